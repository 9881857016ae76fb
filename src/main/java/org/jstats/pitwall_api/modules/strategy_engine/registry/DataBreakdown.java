package org.jstats.pitwall_api.modules.strategy_engine.registry;

import java.io.Serial;
import java.io.Serializable;

/**
 * Literal example counts per source and each source's share of the total fit weight.
 */
public record DataBreakdown(int real, int synthetic, double realInfluence, double syntheticInfluence)
        implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    public int total() {
        return real + synthetic;
    }
}
