package org.jstats.pitwall_api.modules.strategy_engine.registry;

import java.io.Serial;
import java.io.Serializable;
import java.util.Map;

/**
 * Held-out scores keyed {@code <target>_<metric>[_real|_synthetic]}.
 */
public record TrainingMetrics(Map<String, Double> scores, DataBreakdown dataBreakdown) implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    public TrainingMetrics {
        scores = Map.copyOf(scores);
    }
}
