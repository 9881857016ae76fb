package org.jstats.pitwall_api.modules.strategy_engine.model;

import java.util.List;

/**
 * @param pitUrgency 0 (no pressure) to 100 (pit now)
 */
public record PitStopResponse(
        boolean inPitWindow,
        double pitWindowProbability,
        boolean undercutOpportunity,
        double undercutProbability,
        int optimalPitLap,
        int lapsUntilOptimal,
        int pitUrgency,
        String recommendation,
        List<StrategyOption> strategyOptions
) {

    /**
     * One named pit plan.
     *
     * @param risk Low, Medium or High, by distance from the predicted optimal lap
     */
    public record StrategyOption(
            String name,
            int pitLap,
            String compound,
            String expectedGain,
            String risk
    ) {}
}
