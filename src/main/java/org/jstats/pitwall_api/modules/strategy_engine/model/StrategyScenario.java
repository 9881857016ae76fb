package org.jstats.pitwall_api.modules.strategy_engine.model;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A pre-configured race plan.
 *
 * @param targetPitLaps planned stop laps; empty when the plan is triggered by the race situation
 * @param trigger race situation that starts the plan, if any
 */
public record StrategyScenario(
        String id,
        String name,
        String description,
        List<String> tireSequence,
        List<Integer> targetPitLaps,
        @Nullable String trigger,
        String riskLevel
) {

    public StrategyScenario {
        tireSequence = List.copyOf(tireSequence);
        targetPitLaps = List.copyOf(targetPitLaps);
    }
}
