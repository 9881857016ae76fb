package org.jstats.pitwall_api.modules.strategy_engine.model;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A section is null when its domain has no servable model.
 */
public record FullAnalysisResponse(
        @Nullable TireStrategyResponse tireStrategy,
        @Nullable PitStopResponse pitStop,
        @Nullable RacePaceResponse racePace,
        @Nullable PositionResponse position,
        ExecutiveSummary executiveSummary
) {

    public record ExecutiveSummary(
            List<String> criticalActions,
            List<String> recommendations,
            List<String> riskFactors
    ) {}
}
