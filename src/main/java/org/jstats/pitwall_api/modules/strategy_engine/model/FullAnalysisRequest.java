package org.jstats.pitwall_api.modules.strategy_engine.model;

import static java.util.Objects.requireNonNullElseGet;

/**
 * Inputs for all four domains; an omitted section uses that domain's defaults.
 */
public record FullAnalysisRequest(
        TireStrategyRequest tireData,
        PitStopRequest pitData,
        RacePaceRequest paceData,
        PositionRequest positionData
) {

    public FullAnalysisRequest {
        tireData = requireNonNullElseGet(tireData, TireStrategyRequest::defaults);
        pitData = requireNonNullElseGet(pitData, PitStopRequest::defaults);
        paceData = requireNonNullElseGet(paceData, RacePaceRequest::defaults);
        positionData = requireNonNullElseGet(positionData, PositionRequest::defaults);
    }
}
