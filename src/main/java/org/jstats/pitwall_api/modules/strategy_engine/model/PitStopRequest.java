package org.jstats.pitwall_api.modules.strategy_engine.model;

import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Objects.requireNonNullElse;

/**
 * Pit-stop inputs. Omitted fields take the documented defaults.
 */
public record PitStopRequest(
        Integer currentLap,
        Integer totalLaps,
        Integer remainingLaps,
        Integer tireAge,
        Integer tireCompoundIdx,
        Integer currentPosition,
        Double gapToCarAhead,
        Double gapToCarBehind,
        Double pitDelta,
        Double trackPositionValue,
        Double tireDegradationRate,
        Double currentPaceDelta,
        Integer competitorTireAge,
        Integer competitorCompoundIdx,
        Double fuelAdjustedPace,
        Integer trafficDensity,
        Double safetyCarProbability,
        Integer drsAvailable,
        Double trackTemperature,
        Double rainProbability,
        Boolean safetyCarDeployed
) {

    public PitStopRequest {
        currentLap = requireNonNullElse(currentLap, 1);
        totalLaps = requireNonNullElse(totalLaps, 50);
        remainingLaps = requireNonNullElse(remainingLaps, 50);
        tireAge = requireNonNullElse(tireAge, 0);
        tireCompoundIdx = requireNonNullElse(tireCompoundIdx, 1);
        currentPosition = requireNonNullElse(currentPosition, 10);
        gapToCarAhead = requireNonNullElse(gapToCarAhead, 2.0);
        gapToCarBehind = requireNonNullElse(gapToCarBehind, 2.0);
        pitDelta = requireNonNullElse(pitDelta, 22.0);
        trackPositionValue = requireNonNullElse(trackPositionValue, 50.0);
        tireDegradationRate = requireNonNullElse(tireDegradationRate, 0.05);
        currentPaceDelta = requireNonNullElse(currentPaceDelta, 0.0);
        competitorTireAge = requireNonNullElse(competitorTireAge, 10);
        competitorCompoundIdx = requireNonNullElse(competitorCompoundIdx, 1);
        fuelAdjustedPace = requireNonNullElse(fuelAdjustedPace, 0.0);
        trafficDensity = requireNonNullElse(trafficDensity, 5);
        safetyCarProbability = requireNonNullElse(safetyCarProbability, 10.0);
        drsAvailable = requireNonNullElse(drsAvailable, 1);
        trackTemperature = requireNonNullElse(trackTemperature, 30.0);
        rainProbability = requireNonNullElse(rainProbability, 0.0);
        safetyCarDeployed = requireNonNullElse(safetyCarDeployed, false);
    }

    public static PitStopRequest defaults() {
        return new PitStopRequest(null, null, null, null, null, null, null, null, null, null,
                null, null, null, null, null, null, null, null, null, null, null);
    }

    public PitStopRequest withTireAge(int age) {
        return new PitStopRequest(currentLap, totalLaps, remainingLaps, age, tireCompoundIdx, currentPosition,
                gapToCarAhead, gapToCarBehind, pitDelta, trackPositionValue, tireDegradationRate, currentPaceDelta,
                competitorTireAge, competitorCompoundIdx, fuelAdjustedPace, trafficDensity, safetyCarProbability,
                drsAvailable, trackTemperature, rainProbability, safetyCarDeployed);
    }

    public Map<String, Double> toFeatures() {
        Map<String, Double> f = new LinkedHashMap<>();
        f.put("current_lap", currentLap.doubleValue());
        f.put("total_laps", totalLaps.doubleValue());
        f.put("remaining_laps", remainingLaps.doubleValue());
        f.put("tire_age", tireAge.doubleValue());
        f.put("tire_compound_idx", tireCompoundIdx.doubleValue());
        f.put("current_position", currentPosition.doubleValue());
        f.put("gap_to_car_ahead", gapToCarAhead);
        f.put("gap_to_car_behind", gapToCarBehind);
        f.put("pit_delta", pitDelta);
        f.put("track_position_value", trackPositionValue);
        f.put("tire_degradation_rate", tireDegradationRate);
        f.put("current_pace_delta", currentPaceDelta);
        f.put("competitor_tire_age", competitorTireAge.doubleValue());
        f.put("competitor_compound_idx", competitorCompoundIdx.doubleValue());
        f.put("fuel_adjusted_pace", fuelAdjustedPace);
        f.put("traffic_density", trafficDensity.doubleValue());
        f.put("safety_car_probability", safetyCarProbability);
        f.put("drs_available", drsAvailable.doubleValue());
        f.put("track_temperature", trackTemperature);
        f.put("rain_probability", rainProbability);
        return f;
    }
}
