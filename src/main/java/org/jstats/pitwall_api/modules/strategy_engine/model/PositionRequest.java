package org.jstats.pitwall_api.modules.strategy_engine.model;

import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Objects.requireNonNullElse;

/**
 * Position battle inputs. Omitted fields take the documented defaults.
 */
public record PositionRequest(
        Integer currentPosition,
        Integer lapNumber,
        Integer remainingLaps,
        Double gapToCarAhead,
        Double gapToCarBehind,
        Double relativePace,
        Integer tireAdvantage,
        Integer compoundAdvantage,
        Integer drsAvailable,
        Double batteryLevel,
        Double straightLength,
        Double overtakingDifficulty,
        Double trackPositionValue,
        Double driverAggression,
        Double carPerformanceDelta,
        Double weatherStability,
        Double safetyCarProbability,
        Integer lapsSincePit,
        Integer competitorLapsSincePit,
        Integer pointsPosition
) {

    public PositionRequest {
        currentPosition = requireNonNullElse(currentPosition, 10);
        lapNumber = requireNonNullElse(lapNumber, 1);
        remainingLaps = requireNonNullElse(remainingLaps, 50);
        gapToCarAhead = requireNonNullElse(gapToCarAhead, 2.0);
        gapToCarBehind = requireNonNullElse(gapToCarBehind, 2.0);
        relativePace = requireNonNullElse(relativePace, 0.0);
        tireAdvantage = requireNonNullElse(tireAdvantage, 0);
        compoundAdvantage = requireNonNullElse(compoundAdvantage, 0);
        drsAvailable = requireNonNullElse(drsAvailable, 1);
        batteryLevel = requireNonNullElse(batteryLevel, 80.0);
        straightLength = requireNonNullElse(straightLength, 1000.0);
        overtakingDifficulty = requireNonNullElse(overtakingDifficulty, 50.0);
        trackPositionValue = requireNonNullElse(trackPositionValue, 50.0);
        driverAggression = requireNonNullElse(driverAggression, 50.0);
        carPerformanceDelta = requireNonNullElse(carPerformanceDelta, 0.0);
        weatherStability = requireNonNullElse(weatherStability, 100.0);
        safetyCarProbability = requireNonNullElse(safetyCarProbability, 10.0);
        lapsSincePit = requireNonNullElse(lapsSincePit, 5);
        competitorLapsSincePit = requireNonNullElse(competitorLapsSincePit, 5);
        pointsPosition = requireNonNullElse(pointsPosition, 10);
    }

    public static PositionRequest defaults() {
        return new PositionRequest(null, null, null, null, null, null, null, null, null, null,
                null, null, null, null, null, null, null, null, null, null);
    }

    public Map<String, Double> toFeatures() {
        Map<String, Double> f = new LinkedHashMap<>();
        f.put("current_position", currentPosition.doubleValue());
        f.put("lap_number", lapNumber.doubleValue());
        f.put("remaining_laps", remainingLaps.doubleValue());
        f.put("gap_to_car_ahead", gapToCarAhead);
        f.put("gap_to_car_behind", gapToCarBehind);
        f.put("relative_pace", relativePace);
        f.put("tire_advantage", tireAdvantage.doubleValue());
        f.put("compound_advantage", compoundAdvantage.doubleValue());
        f.put("drs_available", drsAvailable.doubleValue());
        f.put("battery_level", batteryLevel);
        f.put("straight_length", straightLength);
        f.put("overtaking_difficulty", overtakingDifficulty);
        f.put("track_position_value", trackPositionValue);
        f.put("driver_aggression", driverAggression);
        f.put("car_performance_delta", carPerformanceDelta);
        f.put("weather_stability", weatherStability);
        f.put("safety_car_probability", safetyCarProbability);
        f.put("laps_since_pit", lapsSincePit.doubleValue());
        f.put("competitor_laps_since_pit", competitorLapsSincePit.doubleValue());
        f.put("points_position", pointsPosition.doubleValue());
        return f;
    }
}
