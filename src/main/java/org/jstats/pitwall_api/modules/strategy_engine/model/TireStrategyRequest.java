package org.jstats.pitwall_api.modules.strategy_engine.model;

import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Objects.requireNonNullElse;

/**
 * Tire strategy inputs. Omitted fields take the documented defaults.
 */
public record TireStrategyRequest(
        Double trackTemperature,
        Double airTemperature,
        Double humidity,
        Double trackLength,
        Integer numberOfCorners,
        Integer highSpeedCorners,
        Integer lowSpeedCorners,
        Integer currentLap,
        Integer totalLaps,
        Integer remainingLaps,
        Integer currentPosition,
        Double gapToLeader,
        Double gapToCarAhead,
        Double gapToCarBehind,
        Double fuelLoad,
        Integer tireAge,
        Double rainProbability,
        Double trackEvolution,
        Boolean safetyCarDeployed,
        Boolean vscDeployed
) {

    public TireStrategyRequest {
        trackTemperature = requireNonNullElse(trackTemperature, 30.0);
        airTemperature = requireNonNullElse(airTemperature, 25.0);
        humidity = requireNonNullElse(humidity, 50.0);
        trackLength = requireNonNullElse(trackLength, 5.0);
        numberOfCorners = requireNonNullElse(numberOfCorners, 15);
        highSpeedCorners = requireNonNullElse(highSpeedCorners, 5);
        lowSpeedCorners = requireNonNullElse(lowSpeedCorners, 10);
        currentLap = requireNonNullElse(currentLap, 1);
        totalLaps = requireNonNullElse(totalLaps, 50);
        remainingLaps = requireNonNullElse(remainingLaps, 50);
        currentPosition = requireNonNullElse(currentPosition, 10);
        gapToLeader = requireNonNullElse(gapToLeader, 0.0);
        gapToCarAhead = requireNonNullElse(gapToCarAhead, 0.0);
        gapToCarBehind = requireNonNullElse(gapToCarBehind, 0.0);
        fuelLoad = requireNonNullElse(fuelLoad, 100.0);
        tireAge = requireNonNullElse(tireAge, 0);
        rainProbability = requireNonNullElse(rainProbability, 0.0);
        trackEvolution = requireNonNullElse(trackEvolution, 50.0);
        safetyCarDeployed = requireNonNullElse(safetyCarDeployed, false);
        vscDeployed = requireNonNullElse(vscDeployed, false);
    }

    public static TireStrategyRequest defaults() {
        return new TireStrategyRequest(null, null, null, null, null, null, null, null, null, null,
                null, null, null, null, null, null, null, null, null, null);
    }

    public Map<String, Double> toFeatures() {
        Map<String, Double> f = new LinkedHashMap<>();
        f.put("track_temperature", trackTemperature);
        f.put("air_temperature", airTemperature);
        f.put("humidity", humidity);
        f.put("track_length", trackLength);
        f.put("number_of_corners", numberOfCorners.doubleValue());
        f.put("high_speed_corners", highSpeedCorners.doubleValue());
        f.put("low_speed_corners", lowSpeedCorners.doubleValue());
        f.put("current_lap", currentLap.doubleValue());
        f.put("total_laps", totalLaps.doubleValue());
        f.put("remaining_laps", remainingLaps.doubleValue());
        f.put("current_position", currentPosition.doubleValue());
        f.put("gap_to_leader", gapToLeader);
        f.put("gap_to_car_ahead", gapToCarAhead);
        f.put("gap_to_car_behind", gapToCarBehind);
        f.put("fuel_load", fuelLoad);
        f.put("tire_age", tireAge.doubleValue());
        f.put("rain_probability", rainProbability);
        f.put("track_evolution", trackEvolution);
        f.put("safety_car", safetyCarDeployed ? 1.0 : 0.0);
        f.put("vsc", vscDeployed ? 1.0 : 0.0);
        return f;
    }
}
