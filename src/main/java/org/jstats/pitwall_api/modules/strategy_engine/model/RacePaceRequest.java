package org.jstats.pitwall_api.modules.strategy_engine.model;

import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Objects.requireNonNullElse;

/**
 * Race pace inputs. Omitted fields take the documented defaults.
 */
public record RacePaceRequest(
        Integer lapNumber,
        Double fuelLoad,
        Integer tireAge,
        Integer tireCompoundIdx,
        Double trackTemperature,
        Double airTemperature,
        Double trackEvolution,
        Integer traffic,
        Integer drsEnabled,
        Double sector1Time,
        Double sector2Time,
        Double previousLapTime,
        Double bestLapTime,
        Double avgLapTime,
        Integer position,
        Double windSpeed,
        Double humidity,
        Integer safetyCarLaps,
        Double pushLevel,
        Double batteryDeployment
) {

    public RacePaceRequest {
        lapNumber = requireNonNullElse(lapNumber, 1);
        fuelLoad = requireNonNullElse(fuelLoad, 100.0);
        tireAge = requireNonNullElse(tireAge, 0);
        tireCompoundIdx = requireNonNullElse(tireCompoundIdx, 1);
        trackTemperature = requireNonNullElse(trackTemperature, 30.0);
        airTemperature = requireNonNullElse(airTemperature, 25.0);
        trackEvolution = requireNonNullElse(trackEvolution, 50.0);
        traffic = requireNonNullElse(traffic, 0);
        drsEnabled = requireNonNullElse(drsEnabled, 1);
        sector1Time = requireNonNullElse(sector1Time, 30.0);
        sector2Time = requireNonNullElse(sector2Time, 35.0);
        previousLapTime = requireNonNullElse(previousLapTime, 90.0);
        bestLapTime = requireNonNullElse(bestLapTime, 88.0);
        avgLapTime = requireNonNullElse(avgLapTime, 89.0);
        position = requireNonNullElse(position, 10);
        windSpeed = requireNonNullElse(windSpeed, 10.0);
        humidity = requireNonNullElse(humidity, 50.0);
        safetyCarLaps = requireNonNullElse(safetyCarLaps, 0);
        pushLevel = requireNonNullElse(pushLevel, 80.0);
        batteryDeployment = requireNonNullElse(batteryDeployment, 50.0);
    }

    public static RacePaceRequest defaults() {
        return new RacePaceRequest(null, null, null, null, null, null, null, null, null, null,
                null, null, null, null, null, null, null, null, null, null);
    }

    /**
     * Same conditions projected onto a later lap.
     */
    public RacePaceRequest atLap(int lap, double fuel, int age) {
        return new RacePaceRequest(lap, fuel, age, tireCompoundIdx, trackTemperature, airTemperature,
                trackEvolution, traffic, drsEnabled, sector1Time, sector2Time, previousLapTime, bestLapTime,
                avgLapTime, position, windSpeed, humidity, safetyCarLaps, pushLevel, batteryDeployment);
    }

    public Map<String, Double> toFeatures() {
        Map<String, Double> f = new LinkedHashMap<>();
        f.put("lap_number", lapNumber.doubleValue());
        f.put("fuel_load", fuelLoad);
        f.put("tire_age", tireAge.doubleValue());
        f.put("tire_compound_idx", tireCompoundIdx.doubleValue());
        f.put("track_temperature", trackTemperature);
        f.put("air_temperature", airTemperature);
        f.put("track_evolution", trackEvolution);
        f.put("traffic", traffic.doubleValue());
        f.put("drs_enabled", drsEnabled.doubleValue());
        f.put("sector1_time", sector1Time);
        f.put("sector2_time", sector2Time);
        f.put("previous_lap_time", previousLapTime);
        f.put("best_lap_time", bestLapTime);
        f.put("avg_lap_time", avgLapTime);
        f.put("position", position.doubleValue());
        f.put("wind_speed", windSpeed);
        f.put("humidity", humidity);
        f.put("safety_car_laps", safetyCarLaps.doubleValue());
        f.put("push_level", pushLevel);
        f.put("battery_deployment", batteryDeployment);
        return f;
    }
}
