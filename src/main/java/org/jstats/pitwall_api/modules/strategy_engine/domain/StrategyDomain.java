package org.jstats.pitwall_api.modules.strategy_engine.domain;

import org.jstats.pitwall_api.modules.strategy_engine.exception.ModelNotFoundException;

import java.util.List;

import static org.jstats.pitwall_api.modules.strategy_engine.domain.Targets.*;

/**
 * The four independently trained prediction domains, each with its feature schema and learned targets.
 */
public enum StrategyDomain {

    TIRE_STRATEGY(
            "tire_strategy",
            "Predicts optimal tire compound and stint length",
            FeatureSchema.of(
                    "track_temperature", "air_temperature", "humidity", "track_length",
                    "number_of_corners", "high_speed_corners", "low_speed_corners", "current_lap",
                    "total_laps", "remaining_laps", "current_position", "gap_to_leader",
                    "gap_to_car_ahead", "gap_to_car_behind", "fuel_load", "tire_age",
                    "rain_probability", "track_evolution", "safety_car", "vsc"),
            List.of(
                    TargetSpec.classifier(COMPOUND),
                    TargetSpec.boosted(STINT_LENGTH),
                    TargetSpec.boosted(DEGRADATION_RATE))),

    PIT_STOP(
            "pit_stop",
            "Predicts pit window, undercut opportunities and optimal pit lap",
            FeatureSchema.of(
                    "current_lap", "total_laps", "remaining_laps", "tire_age",
                    "tire_compound_idx", "current_position", "gap_to_car_ahead", "gap_to_car_behind",
                    "pit_delta", "track_position_value", "tire_degradation_rate", "current_pace_delta",
                    "competitor_tire_age", "competitor_compound_idx", "fuel_adjusted_pace", "traffic_density",
                    "safety_car_probability", "drs_available", "track_temperature", "rain_probability"),
            List.of(
                    TargetSpec.classifier(IN_PIT_WINDOW),
                    TargetSpec.classifier(UNDERCUT_OPPORTUNITY),
                    TargetSpec.boosted(OPTIMAL_PIT_LAP))),

    RACE_PACE(
            "race_pace",
            "Predicts lap times, fuel effect and pace trend",
            FeatureSchema.of(
                    "lap_number", "fuel_load", "tire_age", "tire_compound_idx",
                    "track_temperature", "air_temperature", "track_evolution", "traffic",
                    "drs_enabled", "sector1_time", "sector2_time", "previous_lap_time",
                    "best_lap_time", "avg_lap_time", "position", "wind_speed",
                    "humidity", "safety_car_laps", "push_level", "battery_deployment"),
            List.of(
                    TargetSpec.boosted(LAP_TIME),
                    TargetSpec.forest(FUEL_EFFECT),
                    TargetSpec.boosted(PACE_TREND))),

    POSITION(
            "position",
            "Predicts overtakes and position changes",
            FeatureSchema.of(
                    "current_position", "lap_number", "remaining_laps", "gap_to_car_ahead",
                    "gap_to_car_behind", "relative_pace", "tire_advantage", "compound_advantage",
                    "drs_available", "battery_level", "straight_length", "overtaking_difficulty",
                    "track_position_value", "driver_aggression", "car_performance_delta", "weather_stability",
                    "safety_car_probability", "laps_since_pit", "competitor_laps_since_pit", "points_position"),
            List.of(
                    TargetSpec.classifier(OVERTAKE_SUCCESS),
                    TargetSpec.classifier(POSITION_CHANGE),
                    TargetSpec.boosted(POSITION_DELTA)));

    private final String modelName;
    private final String description;
    private final FeatureSchema schema;
    private final List<TargetSpec> targets;

    StrategyDomain(String modelName, String description, FeatureSchema schema, List<TargetSpec> targets) {
        this.modelName = modelName;
        this.description = description;
        this.schema = schema;
        this.targets = targets;
    }

    public String modelName() {
        return modelName;
    }

    public String description() {
        return description;
    }

    public FeatureSchema schema() {
        return schema;
    }

    public List<TargetSpec> targets() {
        return targets;
    }

    public static StrategyDomain fromName(String name) {
        for (StrategyDomain domain : values()) {
            if (domain.modelName.equals(name)) {
                return domain;
            }
        }
        throw new ModelNotFoundException(name);
    }
}
