package org.jstats.pitwall_api.modules.strategy_engine.training;

import org.jstats.pitwall_api.modules.strategy_engine.config.StrategyEngineProperties;
import org.jstats.pitwall_api.modules.strategy_engine.domain.Compound;
import org.jstats.pitwall_api.modules.strategy_engine.domain.LabelSet;
import org.jstats.pitwall_api.modules.strategy_engine.domain.StrategyDomain;
import org.jstats.pitwall_api.modules.strategy_engine.domain.TrainingExample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.jstats.pitwall_api.modules.strategy_engine.domain.DomainRules.*;
import static org.jstats.pitwall_api.modules.strategy_engine.domain.Targets.*;

/**
 * Generates rule-labeled examples. Every numeric feature is drawn uniformly inside fixed bounds,
 * so a given seed always yields the same examples.
 */
@Component
public class SyntheticSampleGenerator {

    private static final Logger log = LoggerFactory.getLogger(SyntheticSampleGenerator.class);

    private final StrategyEngineProperties properties;

    public SyntheticSampleGenerator(StrategyEngineProperties properties) {
        this.properties = properties;
    }

    public List<TrainingExample> generate(StrategyDomain domain, int count, SyntheticContext context, long seed) {
        Random rng = new Random(seed);
        double confidence = properties.getBlend().getSyntheticConfidence();
        List<TrainingExample> examples = new ArrayList<>(Math.max(0, count));
        for (int i = 0; i < count; i++) {
            Map<String, Double> features = new LinkedHashMap<>();
            LabelSet labels = switch (domain) {
                case TIRE_STRATEGY -> tireSample(rng, context, features);
                case PIT_STOP -> pitStopSample(rng, context, features);
                case RACE_PACE -> paceSample(rng, context, features);
                case POSITION -> positionSample(rng, features);
            };
            examples.add(TrainingExample.synthetic(features, labels, confidence));
        }
        if (log.isDebugEnabled()) {
            log.debug("Generated {} synthetic {} examples (seed={})", examples.size(), domain.modelName(), seed);
        }
        return examples;
    }

    // ---------- tire strategy ----------
    private LabelSet tireSample(Random rng, SyntheticContext context, Map<String, Double> f) {
        SyntheticContext.Range track = context.trackTemperatureOr(20, 50);
        SyntheticContext.Range air = context.airTemperatureOr(15, 40);
        SyntheticContext.Range humidity = context.humidityOr(20, 90);

        double trackTemp = uniform(rng, track.min(), track.max());
        int highSpeed = between(rng, 2, 9);
        int currentLap = between(rng, 1, 49);
        int totalLaps = between(rng, 50, 69);
        int remaining = totalLaps - currentLap;
        int position = between(rng, 1, 19);
        double rain = uniform(rng, 0, 100);

        f.put("track_temperature", trackTemp);
        f.put("air_temperature", uniform(rng, air.min(), air.max()));
        f.put("humidity", uniform(rng, humidity.min(), humidity.max()));
        f.put("track_length", uniform(rng, 3.0, 7.0));
        f.put("number_of_corners", (double) between(rng, 10, 24));
        f.put("high_speed_corners", (double) highSpeed);
        f.put("low_speed_corners", (double) between(rng, 5, 14));
        f.put("current_lap", (double) currentLap);
        f.put("total_laps", (double) totalLaps);
        f.put("remaining_laps", (double) remaining);
        f.put("current_position", (double) position);
        f.put("gap_to_leader", uniform(rng, 0, 60));
        f.put("gap_to_car_ahead", uniform(rng, 0, 10));
        f.put("gap_to_car_behind", uniform(rng, 0, 10));
        f.put("fuel_load", uniform(rng, 10, 110));
        f.put("tire_age", (double) between(rng, 0, 29));
        f.put("rain_probability", rain);
        f.put("track_evolution", uniform(rng, 0, 100));
        f.put("safety_car", chance(rng, 0.10));
        f.put("vsc", chance(rng, 0.05));

        Compound compound = compoundFor(rng, rain, trackTemp, remaining, position);
        double stint = STINT_BASE.get(compound) + between(rng, -5, 5)
                - 0.2 * (trackTemp - 30) - 0.5 * highSpeed;
        double degradation = BASE_DEGRADATION + 0.002 * (trackTemp - 30) + 0.003 * highSpeed
                + uniform(rng, -0.01, 0.01);

        return LabelSet.builder()
                .label(COMPOUND, compound.name())
                .value(STINT_LENGTH, clamp(stint, 5, 50))
                .value(DEGRADATION_RATE, clamp(degradation, MIN_DEGRADATION, MAX_DEGRADATION))
                .build();
    }

    static Compound compoundFor(Random rng, double rain, double trackTemp, int remaining, int position) {
        if (rain > WET_CROSSOVER) {
            return Compound.WET;
        }
        if (rain > RAIN_CROSSOVER) {
            return Compound.INTERMEDIATE;
        }
        if (trackTemp > HOT_TRACK) {
            return remaining > HOT_TRACK_MEDIUM_REMAINING ? Compound.HARD : Compound.MEDIUM;
        }
        if (trackTemp < COLD_TRACK) {
            return Compound.SOFT;
        }
        if (remaining < SHORT_STINT_REMAINING) {
            return Compound.SOFT;
        }
        double roll = rng.nextDouble();
        if (position <= 3) {
            return roll > 0.3 ? Compound.MEDIUM : Compound.HARD;
        }
        if (position >= 15) {
            return roll > 0.5 ? Compound.SOFT : Compound.MEDIUM;
        }
        if (roll < 0.3) {
            return Compound.SOFT;
        }
        return roll < 0.8 ? Compound.MEDIUM : Compound.HARD;
    }

    // ---------- pit stop ----------
    private LabelSet pitStopSample(Random rng, SyntheticContext context, Map<String, Double> f) {
        SyntheticContext.Range track = context.trackTemperatureOr(20, 50);

        int totalLaps = between(rng, 50, 69);
        int currentLap = between(rng, 1, totalLaps - 1);
        int remaining = totalLaps - currentLap;
        int tireAge = between(rng, 0, 34);
        int compoundIdx = between(rng, 0, 2);
        double gapAhead = uniform(rng, 0, 8);
        double pitDelta = uniform(rng, 18, 26);
        int competitorAge = between(rng, 0, 34);

        f.put("current_lap", (double) currentLap);
        f.put("total_laps", (double) totalLaps);
        f.put("remaining_laps", (double) remaining);
        f.put("tire_age", (double) tireAge);
        f.put("tire_compound_idx", (double) compoundIdx);
        f.put("current_position", (double) between(rng, 1, 19));
        f.put("gap_to_car_ahead", gapAhead);
        f.put("gap_to_car_behind", uniform(rng, 0, 8));
        f.put("pit_delta", pitDelta);
        f.put("track_position_value", uniform(rng, 30, 80));
        f.put("tire_degradation_rate", uniform(rng, 0.02, 0.12));
        f.put("current_pace_delta", uniform(rng, -1.0, 1.0));
        f.put("competitor_tire_age", (double) competitorAge);
        f.put("competitor_compound_idx", (double) between(rng, 0, 2));
        f.put("fuel_adjusted_pace", uniform(rng, -0.6, 0.6));
        f.put("traffic_density", (double) between(rng, 0, 14));
        f.put("safety_car_probability", uniform(rng, 0, 30));
        f.put("drs_available", chance(rng, 0.7));
        f.put("track_temperature", uniform(rng, track.min(), track.max()));
        f.put("rain_probability", uniform(rng, 0, 100));

        boolean inWindow = tireAge >= WINDOW_MIN_TIRE_AGE && tireAge <= WINDOW_MAX_TIRE_AGE
                && remaining > WINDOW_MIN_REMAINING;
        boolean undercut = inWindow && gapAhead < UNDERCUT_GAP_FRACTION * pitDelta && tireAge > competitorAge;
        int optimalLap = currentLap + PIT_STINT_BY_COMPOUND_IDX[compoundIdx] - tireAge + between(rng, -3, 3);

        return LabelSet.builder()
                .label(IN_PIT_WINDOW, flag(inWindow))
                .label(UNDERCUT_OPPORTUNITY, flag(undercut))
                .value(OPTIMAL_PIT_LAP, Math.max(currentLap, optimalLap))
                .build();
    }

    // ---------- race pace ----------
    private LabelSet paceSample(Random rng, SyntheticContext context, Map<String, Double> f) {
        SyntheticContext.Range track = context.trackTemperatureOr(20, 50);
        SyntheticContext.Range air = context.airTemperatureOr(15, 40);
        SyntheticContext.Range humidity = context.humidityOr(20, 90);

        double fuel = uniform(rng, MIN_FUEL, START_FUEL);
        int tireAge = between(rng, 0, 34);
        int compoundIdx = between(rng, 0, 2);
        double trackTemp = uniform(rng, track.min(), track.max());
        int traffic = between(rng, 0, 4);

        f.put("lap_number", (double) between(rng, 1, 59));
        f.put("fuel_load", fuel);
        f.put("tire_age", (double) tireAge);
        f.put("tire_compound_idx", (double) compoundIdx);
        f.put("track_temperature", trackTemp);
        f.put("air_temperature", uniform(rng, air.min(), air.max()));
        f.put("track_evolution", uniform(rng, 0, 100));
        f.put("traffic", (double) traffic);
        f.put("drs_enabled", chance(rng, 0.7));
        f.put("sector1_time", uniform(rng, 25, 35));
        f.put("sector2_time", uniform(rng, 30, 40));
        f.put("previous_lap_time", uniform(rng, 85, 95));
        f.put("best_lap_time", uniform(rng, 84, 88));
        f.put("avg_lap_time", uniform(rng, 86, 92));
        f.put("position", (double) between(rng, 1, 19));
        f.put("wind_speed", uniform(rng, 0, 30));
        f.put("humidity", uniform(rng, humidity.min(), humidity.max()));
        f.put("safety_car_laps", (double) between(rng, 0, 9));
        f.put("push_level", uniform(rng, 50, 100));
        f.put("battery_deployment", uniform(rng, 30, 100));

        double lapTime = BASE_LAP_TIME + COMPOUND_PACE_OFFSET[compoundIdx] + FUEL_EFFECT_PER_KG * fuel
                + 0.04 * tireAge + 0.3 * traffic + 0.02 * (trackTemp - 30) + uniform(rng, -0.3, 0.3);

        return LabelSet.builder()
                .value(LAP_TIME, lapTime)
                .value(FUEL_EFFECT, FUEL_EFFECT_PER_KG + uniform(rng, -0.003, 0.003))
                .value(PACE_TREND, 0.03 * tireAge + uniform(rng, -0.05, 0.05))
                .build();
    }

    // ---------- position ----------
    private LabelSet positionSample(Random rng, Map<String, Double> f) {
        int remaining = between(rng, 1, 54);
        double gapAhead = uniform(rng, 0, 6);
        double gapBehind = uniform(rng, 0, 6);
        double relativePace = uniform(rng, -1.0, 1.0);
        double drs = chance(rng, 0.7);
        double difficulty = uniform(rng, 20, 90);

        f.put("current_position", (double) between(rng, 1, 19));
        f.put("lap_number", (double) between(rng, 1, 59));
        f.put("remaining_laps", (double) remaining);
        f.put("gap_to_car_ahead", gapAhead);
        f.put("gap_to_car_behind", gapBehind);
        f.put("relative_pace", relativePace);
        f.put("tire_advantage", (double) between(rng, -15, 15));
        f.put("compound_advantage", (double) between(rng, -1, 1));
        f.put("drs_available", drs);
        f.put("battery_level", uniform(rng, 30, 100));
        f.put("straight_length", uniform(rng, 500, 1500));
        f.put("overtaking_difficulty", difficulty);
        f.put("track_position_value", uniform(rng, 30, 80));
        f.put("driver_aggression", uniform(rng, 30, 90));
        f.put("car_performance_delta", uniform(rng, -0.6, 0.6));
        f.put("weather_stability", uniform(rng, 50, 100));
        f.put("safety_car_probability", uniform(rng, 0, 30));
        f.put("laps_since_pit", (double) between(rng, 0, 29));
        f.put("competitor_laps_since_pit", (double) between(rng, 0, 29));
        f.put("points_position", (double) between(rng, 1, 19));

        boolean overtake = gapAhead < 1.0 && relativePace < -0.2 && drs == 1.0 && difficulty < 70;
        String change;
        double delta;
        if (overtake) {
            change = GAIN;
            delta = -Math.min(remaining / 5.0, 3);
        } else if (gapBehind < 0.5 && relativePace > 0.3) {
            change = LOSE;
            delta = Math.min(remaining / 5.0, 2);
        } else {
            change = MAINTAIN;
            delta = 0;
        }

        return LabelSet.builder()
                .label(OVERTAKE_SUCCESS, flag(overtake))
                .label(POSITION_CHANGE, change)
                .value(POSITION_DELTA, delta)
                .build();
    }

    private static double uniform(Random rng, double min, double max) {
        return min + rng.nextDouble() * (max - min);
    }

    private static int between(Random rng, int min, int maxInclusive) {
        return min + rng.nextInt(maxInclusive - min + 1);
    }

    private static double chance(Random rng, double probability) {
        return rng.nextDouble() < probability ? 1.0 : 0.0;
    }
}
