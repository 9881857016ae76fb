package org.jstats.pitwall_api.modules.strategy_engine.domain;

import java.util.Map;

/**
 * Strategy constants shared by the synthetic rule tables and the real-data extractor.
 */
public final class DomainRules {

    // tire compound
    public static final double WET_CROSSOVER = 85;
    public static final double RAIN_CROSSOVER = 70;
    public static final double HOT_TRACK = 40;
    public static final double COLD_TRACK = 25;
    public static final int SHORT_STINT_REMAINING = 15;
    public static final int HOT_TRACK_MEDIUM_REMAINING = 20;

    public static final Map<Compound, Integer> STINT_BASE = Map.of(
            Compound.SOFT, 12,
            Compound.MEDIUM, 25,
            Compound.HARD, 35,
            Compound.INTERMEDIATE, 20,
            Compound.WET, 15);

    public static final double MIN_DEGRADATION = 0.01;
    public static final double MAX_DEGRADATION = 0.15;
    public static final double BASE_DEGRADATION = 0.05;

    // pit stop
    public static final int WINDOW_MIN_TIRE_AGE = 15;
    public static final int WINDOW_MAX_TIRE_AGE = 30;
    public static final int WINDOW_MIN_REMAINING = 10;
    public static final double UNDERCUT_GAP_FRACTION = 0.15;
    public static final double PIT_DELTA = 22.0;
    public static final int[] PIT_STINT_BY_COMPOUND_IDX = {15, 25, 35};

    // pace
    public static final double BASE_LAP_TIME = 88.0;
    public static final double FUEL_EFFECT_PER_KG = 0.03;
    public static final double FUEL_BURN_PER_LAP = 1.8;
    public static final double START_FUEL = 110.0;
    public static final double MIN_FUEL = 5.0;
    public static final double[] COMPOUND_PACE_OFFSET = {-0.3, 0.0, 0.4};

    private DomainRules() {
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    public static double fuelLoadAtLap(int lap) {
        return Math.max(MIN_FUEL, START_FUEL - FUEL_BURN_PER_LAP * lap);
    }

    public static double trackEvolutionAtLap(int lap) {
        return Math.min(100, 2.0 * lap);
    }
}
