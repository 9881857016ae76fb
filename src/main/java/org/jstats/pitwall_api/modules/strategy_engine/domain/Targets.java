package org.jstats.pitwall_api.modules.strategy_engine.domain;

/**
 * Label keys shared by the extractor, the generator, the trainer and the prediction services.
 */
public final class Targets {

    public static final String COMPOUND = "compound";
    public static final String STINT_LENGTH = "stint_length";
    public static final String DEGRADATION_RATE = "degradation_rate";

    public static final String IN_PIT_WINDOW = "in_pit_window";
    public static final String UNDERCUT_OPPORTUNITY = "undercut_opportunity";
    public static final String OPTIMAL_PIT_LAP = "optimal_pit_lap";

    public static final String LAP_TIME = "lap_time";
    public static final String FUEL_EFFECT = "fuel_effect";
    public static final String PACE_TREND = "pace_trend";

    public static final String OVERTAKE_SUCCESS = "overtake_success";
    public static final String POSITION_CHANGE = "position_change";
    public static final String POSITION_DELTA = "position_delta";

    public static final String YES = "true";
    public static final String NO = "false";

    public static final String LOSE = "LOSE";
    public static final String MAINTAIN = "MAINTAIN";
    public static final String GAIN = "GAIN";

    private Targets() {
    }

    public static String flag(boolean value) {
        return value ? YES : NO;
    }
}
