package org.jstats.pitwall_api.modules.strategy_engine.model;

import java.util.List;

public record RacePaceResponse(
        double predictedLapTime,
        double fuelEffectPerKg,
        double paceTrendPerLap,
        double currentDeltaToOptimal,
        List<LapPrediction> lapPredictions,
        PerformanceAssessment performanceAssessment,
        List<String> recommendations
) {

    public record LapPrediction(
            int lap,
            double predictedTime,
            double fuelLoad,
            int tireAge,
            double deltaToBest
    ) {}

    /**
     * @param trend {@code improving} or {@code degrading}
     */
    public record PerformanceAssessment(
            String level,
            String color,
            double deltaToBest,
            double deltaToAverage,
            String trend
    ) {}
}
