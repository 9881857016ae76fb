package org.jstats.pitwall_api.modules.strategy_engine.model;

import java.util.List;
import java.util.Map;

/**
 * @param compoundProbabilities one entry per compound, summing to 1
 * @param expectedTimeLossPerLapMs degradation expressed in milliseconds per lap
 */
public record TireStrategyResponse(
        String recommendedCompound,
        double compoundConfidence,
        Map<String, Double> compoundProbabilities,
        int predictedStintLength,
        double degradationRatePerLap,
        double expectedTimeLossPerLapMs,
        List<String> strategyNotes
) {}
