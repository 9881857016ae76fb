package org.jstats.pitwall_api.modules.strategy_engine.model;

import org.jstats.pitwall_api.modules.strategy_engine.registry.TrainingMetrics;

import java.time.Instant;

public record TrainingResult(
        String modelName,
        TrainingMetrics metrics,
        int realSamples,
        int syntheticSamples,
        double realDataWeight,
        double syntheticDataWeight,
        Instant trainedAt
) {}
