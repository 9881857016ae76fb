package org.jstats.pitwall_api.modules.strategy_engine.model;

import org.jspecify.annotations.Nullable;
import org.jstats.pitwall_api.modules.strategy_engine.registry.TrainingMetrics;

import java.time.Instant;
import java.util.List;

/**
 * @param outputs learned targets of the domain
 */
public record ModelInfo(
        String name,
        String description,
        String status,
        boolean ready,
        List<String> features,
        List<String> outputs,
        @Nullable Instant trainedAt,
        @Nullable TrainingMetrics metrics
) {}
