package org.jstats.pitwall_api.modules.strategy_engine.model;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * Training options. Null weights fall back to the configured defaults.
 *
 * @param hybridMode  false trains on synthetic examples only
 * @param sessionKeys telemetry sessions to extract real examples from; null entries are ignored
 */
public record TrainingRequest(
        Boolean hybridMode,
        @Nullable Double realDataWeight,
        @Nullable Double syntheticDataWeight,
        List<Integer> sessionKeys
) {

    public TrainingRequest {
        hybridMode = hybridMode == null || hybridMode;
        sessionKeys = sessionKeys == null ? List.of() : sessionKeys.stream().filter(Objects::nonNull).toList();
    }

    public static TrainingRequest defaults() {
        return new TrainingRequest(true, null, null, List.of());
    }
}
