package org.jstats.pitwall_api.modules.strategy_engine.training;

import org.jstats.pitwall_api.modules.strategy_engine.exception.ConfigException;

/**
 * Normalized real/synthetic split; the two weights always sum to 1.0.
 */
public record BlendWeights(double real, double synthetic) {

    public static final BlendWeights SYNTHETIC_ONLY = new BlendWeights(0.0, 1.0);
    public static final BlendWeights REAL_ONLY = new BlendWeights(1.0, 0.0);

    /**
     * Validates and normalizes a raw weight pair.
     *
     * @throws ConfigException for negative or non-finite weights, or when both are zero
     */
    public static BlendWeights of(double real, double synthetic) {
        if (!Double.isFinite(real) || !Double.isFinite(synthetic)) {
            throw new ConfigException("Blend weights must be finite numbers");
        }
        if (real < 0 || synthetic < 0) {
            throw new ConfigException("Blend weights must not be negative (real=%s, synthetic=%s)".formatted(real, synthetic));
        }
        double sum = real + synthetic;
        if (sum == 0) {
            throw new ConfigException("At least one blend weight must be positive");
        }
        return new BlendWeights(real / sum, synthetic / sum);
    }
}
