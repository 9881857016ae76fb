package org.jstats.pitwall_api.modules.strategy_engine.exception;

/**
 * Raised when a model name matches none of the strategy domains.
 */
public class ModelNotFoundException extends RuntimeException {

    public ModelNotFoundException(String modelName) {
        super("Unknown model '%s'. Valid options: tire_strategy, pit_stop, race_pace, position".formatted(modelName));
    }
}
