package org.jstats.pitwall_api.modules.strategy_engine.exception;

/**
 * Raised when a prediction targets a domain without a servable artifact.
 */
public class ModelNotReadyException extends RuntimeException {

    private final String modelName;

    public ModelNotReadyException(String modelName) {
        super("Model %s is not trained or loaded".formatted(modelName));
        this.modelName = modelName;
    }

    public String getModelName() {
        return modelName;
    }
}
