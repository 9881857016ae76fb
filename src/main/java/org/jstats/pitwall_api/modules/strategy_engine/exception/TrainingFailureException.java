package org.jstats.pitwall_api.modules.strategy_engine.exception;

/**
 * Raised when fitting a domain's models fails. The previously registered artifact, if any, stays servable.
 */
public class TrainingFailureException extends RuntimeException {

    private final String modelName;

    public TrainingFailureException(String modelName, String message) {
        super(message);
        this.modelName = modelName;
    }

    public TrainingFailureException(String modelName, String message, Throwable cause) {
        super(message, cause);
        this.modelName = modelName;
    }

    public String getModelName() {
        return modelName;
    }
}
