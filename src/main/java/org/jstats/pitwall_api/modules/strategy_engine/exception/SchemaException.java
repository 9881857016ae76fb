package org.jstats.pitwall_api.modules.strategy_engine.exception;

/**
 * Raised when a feature or label payload is missing a key the schema requires.
 */
public class SchemaException extends RuntimeException {

    private final String field;

    public SchemaException(String field) {
        super("Missing required field '%s'".formatted(field));
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
