package org.jstats.pitwall_api.modules.strategy_engine.exception;

/**
 * Raised for invalid engine configuration, e.g. negative blend weights.
 */
public class ConfigException extends RuntimeException {

    public ConfigException(String message) {
        super(message);
    }
}
