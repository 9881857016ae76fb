package org.jstats.pitwall_api.modules.strategy_engine.registry;

public enum ModelState {
    NOT_LOADED,
    TRAINING,
    READY,
    ERROR
}
