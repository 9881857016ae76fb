package org.jstats.pitwall_api.modules.strategy_engine.domain;

/**
 * Provenance of a training example.
 */
public enum SampleSource {
    REAL,
    SYNTHETIC
}
