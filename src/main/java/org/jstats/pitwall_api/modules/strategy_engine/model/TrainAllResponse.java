package org.jstats.pitwall_api.modules.strategy_engine.model;

import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Per-domain outcomes of a train-all run, keyed by model name.
 */
public record TrainAllResponse(Map<String, Outcome> results) {

    public record Outcome(boolean success, @Nullable TrainingResult result, @Nullable String error) {

        public static Outcome succeeded(TrainingResult result) {
            return new Outcome(true, result, null);
        }

        public static Outcome failed(String error) {
            return new Outcome(false, null, error);
        }
    }
}
