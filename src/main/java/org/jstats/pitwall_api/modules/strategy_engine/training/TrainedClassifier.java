package org.jstats.pitwall_api.modules.strategy_engine.training;

import java.io.Serializable;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Fitted model for one categorical target.
 */
public interface TrainedClassifier extends Serializable {

    String target();

    /**
     * Class probabilities keyed by label. Every class in {@code classes} is present (0 when the model
     * never saw it) and the values sum to 1.
     */
    Map<String, Double> probabilities(double[] features, Collection<String> classes);

    String predict(double[] features);

    default double probabilityOf(double[] features, String cls) {
        return probabilities(features, List.of(cls)).getOrDefault(cls, 0.0);
    }
}
