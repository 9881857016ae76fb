package org.jstats.pitwall_api.modules.strategy_engine.domain;

import java.util.Map;

/**
 * One labeled row. Re-weighting returns a copy.
 *
 * @param features   raw feature values keyed by schema name
 * @param labels     targets for the domain the example was built for
 * @param source     real observation or rule-derived
 * @param weight     blend weight of the example's source
 * @param confidence 1.0 for real rows, the configured synthetic confidence otherwise
 */
public record TrainingExample(
        Map<String, Double> features,
        LabelSet labels,
        SampleSource source,
        double weight,
        double confidence
) {

    public TrainingExample {
        features = Map.copyOf(features);
    }

    public static TrainingExample real(Map<String, Double> features, LabelSet labels) {
        return new TrainingExample(features, labels, SampleSource.REAL, 1.0, 1.0);
    }

    public static TrainingExample synthetic(Map<String, Double> features, LabelSet labels, double confidence) {
        return new TrainingExample(features, labels, SampleSource.SYNTHETIC, 1.0, confidence);
    }

    public TrainingExample withWeight(double newWeight) {
        return new TrainingExample(features, labels, source, newWeight, confidence);
    }

    public boolean isReal() {
        return source == SampleSource.REAL;
    }
}
