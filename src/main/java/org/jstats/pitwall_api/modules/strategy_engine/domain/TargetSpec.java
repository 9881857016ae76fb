package org.jstats.pitwall_api.modules.strategy_engine.domain;

import java.io.Serial;
import java.io.Serializable;

/**
 * One learned output of a strategy domain.
 *
 * @param name      label key inside {@link LabelSet}
 * @param kind      classification or regression
 * @param estimator ensemble family used to fit it
 */
public record TargetSpec(String name, Kind kind, Estimator estimator) implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    public enum Kind { CLASSIFICATION, REGRESSION }

    public enum Estimator { RANDOM_FOREST, GRADIENT_BOOSTING }

    public static TargetSpec classifier(String name) {
        return new TargetSpec(name, Kind.CLASSIFICATION, Estimator.RANDOM_FOREST);
    }

    public static TargetSpec boosted(String name) {
        return new TargetSpec(name, Kind.REGRESSION, Estimator.GRADIENT_BOOSTING);
    }

    public static TargetSpec forest(String name) {
        return new TargetSpec(name, Kind.REGRESSION, Estimator.RANDOM_FOREST);
    }

    public boolean isClassification() {
        return kind == Kind.CLASSIFICATION;
    }
}
