package org.jstats.pitwall_api.modules.strategy_engine.registry;

import org.jstats.pitwall_api.modules.strategy_engine.domain.FeatureSchema;
import org.jstats.pitwall_api.modules.strategy_engine.domain.StrategyDomain;
import org.jstats.pitwall_api.modules.strategy_engine.training.TrainedClassifier;
import org.jstats.pitwall_api.modules.strategy_engine.training.TrainedRegressor;

import java.io.Serial;
import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Everything needed to serve one domain. Immutable; a retrain produces a new instance.
 *
 * @param classLabels classes seen during training, per categorical target
 */
public record ModelArtifact(
        StrategyDomain domain,
        FeatureSchema schema,
        Map<String, TrainedClassifier> classifiers,
        Map<String, TrainedRegressor> regressors,
        Map<String, List<String>> classLabels,
        TrainingMetrics metrics,
        Instant trainedAt
) implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    public ModelArtifact {
        classifiers = Map.copyOf(classifiers);
        regressors = Map.copyOf(regressors);
        classLabels = Map.copyOf(classLabels);
    }

    public TrainedClassifier classifier(String target) {
        TrainedClassifier classifier = classifiers.get(target);
        if (classifier == null) {
            throw new IllegalStateException("No classifier for target '%s' in %s".formatted(target, domain.modelName()));
        }
        return classifier;
    }

    public TrainedRegressor regressor(String target) {
        TrainedRegressor regressor = regressors.get(target);
        if (regressor == null) {
            throw new IllegalStateException("No regressor for target '%s' in %s".formatted(target, domain.modelName()));
        }
        return regressor;
    }
}
