package org.jstats.pitwall_api.modules.strategy_engine.training;

import org.tribuo.Model;
import org.tribuo.Prediction;
import org.tribuo.classification.Label;
import org.tribuo.classification.LabelFactory;

import java.io.Serial;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Random forest of CART classification trees with a voting combiner.
 */
final class ForestClassifier implements TrainedClassifier {

    @Serial
    private static final long serialVersionUID = 1L;

    private final String target;
    private final String[] featureNames;
    private final Model<Label> model;

    ForestClassifier(String target, String[] featureNames, Model<Label> model) {
        this.target = target;
        this.featureNames = featureNames.clone();
        this.model = model;
    }

    @Override
    public String target() {
        return target;
    }

    @Override
    public Map<String, Double> probabilities(double[] features, Collection<String> classes) {
        Prediction<Label> prediction = model.predict(
                TribuoRows.example(LabelFactory.UNKNOWN_LABEL, featureNames, features, 1f));
        Map<String, Double> scores = new LinkedHashMap<>();
        for (String cls : classes) {
            scores.put(cls, 0.0);
        }
        for (Map.Entry<String, Label> entry : prediction.getOutputScores().entrySet()) {
            double score = entry.getValue().getScore();
            scores.merge(entry.getKey(), Double.isFinite(score) ? Math.max(0, score) : 0.0, Double::sum);
        }
        double total = scores.values().stream().mapToDouble(Double::doubleValue).sum();
        if (total <= 0) {
            // no usable scores: all mass on the predicted label
            scores.replaceAll((k, v) -> 0.0);
            scores.put(prediction.getOutput().getLabel(), 1.0);
            return scores;
        }
        scores.replaceAll((k, v) -> v / total);
        return scores;
    }

    @Override
    public String predict(double[] features) {
        return model.predict(TribuoRows.example(LabelFactory.UNKNOWN_LABEL, featureNames, features, 1f))
                .getOutput().getLabel();
    }
}
