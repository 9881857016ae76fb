package org.jstats.pitwall_api.modules.strategy_engine.training;

import org.tribuo.Model;
import org.tribuo.regression.RegressionFactory;
import org.tribuo.regression.Regressor;

import java.io.Serial;
import java.util.List;

/**
 * Squared-loss gradient boosting: a constant base value plus shrunken CART trees fitted to residuals.
 */
final class GradientBoostedRegressor implements TrainedRegressor {

    @Serial
    private static final long serialVersionUID = 1L;

    private final String target;
    private final String[] featureNames;
    private final double base;
    private final double learningRate;
    private final List<Model<Regressor>> stages;

    GradientBoostedRegressor(String target, String[] featureNames, double base, double learningRate,
                             List<Model<Regressor>> stages) {
        this.target = target;
        this.featureNames = featureNames.clone();
        this.base = base;
        this.learningRate = learningRate;
        this.stages = List.copyOf(stages);
    }

    @Override
    public String target() {
        return target;
    }

    @Override
    public double predict(double[] features) {
        var example = TribuoRows.example(RegressionFactory.UNKNOWN_REGRESSOR, featureNames, features, 1f);
        double value = base;
        for (Model<Regressor> stage : stages) {
            value += learningRate * stage.predict(example).getOutput().getValues()[0];
        }
        return value;
    }

    int rounds() {
        return stages.size();
    }
}
