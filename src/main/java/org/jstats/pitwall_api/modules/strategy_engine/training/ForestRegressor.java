package org.jstats.pitwall_api.modules.strategy_engine.training;

import org.tribuo.Model;
import org.tribuo.regression.RegressionFactory;
import org.tribuo.regression.Regressor;

import java.io.Serial;

/**
 * Random forest of CART regression trees with an averaging combiner.
 */
final class ForestRegressor implements TrainedRegressor {

    @Serial
    private static final long serialVersionUID = 1L;

    private final String target;
    private final String[] featureNames;
    private final Model<Regressor> model;

    ForestRegressor(String target, String[] featureNames, Model<Regressor> model) {
        this.target = target;
        this.featureNames = featureNames.clone();
        this.model = model;
    }

    @Override
    public String target() {
        return target;
    }

    @Override
    public double predict(double[] features) {
        return model.predict(TribuoRows.example(RegressionFactory.UNKNOWN_REGRESSOR, featureNames, features, 1f))
                .getOutput().getValues()[0];
    }
}
