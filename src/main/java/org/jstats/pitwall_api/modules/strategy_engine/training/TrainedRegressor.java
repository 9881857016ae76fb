package org.jstats.pitwall_api.modules.strategy_engine.training;

import java.io.Serializable;

/**
 * Fitted model for one continuous target.
 */
public interface TrainedRegressor extends Serializable {

    String target();

    double predict(double[] features);
}
