package org.jstats.pitwall_api.modules.strategy_engine.training;

import org.jstats.pitwall_api.modules.strategy_engine.domain.FeatureSchema;
import org.jstats.pitwall_api.modules.strategy_engine.exception.SchemaException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Maps named feature values onto the schema's fixed order. Never fills in defaults.
 */
@Component
public class FeatureEncoder {

    public double[] encode(FeatureSchema schema, Map<String, Double> features) {
        List<String> names = schema.names();
        double[] vector = new double[names.size()];
        for (int i = 0; i < vector.length; i++) {
            Double value = features.get(names.get(i));
            if (value == null) {
                throw new SchemaException(names.get(i));
            }
            vector[i] = value;
        }
        return vector;
    }
}
