package org.jstats.pitwall_api.modules.strategy_engine.domain;

import org.jstats.pitwall_api.modules.strategy_engine.exception.SchemaException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Categorical and numeric targets attached to one training example.
 */
public record LabelSet(Map<String, String> classes, Map<String, Double> values) {

    public LabelSet {
        classes = Map.copyOf(classes);
        values = Map.copyOf(values);
    }

    public String classOf(String target) {
        String value = classes.get(target);
        if (value == null) {
            throw new SchemaException(target);
        }
        return value;
    }

    public double valueOf(String target) {
        Double value = values.get(target);
        if (value == null) {
            throw new SchemaException(target);
        }
        return value;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, String> classes = new LinkedHashMap<>();
        private final Map<String, Double> values = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder label(String target, String cls) {
            classes.put(target, cls);
            return this;
        }

        public Builder value(String target, double value) {
            values.put(target, value);
            return this;
        }

        public LabelSet build() {
            return new LabelSet(classes, values);
        }
    }
}
