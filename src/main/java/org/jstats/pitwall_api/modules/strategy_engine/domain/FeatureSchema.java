package org.jstats.pitwall_api.modules.strategy_engine.domain;

import java.io.Serial;
import java.io.Serializable;
import java.util.List;

/**
 * Fixed-order list of feature names a domain's models consume.
 */
public record FeatureSchema(List<String> names) implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    public FeatureSchema {
        if (names == null || names.isEmpty()) {
            throw new IllegalArgumentException("Feature schema must name at least one feature");
        }
        names = List.copyOf(names);
    }

    public static FeatureSchema of(String... names) {
        return new FeatureSchema(List.of(names));
    }

    public int size() {
        return names.size();
    }

    public String[] toArray() {
        return names.toArray(new String[0]);
    }
}
