package org.jstats.pitwall_api.modules.strategy_engine.training;

import org.tribuo.Example;
import org.tribuo.MutableDataset;
import org.tribuo.Output;
import org.tribuo.OutputFactory;
import org.tribuo.impl.ArrayExample;
import org.tribuo.provenance.SimpleDataSourceProvenance;

import java.util.List;

/**
 * Builds Tribuo examples and datasets from encoded feature vectors.
 */
final class TribuoRows {

    private TribuoRows() {
    }

    static <T extends Output<T>> Example<T> example(T output, String[] names, double[] values, float weight) {
        ArrayExample<T> example = new ArrayExample<>(output, names, values);
        example.setWeight(weight);
        return example;
    }

    static <T extends Output<T>> MutableDataset<T> dataset(String description, OutputFactory<T> factory,
                                                           List<Example<T>> examples) {
        MutableDataset<T> dataset = new MutableDataset<>(new SimpleDataSourceProvenance(description, factory), factory);
        dataset.addAll(examples);
        return dataset;
    }
}
