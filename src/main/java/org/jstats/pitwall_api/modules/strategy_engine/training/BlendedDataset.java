package org.jstats.pitwall_api.modules.strategy_engine.training;

import org.jstats.pitwall_api.modules.strategy_engine.domain.TrainingExample;

import java.util.List;

/**
 * Output of the blender: every example already carries its source weight.
 *
 * @param examples       real examples first, then synthetic ones
 * @param weights        effective split after empty or zero-weight sides were dropped
 * @param realCount      real examples kept
 * @param syntheticCount synthetic examples kept
 */
public record BlendedDataset(
        List<TrainingExample> examples,
        BlendWeights weights,
        int realCount,
        int syntheticCount
) {

    public BlendedDataset {
        examples = List.copyOf(examples);
    }

    public int size() {
        return examples.size();
    }
}
