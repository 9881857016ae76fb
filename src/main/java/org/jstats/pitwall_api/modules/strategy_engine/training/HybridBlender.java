package org.jstats.pitwall_api.modules.strategy_engine.training;

import org.jstats.pitwall_api.modules.strategy_engine.domain.TrainingExample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Combines real and synthetic examples under a weight split.
 */
@Component
public class HybridBlender {

    private static final Logger log = LoggerFactory.getLogger(HybridBlender.class);

    public BlendedDataset blend(List<TrainingExample> real, List<TrainingExample> synthetic, BlendWeights requested) {
        BlendWeights effective = effectiveWeights(real.isEmpty(), synthetic.isEmpty(), requested);

        List<TrainingExample> blended = new ArrayList<>(real.size() + synthetic.size());
        int realKept = 0;
        int syntheticKept = 0;
        if (effective.real() > 0) {
            for (TrainingExample example : real) {
                blended.add(example.withWeight(effective.real()));
            }
            realKept = real.size();
        }
        if (effective.synthetic() > 0) {
            for (TrainingExample example : synthetic) {
                blended.add(example.withWeight(effective.synthetic()));
            }
            syntheticKept = synthetic.size();
        }

        if (log.isDebugEnabled()) {
            log.debug("Blended {} real + {} synthetic examples at {}/{}",
                    realKept, syntheticKept, effective.real(), effective.synthetic());
        }
        return new BlendedDataset(blended, effective, realKept, syntheticKept);
    }

    private static BlendWeights effectiveWeights(boolean realEmpty, boolean syntheticEmpty, BlendWeights requested) {
        if (realEmpty && !syntheticEmpty) {
            return BlendWeights.SYNTHETIC_ONLY;
        }
        if (syntheticEmpty && !realEmpty) {
            return BlendWeights.REAL_ONLY;
        }
        return requested;
    }
}
