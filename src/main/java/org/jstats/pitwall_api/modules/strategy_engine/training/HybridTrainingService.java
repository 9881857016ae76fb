package org.jstats.pitwall_api.modules.strategy_engine.training;

import org.jstats.pitwall_api.modules.strategy_engine.config.StrategyEngineProperties;
import org.jstats.pitwall_api.modules.strategy_engine.data.RawSessionRecord;
import org.jstats.pitwall_api.modules.strategy_engine.data.SessionRecordProvider;
import org.jstats.pitwall_api.modules.strategy_engine.domain.StrategyDomain;
import org.jstats.pitwall_api.modules.strategy_engine.domain.TrainingExample;
import org.jstats.pitwall_api.modules.strategy_engine.model.TrainAllResponse;
import org.jstats.pitwall_api.modules.strategy_engine.model.TrainAllResponse.Outcome;
import org.jstats.pitwall_api.modules.strategy_engine.model.TrainingRequest;
import org.jstats.pitwall_api.modules.strategy_engine.model.TrainingResult;
import org.jstats.pitwall_api.modules.strategy_engine.registry.DataBreakdown;
import org.jstats.pitwall_api.modules.strategy_engine.registry.ModelArtifact;
import org.jstats.pitwall_api.modules.strategy_engine.registry.ModelRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNullElse;

/**
 * Fetch, extract, generate, blend, train and register, for one domain or all of them.
 */
@Service
public class HybridTrainingService {

    private static final Logger log = LoggerFactory.getLogger(HybridTrainingService.class);

    private final SessionRecordProvider sessions;
    private final RealSampleExtractor extractor;
    private final SyntheticSampleGenerator generator;
    private final HybridBlender blender;
    private final StrategyModelTrainer trainer;
    private final ModelRegistry registry;
    private final StrategyEngineProperties properties;

    public HybridTrainingService(SessionRecordProvider sessions,
                                 RealSampleExtractor extractor,
                                 SyntheticSampleGenerator generator,
                                 HybridBlender blender,
                                 StrategyModelTrainer trainer,
                                 ModelRegistry registry,
                                 StrategyEngineProperties properties) {
        this.sessions = sessions;
        this.extractor = extractor;
        this.generator = generator;
        this.blender = blender;
        this.trainer = trainer;
        this.registry = registry;
        this.properties = properties;
    }

    /**
     * Trains one domain and publishes the result.
     *
     * @throws org.jstats.pitwall_api.modules.strategy_engine.exception.ConfigException for invalid weights
     * @throws org.jstats.pitwall_api.modules.strategy_engine.exception.TrainingFailureException when fitting fails
     */
    public TrainingResult train(StrategyDomain domain, TrainingRequest request) {
        BlendWeights weights = requestedWeights(request);
        List<RawSessionRecord> records = request.hybridMode() ? fetch(request.sessionKeys()) : List.of();
        List<TrainingExample> real = request.hybridMode() ? extractor.extract(domain, records) : List.of();

        int syntheticCount = syntheticCount(real.size(), weights);
        List<TrainingExample> synthetic = syntheticCount == 0
                ? List.of()
                : generator.generate(domain, syntheticCount, SyntheticContext.fromRecords(records), properties.getSeed());

        BlendedDataset dataset = blender.blend(real, synthetic, weights);
        log.info("Training {} on {} real and {} synthetic examples (requested split {}/{})",
                domain.modelName(), dataset.realCount(), dataset.syntheticCount(), weights.real(), weights.synthetic());

        ModelArtifact artifact = registry.retrain(domain, () -> trainer.train(domain, dataset));
        DataBreakdown breakdown = artifact.metrics().dataBreakdown();
        return new TrainingResult(
                domain.modelName(),
                artifact.metrics(),
                breakdown.real(),
                breakdown.synthetic(),
                breakdown.realInfluence(),
                breakdown.syntheticInfluence(),
                artifact.trainedAt());
    }

    /**
     * Trains every domain in turn; a failing domain is reported without aborting the others.
     */
    public TrainAllResponse trainAll(TrainingRequest request) {
        Map<String, Outcome> results = new LinkedHashMap<>();
        for (StrategyDomain domain : StrategyDomain.values()) {
            try {
                results.put(domain.modelName(), Outcome.succeeded(train(domain, request)));
            } catch (RuntimeException ex) {
                log.warn("Training {} failed during train-all: {}", domain.modelName(), ex.getMessage());
                results.put(domain.modelName(), Outcome.failed(
                        requireNonNullElse(ex.getMessage(), ex.getClass().getSimpleName())));
            }
        }
        return new TrainAllResponse(results);
    }

    BlendWeights requestedWeights(TrainingRequest request) {
        if (!request.hybridMode()) {
            return BlendWeights.SYNTHETIC_ONLY;
        }
        return BlendWeights.of(
                requireNonNullElse(request.realDataWeight(), properties.getBlend().getRealWeight()),
                requireNonNullElse(request.syntheticDataWeight(), properties.getBlend().getSyntheticWeight()));
    }

    /**
     * Tops up scarce real data to the target pool size whatever the requested split; otherwise adds the
     * synthetic share of the remaining headroom.
     */
    int syntheticCount(int realCount, BlendWeights weights) {
        StrategyEngineProperties.Blend blend = properties.getBlend();
        int count;
        if (realCount < blend.getMinRealSamples()) {
            count = blend.getTargetTotalSamples();
        } else if (weights.synthetic() == 0) {
            return 0;
        } else {
            count = (int) Math.round(Math.max(0, blend.getTargetTotalSamples() - realCount) * weights.synthetic());
        }
        return Math.min(count, blend.getMaxSyntheticSamples());
    }

    private List<RawSessionRecord> fetch(List<Integer> sessionKeys) {
        List<RawSessionRecord> records = new ArrayList<>();
        for (Integer key : sessionKeys) {
            try {
                records.addAll(sessions.fetchSession(key));
            } catch (RuntimeException ex) {
                log.warn("Session {} unavailable, continuing without it: {}", key, ex.getMessage());
            }
        }
        if (log.isDebugEnabled()) {
            log.debug("Fetched {} raw records from {} sessions", records.size(), sessionKeys.size());
        }
        return records;
    }
}
