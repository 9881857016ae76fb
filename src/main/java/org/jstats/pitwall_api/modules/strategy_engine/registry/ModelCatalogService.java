package org.jstats.pitwall_api.modules.strategy_engine.registry;

import org.jstats.pitwall_api.modules.strategy_engine.domain.StrategyDomain;
import org.jstats.pitwall_api.modules.strategy_engine.domain.TargetSpec;
import org.jstats.pitwall_api.modules.strategy_engine.model.ModelInfo;
import org.jstats.pitwall_api.modules.strategy_engine.model.ModelStatusResponse;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Read-only description of the registered domains.
 */
@Service
public class ModelCatalogService {

    private final ModelRegistry registry;

    public ModelCatalogService(ModelRegistry registry) {
        this.registry = registry;
    }

    public ModelStatusResponse status() {
        return new ModelStatusResponse(registry.status());
    }

    /**
     * @throws org.jstats.pitwall_api.modules.strategy_engine.exception.ModelNotFoundException for an unknown name
     */
    public ModelInfo info(String name) {
        StrategyDomain domain = StrategyDomain.fromName(name);
        ModelStatus status = registry.statusOf(domain);
        Optional<ModelArtifact> artifact = registry.current(domain);
        return new ModelInfo(
                domain.modelName(),
                domain.description(),
                status.status(),
                status.ready(),
                domain.schema().names(),
                domain.targets().stream().map(TargetSpec::name).toList(),
                status.trainedAt(),
                artifact.map(ModelArtifact::metrics).orElse(null));
    }
}
