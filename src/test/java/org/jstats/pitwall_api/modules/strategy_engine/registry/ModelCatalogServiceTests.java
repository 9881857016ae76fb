package org.jstats.pitwall_api.modules.strategy_engine.registry;

import org.jstats.pitwall_api.modules.strategy_engine.config.StrategyEngineProperties;
import org.jstats.pitwall_api.modules.strategy_engine.domain.StrategyDomain;
import org.jstats.pitwall_api.modules.strategy_engine.exception.ModelNotFoundException;
import org.jstats.pitwall_api.modules.strategy_engine.model.ModelInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelCatalogServiceTests {

    @TempDir
    Path modelsDir;

    ModelRegistry registry;
    ModelCatalogService catalog;

    @BeforeEach
    void setUp() {
        StrategyEngineProperties properties = new StrategyEngineProperties();
        properties.setModelsDir(modelsDir.toString());
        registry = new ModelRegistry(new ModelArtifactStore(properties));
        catalog = new ModelCatalogService(registry);
    }

    @Test
    void info_beforeTraining_hasSchemaButNoMetrics() {
        ModelInfo info = catalog.info("tire_strategy");

        assertEquals("not_loaded", info.status());
        assertFalse(info.ready());
        assertEquals(20, info.features().size());
        assertEquals(List.of("compound", "stint_length", "degradation_rate"), info.outputs());
        assertNull(info.metrics());
        assertNull(info.trainedAt());
    }

    @Test
    void info_afterTraining_carriesMetrics() {
        registry.retrain(StrategyDomain.RACE_PACE, () -> ModelRegistryTests.artifact(StrategyDomain.RACE_PACE));

        ModelInfo info = catalog.info("race_pace");

        assertTrue(info.ready());
        assertEquals("trained", info.status());
        assertNotNull(info.metrics());
        assertEquals(0.7, info.metrics().dataBreakdown().realInfluence(), 1e-12);
    }

    @Test
    void info_unknownModel_throwsNotFound() {
        assertThrows(ModelNotFoundException.class, () -> catalog.info("tyres"));
    }

    @Test
    void status_listsAllDomainsInOrder() {
        assertEquals(List.of("tire_strategy", "pit_stop", "race_pace", "position"),
                catalog.status().models().stream().map(ModelStatus::name).toList());
    }
}
