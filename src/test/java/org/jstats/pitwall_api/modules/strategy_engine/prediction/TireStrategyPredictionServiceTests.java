package org.jstats.pitwall_api.modules.strategy_engine.prediction;

import org.jstats.pitwall_api.modules.strategy_engine.domain.StrategyDomain;
import org.jstats.pitwall_api.modules.strategy_engine.exception.ModelNotReadyException;
import org.jstats.pitwall_api.modules.strategy_engine.model.TireStrategyRequest;
import org.jstats.pitwall_api.modules.strategy_engine.model.TireStrategyResponse;
import org.jstats.pitwall_api.modules.strategy_engine.registry.ModelRegistry;
import org.jstats.pitwall_api.modules.strategy_engine.training.FeatureEncoder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.jstats.pitwall_api.modules.strategy_engine.domain.Targets.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class TireStrategyPredictionServiceTests {

    ModelRegistry registry;
    TireStrategyPredictionService service;

    @BeforeEach
    void setUp() {
        registry = mock(ModelRegistry.class);
        service = new TireStrategyPredictionService(registry, new FeatureEncoder());
    }

    @Test
    void predict_recommendsMostProbableCompound() {
        stubModel(22.7, 0.0823);

        TireStrategyResponse response = service.predict(TireStrategyRequest.defaults());

        assertEquals("MEDIUM", response.recommendedCompound());
        assertEquals(0.5, response.compoundConfidence(), 1e-9);
        assertEquals(List.of("SOFT", "MEDIUM", "HARD", "INTERMEDIATE", "WET"),
                List.copyOf(response.compoundProbabilities().keySet()));
        double total = response.compoundProbabilities().values().stream().mapToDouble(Double::doubleValue).sum();
        assertEquals(1.0, total, 1e-9);
        assertEquals(22, response.predictedStintLength());
        assertEquals(0.0823, response.degradationRatePerLap(), 1e-9);
        assertEquals(82.3, response.expectedTimeLossPerLapMs(), 1e-9);
        assertTrue(response.strategyNotes().contains("Medium compound: balanced performance"));
    }

    @Test
    void predict_enforcesStintAndDegradationFloors() {
        stubModel(2.0, -0.4);

        TireStrategyResponse response = service.predict(TireStrategyRequest.defaults());

        assertEquals(5, response.predictedStintLength());
        assertEquals(0.01, response.degradationRatePerLap(), 1e-12);
        assertTrue(response.strategyNotes().contains("Short stint expected - plan for an additional stop"));
    }

    @Test
    void predict_addsConditionNotes() {
        stubModel(35, 0.05);
        TireStrategyRequest request = new TireStrategyRequest(48.0, null, null, null, null, null, null, null, null,
                null, null, null, null, null, null, null, 65.0, null, true, null);

        List<String> notes = service.predict(request).strategyNotes();

        assertEquals("High rain probability - monitor weather closely, intermediates on standby", notes.get(0));
        assertTrue(notes.contains("Long stint possible - one-stop strategy viable"));
        assertTrue(notes.contains("Safety car - consider an opportunistic pit stop"));
        assertTrue(notes.contains("High track temperature - expect increased degradation"));
    }

    @Test
    void predict_isIdempotent() {
        stubModel(22.7, 0.0823);

        assertEquals(service.predict(TireStrategyRequest.defaults()), service.predict(TireStrategyRequest.defaults()));
    }

    @Test
    void whenModelNotReady_thenPropagates() {
        when(registry.require(StrategyDomain.TIRE_STRATEGY)).thenThrow(new ModelNotReadyException("tire_strategy"));

        assertThrows(ModelNotReadyException.class, () -> service.predict(TireStrategyRequest.defaults()));
    }

    private void stubModel(double stint, double degradation) {
        when(registry.require(StrategyDomain.TIRE_STRATEGY)).thenReturn(StubModels.artifact(StrategyDomain.TIRE_STRATEGY)
                .classifier(COMPOUND, Map.of("SOFT", 0.2, "MEDIUM", 0.5, "HARD", 0.3))
                .regressor(STINT_LENGTH, stint)
                .regressor(DEGRADATION_RATE, degradation)
                .build());
    }
}
