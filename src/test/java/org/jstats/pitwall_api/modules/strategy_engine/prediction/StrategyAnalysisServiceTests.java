package org.jstats.pitwall_api.modules.strategy_engine.prediction;

import org.jstats.pitwall_api.modules.strategy_engine.exception.ModelNotReadyException;
import org.jstats.pitwall_api.modules.strategy_engine.model.FullAnalysisRequest;
import org.jstats.pitwall_api.modules.strategy_engine.model.FullAnalysisResponse;
import org.jstats.pitwall_api.modules.strategy_engine.model.FullAnalysisResponse.ExecutiveSummary;
import org.jstats.pitwall_api.modules.strategy_engine.model.PitStopRequest;
import org.jstats.pitwall_api.modules.strategy_engine.model.PitStopResponse;
import org.jstats.pitwall_api.modules.strategy_engine.model.PositionRequest;
import org.jstats.pitwall_api.modules.strategy_engine.model.PositionResponse;
import org.jstats.pitwall_api.modules.strategy_engine.model.RacePaceRequest;
import org.jstats.pitwall_api.modules.strategy_engine.model.RacePaceResponse;
import org.jstats.pitwall_api.modules.strategy_engine.model.TireStrategyRequest;
import org.jstats.pitwall_api.modules.strategy_engine.model.TireStrategyResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class StrategyAnalysisServiceTests {

    TireStrategyPredictionService tireService;
    PitStopPredictionService pitStopService;
    RacePacePredictionService racePaceService;
    PositionPredictionService positionService;

    StrategyAnalysisService service;

    @BeforeEach
    void setUp() {
        tireService = mock(TireStrategyPredictionService.class);
        pitStopService = mock(PitStopPredictionService.class);
        racePaceService = mock(RacePacePredictionService.class);
        positionService = mock(PositionPredictionService.class);
        service = new StrategyAnalysisService(tireService, pitStopService, racePaceService, positionService);
    }

    @Test
    void whenEveryModelReady_thenSummaryCollectsSignals() {
        when(tireService.predict(any())).thenReturn(tire("SOFT"));
        when(pitStopService.predict(any())).thenReturn(pit(85));
        when(racePaceService.predict(any())).thenReturn(pace(0.15));
        when(positionService.predict(any())).thenReturn(position(0.7));

        FullAnalysisResponse response = service.analyze(new FullAnalysisRequest(null, null, null, null));

        assertNotNull(response.tireStrategy());
        assertNotNull(response.pitStop());
        assertNotNull(response.racePace());
        assertNotNull(response.position());
        ExecutiveSummary summary = response.executiveSummary();
        assertEquals(List.of("Consider pit stop - high urgency", "Overtaking opportunity detected"),
                summary.criticalActions());
        assertEquals(List.of("Recommended compound: SOFT"), summary.recommendations());
        assertEquals(List.of("Pace degradation detected"), summary.riskFactors());
    }

    @Test
    void whenSomeModelsNotReady_thenThoseSectionsAreNull() {
        when(tireService.predict(any())).thenThrow(new ModelNotReadyException("tire_strategy"));
        when(pitStopService.predict(any())).thenReturn(pit(20));
        when(racePaceService.predict(any())).thenThrow(new ModelNotReadyException("race_pace"));
        when(positionService.predict(any())).thenReturn(position(0.2));

        FullAnalysisResponse response = service.analyze(new FullAnalysisRequest(null, null, null, null));

        assertNull(response.tireStrategy());
        assertNull(response.racePace());
        assertNotNull(response.pitStop());
        assertTrue(response.executiveSummary().recommendations().isEmpty());
        assertTrue(response.executiveSummary().criticalActions().isEmpty());
    }

    @Test
    void omittedSectionsUseDomainDefaults() {
        when(tireService.predict(any())).thenReturn(tire("MEDIUM"));

        service.analyze(new FullAnalysisRequest(null, null, null, null));

        verify(tireService).predict(TireStrategyRequest.defaults());
        verify(pitStopService).predict(PitStopRequest.defaults());
        verify(racePaceService).predict(RacePaceRequest.defaults());
        verify(positionService).predict(PositionRequest.defaults());
    }

    @Test
    void otherFailuresPropagate() {
        when(tireService.predict(any())).thenThrow(new IllegalStateException("broken"));

        assertThrows(IllegalStateException.class,
                () -> service.analyze(new FullAnalysisRequest(null, null, null, null)));
    }

    @Test
    void summarize_withNothingReady_isEmpty() {
        ExecutiveSummary summary = StrategyAnalysisService.summarize(null, null, null, null);

        assertTrue(summary.criticalActions().isEmpty());
        assertTrue(summary.recommendations().isEmpty());
        assertTrue(summary.riskFactors().isEmpty());
    }

    private static TireStrategyResponse tire(String compound) {
        return new TireStrategyResponse(compound, 0.6, Map.of(compound, 0.6), 20, 0.05, 50.0, List.of());
    }

    private static PitStopResponse pit(int urgency) {
        return new PitStopResponse(true, 0.7, false, 0.2, 25, 5, urgency, "WINDOW OPEN", List.of());
    }

    private static RacePaceResponse pace(double trend) {
        return new RacePaceResponse(90.0, 0.03, trend, 1.0, List.of(),
                new RacePaceResponse.PerformanceAssessment("AVERAGE", "yellow", 1.0, 0.5, "degrading"), List.of());
    }

    private static PositionResponse position(double overtake) {
        return new PositionResponse(5, 4, overtake, new PositionResponse.PositionChangeProbabilities(0.1, 0.3, 0.6),
                new PositionResponse.AttackAnalysis(1.0, overtake * 100, List.of(), "ATTACK"),
                new PositionResponse.DefenseAnalysis(2.0, "MEDIUM", "yellow", 10.0, "MAINTAIN"),
                "MONITORING", List.of());
    }
}
