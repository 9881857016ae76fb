package org.jstats.pitwall_api.modules.strategy_engine.controller;

import org.jstats.pitwall_api.core.config.JacksonConfig;
import org.jstats.pitwall_api.core.config.ProblemHandler;
import org.jstats.pitwall_api.modules.strategy_engine.exception.ModelNotReadyException;
import org.jstats.pitwall_api.modules.strategy_engine.exception.SchemaException;
import org.jstats.pitwall_api.modules.strategy_engine.model.FullAnalysisRequest;
import org.jstats.pitwall_api.modules.strategy_engine.model.FullAnalysisResponse;
import org.jstats.pitwall_api.modules.strategy_engine.model.TireStrategyRequest;
import org.jstats.pitwall_api.modules.strategy_engine.model.TireStrategyResponse;
import org.jstats.pitwall_api.modules.strategy_engine.prediction.PitStopPredictionService;
import org.jstats.pitwall_api.modules.strategy_engine.prediction.PositionPredictionService;
import org.jstats.pitwall_api.modules.strategy_engine.prediction.RacePacePredictionService;
import org.jstats.pitwall_api.modules.strategy_engine.prediction.StrategyAnalysisService;
import org.jstats.pitwall_api.modules.strategy_engine.prediction.StrategyScenarioCatalog;
import org.jstats.pitwall_api.modules.strategy_engine.prediction.TireStrategyPredictionService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(StrategyController.class)
@Import({ProblemHandler.class, JacksonConfig.class, StrategyScenarioCatalog.class})
class StrategyControllerTests {

    @Autowired
    MockMvc mvc;

    @MockBean
    TireStrategyPredictionService tireService;
    @MockBean
    PitStopPredictionService pitStopService;
    @MockBean
    RacePacePredictionService racePaceService;
    @MockBean
    PositionPredictionService positionService;
    @MockBean
    StrategyAnalysisService analysisService;

    @Test
    void tire_readsAndWritesSnakeCase() throws Exception {
        when(tireService.predict(any())).thenReturn(new TireStrategyResponse("INTERMEDIATE", 0.72,
                Map.of("INTERMEDIATE", 0.72, "WET", 0.28), 18, 0.06, 60.0, List.of("High rain probability")));

        mvc.perform(post("/api/strategy/tire")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rain_probability\": 80, \"track_temperature\": 21.5}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.recommended_compound").value("INTERMEDIATE"))
                .andExpect(jsonPath("$.predicted_stint_length").value(18))
                .andExpect(jsonPath("$.expected_time_loss_per_lap_ms").value(60.0));

        ArgumentCaptor<TireStrategyRequest> captor = ArgumentCaptor.forClass(TireStrategyRequest.class);
        verify(tireService).predict(captor.capture());
        assertEquals(80.0, captor.getValue().rainProbability());
        assertEquals(21.5, captor.getValue().trackTemperature());
        assertEquals(50.0, captor.getValue().humidity());
    }

    @Test
    void tire_withoutBody_usesDefaults() throws Exception {
        when(tireService.predict(any())).thenReturn(new TireStrategyResponse("MEDIUM", 0.5,
                Map.of("MEDIUM", 0.5), 25, 0.05, 50.0, List.of()));

        mvc.perform(post("/api/strategy/tire")).andExpect(status().isOk());

        verify(tireService).predict(TireStrategyRequest.defaults());
    }

    @Test
    void whenModelNotReady_thenConflictProblem() throws Exception {
        when(pitStopService.predict(any())).thenThrow(new ModelNotReadyException("pit_stop"));

        mvc.perform(post("/api/strategy/pit-stop").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.title").value("Model Not Ready"))
                .andExpect(jsonPath("$.model").value("pit_stop"));
    }

    @Test
    void whenFeatureMissing_thenBadRequestNamingField() throws Exception {
        when(racePaceService.predict(any())).thenThrow(new SchemaException("sector1_time"));

        mvc.perform(post("/api/strategy/race-pace").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("sector1_time"));
    }

    @Test
    void malformedJson_isBadRequest() throws Exception {
        mvc.perform(post("/api/strategy/position").contentType(MediaType.APPLICATION_JSON).content("{\"gap_to_car_ahead\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value("https://api.jstats.org/problems/malformed-body"));

        verifyNoInteractions(positionService);
    }

    @Test
    void fullAnalysis_omitsSectionsWithoutModel() throws Exception {
        when(analysisService.analyze(any())).thenReturn(new FullAnalysisResponse(null, null, null, null,
                new FullAnalysisResponse.ExecutiveSummary(List.of(), List.of(), List.of())));

        mvc.perform(post("/api/strategy/full-analysis"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tire_strategy").doesNotExist())
                .andExpect(jsonPath("$.executive_summary.critical_actions").isArray());

        verify(analysisService).analyze(new FullAnalysisRequest(null, null, null, null));
    }

    @Test
    void scenarios_listAndLookup() throws Exception {
        mvc.perform(get("/api/strategy/scenarios"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.scenarios[0]").value("aggressive_one_stop"));

        mvc.perform(get("/api/strategy/scenario/undercut_aggressive"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tire_sequence[1]").value("HARD"))
                .andExpect(jsonPath("$.risk_level").value("High"));

        mvc.perform(get("/api/strategy/scenario/five_stop"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.title").value("Resource Not Found"));
    }

    @Test
    void scenario_malformedName_isBadRequest() throws Exception {
        mvc.perform(get("/api/strategy/scenario/Five-Stop"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Bad Request"));
    }
}
