package org.jstats.pitwall_api.modules.strategy_engine.controller;

import org.jstats.pitwall_api.core.config.JacksonConfig;
import org.jstats.pitwall_api.core.config.ProblemHandler;
import org.jstats.pitwall_api.modules.strategy_engine.domain.StrategyDomain;
import org.jstats.pitwall_api.modules.strategy_engine.exception.ConfigException;
import org.jstats.pitwall_api.modules.strategy_engine.exception.ModelNotFoundException;
import org.jstats.pitwall_api.modules.strategy_engine.exception.TrainingFailureException;
import org.jstats.pitwall_api.modules.strategy_engine.model.ModelStatusResponse;
import org.jstats.pitwall_api.modules.strategy_engine.model.TrainAllResponse;
import org.jstats.pitwall_api.modules.strategy_engine.model.TrainingRequest;
import org.jstats.pitwall_api.modules.strategy_engine.model.TrainingResult;
import org.jstats.pitwall_api.modules.strategy_engine.registry.DataBreakdown;
import org.jstats.pitwall_api.modules.strategy_engine.registry.ModelCatalogService;
import org.jstats.pitwall_api.modules.strategy_engine.registry.ModelStatus;
import org.jstats.pitwall_api.modules.strategy_engine.registry.TrainingMetrics;
import org.jstats.pitwall_api.modules.strategy_engine.training.HybridTrainingService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ModelController.class)
@Import({ProblemHandler.class, JacksonConfig.class})
class ModelControllerTests {

    private static final Instant TRAINED_AT = Instant.parse("2024-03-02T15:00:00Z");

    @Autowired
    MockMvc mvc;

    @MockBean
    HybridTrainingService trainingService;
    @MockBean
    ModelCatalogService catalogService;

    @Test
    void status_listsModels() throws Exception {
        when(catalogService.status()).thenReturn(new ModelStatusResponse(List.of(
                new ModelStatus("tire_strategy", "trained", "Predicts optimal tire compound and stint length",
                        true, TRAINED_AT, null),
                new ModelStatus("pit_stop", "not_loaded", "Predicts pit window", false, null, null))));

        mvc.perform(get("/api/models/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.models[0].trained_at").value("2024-03-02T15:00:00Z"))
                .andExpect(jsonPath("$.models[1].status").value("not_loaded"))
                .andExpect(jsonPath("$.models[1].trained_at").doesNotExist());
    }

    @Test
    void train_passesWeightsAndSessions() throws Exception {
        when(trainingService.train(eq(StrategyDomain.TIRE_STRATEGY), any())).thenReturn(result("tire_strategy"));

        mvc.perform(post("/api/models/train/tire_strategy")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"real_data_weight\":0.8,\"synthetic_data_weight\":0.2,\"session_keys\":[9158,9159]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.model_name").value("tire_strategy"))
                .andExpect(jsonPath("$.real_samples").value(120))
                .andExpect(jsonPath("$.metrics.data_breakdown.real_influence").value(0.8));

        ArgumentCaptor<TrainingRequest> captor = ArgumentCaptor.forClass(TrainingRequest.class);
        verify(trainingService).train(eq(StrategyDomain.TIRE_STRATEGY), captor.capture());
        assertTrue(captor.getValue().hybridMode());
        assertEquals(List.of(9158, 9159), captor.getValue().sessionKeys());
        assertEquals(0.8, captor.getValue().realDataWeight());
    }

    @Test
    void train_nullSessionKeys_areIgnored() throws Exception {
        when(trainingService.train(eq(StrategyDomain.RACE_PACE), any())).thenReturn(result("race_pace"));

        mvc.perform(post("/api/models/train/race_pace")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"session_keys\":[null,9158,null]}"))
                .andExpect(status().isOk());

        ArgumentCaptor<TrainingRequest> captor = ArgumentCaptor.forClass(TrainingRequest.class);
        verify(trainingService).train(eq(StrategyDomain.RACE_PACE), captor.capture());
        assertEquals(List.of(9158), captor.getValue().sessionKeys());
    }

    @Test
    void train_unknownModel_isNotFound() throws Exception {
        mvc.perform(post("/api/models/train/weather"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.title").value("Model Not Found"));

        verifyNoInteractions(trainingService);
    }

    @Test
    void train_invalidWeights_isBadRequest() throws Exception {
        when(trainingService.train(any(), any())).thenThrow(new ConfigException("Blend weights must not be negative"));

        mvc.perform(post("/api/models/train/pit_stop")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"real_data_weight\":-1}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Invalid Configuration"));
    }

    @Test
    void train_failure_isServerErrorNamingModel() throws Exception {
        when(trainingService.train(any(), any()))
                .thenThrow(new TrainingFailureException("position", "Need at least 10 examples"));

        mvc.perform(post("/api/models/train/position"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.model").value("position"));
    }

    @Test
    void trainAll_reportsEachModel() throws Exception {
        Map<String, TrainAllResponse.Outcome> results = new LinkedHashMap<>();
        results.put("tire_strategy", TrainAllResponse.Outcome.succeeded(result("tire_strategy")));
        results.put("pit_stop", TrainAllResponse.Outcome.failed("single class"));
        when(trainingService.trainAll(any())).thenReturn(new TrainAllResponse(results));

        mvc.perform(post("/api/models/train-all"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.results.tire_strategy.success").value(true))
                .andExpect(jsonPath("$.results.pit_stop.success").value(false))
                .andExpect(jsonPath("$.results.pit_stop.error").value("single class"));

        verify(trainingService).trainAll(TrainingRequest.defaults());
    }

    @Test
    void info_unknownModel_isNotFound() throws Exception {
        when(catalogService.info("tyres")).thenThrow(new ModelNotFoundException("tyres"));

        mvc.perform(get("/api/models/tyres/info"))
                .andExpect(status().isNotFound());
    }

    private static TrainingResult result(String name) {
        return new TrainingResult(name,
                new TrainingMetrics(Map.of("compound_accuracy", 0.91), new DataBreakdown(120, 880, 0.8, 0.2)),
                120, 880, 0.8, 0.2, TRAINED_AT);
    }
}
