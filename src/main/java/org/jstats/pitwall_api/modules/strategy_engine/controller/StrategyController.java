package org.jstats.pitwall_api.modules.strategy_engine.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Pattern;
import org.jspecify.annotations.Nullable;
import org.jstats.pitwall_api.modules.strategy_engine.model.FullAnalysisRequest;
import org.jstats.pitwall_api.modules.strategy_engine.model.FullAnalysisResponse;
import org.jstats.pitwall_api.modules.strategy_engine.model.PitStopRequest;
import org.jstats.pitwall_api.modules.strategy_engine.model.PitStopResponse;
import org.jstats.pitwall_api.modules.strategy_engine.model.PositionRequest;
import org.jstats.pitwall_api.modules.strategy_engine.model.PositionResponse;
import org.jstats.pitwall_api.modules.strategy_engine.model.RacePaceRequest;
import org.jstats.pitwall_api.modules.strategy_engine.model.RacePaceResponse;
import org.jstats.pitwall_api.modules.strategy_engine.model.StrategyScenario;
import org.jstats.pitwall_api.modules.strategy_engine.model.TireStrategyRequest;
import org.jstats.pitwall_api.modules.strategy_engine.model.TireStrategyResponse;
import org.jstats.pitwall_api.modules.strategy_engine.prediction.PitStopPredictionService;
import org.jstats.pitwall_api.modules.strategy_engine.prediction.PositionPredictionService;
import org.jstats.pitwall_api.modules.strategy_engine.prediction.RacePacePredictionService;
import org.jstats.pitwall_api.modules.strategy_engine.prediction.StrategyAnalysisService;
import org.jstats.pitwall_api.modules.strategy_engine.prediction.StrategyScenarioCatalog;
import org.jstats.pitwall_api.modules.strategy_engine.prediction.TireStrategyPredictionService;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNullElseGet;

/**
 * Strategy predictions. Every request field is optional; omitted fields take their documented defaults.
 */
@Tag(name = "Strategy", description = "Tire, pit stop, race pace and position predictions")
@Validated
@RestController
@RequestMapping("/api/strategy")
public class StrategyController {

    private final TireStrategyPredictionService tireService;
    private final PitStopPredictionService pitStopService;
    private final RacePacePredictionService racePaceService;
    private final PositionPredictionService positionService;
    private final StrategyAnalysisService analysisService;
    private final StrategyScenarioCatalog scenarios;

    public StrategyController(TireStrategyPredictionService tireService,
                              PitStopPredictionService pitStopService,
                              RacePacePredictionService racePaceService,
                              PositionPredictionService positionService,
                              StrategyAnalysisService analysisService,
                              StrategyScenarioCatalog scenarios) {
        this.tireService = tireService;
        this.pitStopService = pitStopService;
        this.racePaceService = racePaceService;
        this.positionService = positionService;
        this.analysisService = analysisService;
        this.scenarios = scenarios;
    }

    @Operation(
            summary = "Recommend a tire compound",
            responses = {
                    @ApiResponse(responseCode = "200", description = "OK"),
                    @ApiResponse(responseCode = "409", description = "Model not trained",
                            content = @Content(mediaType = "application/problem+json"))
            }
    )
    @PostMapping("/tire")
    public TireStrategyResponse tire(@RequestBody(required = false) @Nullable TireStrategyRequest request) {
        return tireService.predict(requireNonNullElseGet(request, TireStrategyRequest::defaults));
    }

    @Operation(
            summary = "Pit window, undercut and timing",
            responses = {
                    @ApiResponse(responseCode = "200", description = "OK"),
                    @ApiResponse(responseCode = "409", description = "Model not trained",
                            content = @Content(mediaType = "application/problem+json"))
            }
    )
    @PostMapping("/pit-stop")
    public PitStopResponse pitStop(@RequestBody(required = false) @Nullable PitStopRequest request) {
        return pitStopService.predict(requireNonNullElseGet(request, PitStopRequest::defaults));
    }

    @Operation(summary = "Lap time projection and pace assessment")
    @PostMapping("/race-pace")
    public RacePaceResponse racePace(@RequestBody(required = false) @Nullable RacePaceRequest request) {
        return racePaceService.predict(requireNonNullElseGet(request, RacePaceRequest::defaults));
    }

    @Operation(summary = "Overtake and position-change outlook")
    @PostMapping("/position")
    public PositionResponse position(@RequestBody(required = false) @Nullable PositionRequest request) {
        return positionService.predict(requireNonNullElseGet(request, PositionRequest::defaults));
    }

    @Operation(
            summary = "All four predictions with an executive summary",
            description = "A section is omitted when its model is not trained"
    )
    @PostMapping("/full-analysis")
    public FullAnalysisResponse fullAnalysis(@RequestBody(required = false) @Nullable FullAnalysisRequest request) {
        return analysisService.analyze(requireNonNullElseGet(request,
                () -> new FullAnalysisRequest(null, null, null, null)));
    }

    @Operation(summary = "Names of the pre-configured strategy scenarios")
    @GetMapping("/scenarios")
    public Map<String, List<String>> scenarios() {
        return Map.of("scenarios", scenarios.names());
    }

    @Operation(
            summary = "One pre-configured strategy scenario",
            responses = {
                    @ApiResponse(responseCode = "200", description = "OK"),
                    @ApiResponse(responseCode = "400", description = "Malformed scenario name",
                            content = @Content(mediaType = "application/problem+json")),
                    @ApiResponse(responseCode = "404", description = "Unknown scenario",
                            content = @Content(mediaType = "application/problem+json"))
            }
    )
    @GetMapping("/scenario/{scenarioName}")
    public StrategyScenario scenario(
            @PathVariable
            @Pattern(regexp = "^[a-z_]{1,40}$", message = "scenario must be a lowercase id like undercut_aggressive")
            String scenarioName) {
        return scenarios.get(scenarioName);
    }
}
