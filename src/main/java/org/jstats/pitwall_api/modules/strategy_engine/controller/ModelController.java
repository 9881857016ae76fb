package org.jstats.pitwall_api.modules.strategy_engine.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.jspecify.annotations.Nullable;
import org.jstats.pitwall_api.modules.strategy_engine.domain.StrategyDomain;
import org.jstats.pitwall_api.modules.strategy_engine.model.ModelInfo;
import org.jstats.pitwall_api.modules.strategy_engine.model.ModelStatusResponse;
import org.jstats.pitwall_api.modules.strategy_engine.model.TrainAllResponse;
import org.jstats.pitwall_api.modules.strategy_engine.model.TrainingRequest;
import org.jstats.pitwall_api.modules.strategy_engine.model.TrainingResult;
import org.jstats.pitwall_api.modules.strategy_engine.registry.ModelCatalogService;
import org.jstats.pitwall_api.modules.strategy_engine.training.HybridTrainingService;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import static java.util.Objects.requireNonNullElseGet;

/**
 * Training and lifecycle of the four strategy models.
 */
@Tag(name = "Models", description = "Train strategy models on blended real and synthetic data and inspect their status")
@Validated
@RestController
@RequestMapping("/api/models")
public class ModelController {

    private final HybridTrainingService trainingService;
    private final ModelCatalogService catalogService;

    public ModelController(HybridTrainingService trainingService, ModelCatalogService catalogService) {
        this.trainingService = trainingService;
        this.catalogService = catalogService;
    }

    @Operation(summary = "Status of every model")
    @GetMapping("/status")
    public ModelStatusResponse status() {
        return catalogService.status();
    }

    @Operation(
            summary = "Train one model",
            description = "Fetches the requested OpenF1 sessions, blends their examples with synthetic ones and refits the model",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Model trained and published",
                            content = @Content(mediaType = "application/json",
                                    schema = @Schema(implementation = TrainingResult.class))),
                    @ApiResponse(responseCode = "400", description = "Invalid blend weights",
                            content = @Content(mediaType = "application/problem+json")),
                    @ApiResponse(responseCode = "404", description = "Unknown model",
                            content = @Content(mediaType = "application/problem+json")),
                    @ApiResponse(responseCode = "500", description = "Training failed",
                            content = @Content(mediaType = "application/problem+json"))
            }
    )
    @PostMapping("/train/{modelName}")
    public TrainingResult train(@PathVariable String modelName,
                                @RequestBody(required = false) @Nullable TrainingRequest request) {
        return trainingService.train(StrategyDomain.fromName(modelName),
                requireNonNullElseGet(request, TrainingRequest::defaults));
    }

    @Operation(
            summary = "Train every model",
            description = "A failing model is reported in its own entry and does not stop the others"
    )
    @PostMapping("/train-all")
    public TrainAllResponse trainAll(@RequestBody(required = false) @Nullable TrainingRequest request) {
        return trainingService.trainAll(requireNonNullElseGet(request, TrainingRequest::defaults));
    }

    @Operation(
            summary = "Describe one model",
            responses = {
                    @ApiResponse(responseCode = "200", description = "OK"),
                    @ApiResponse(responseCode = "404", description = "Unknown model",
                            content = @Content(mediaType = "application/problem+json"))
            }
    )
    @GetMapping("/{modelName}/info")
    public ModelInfo info(@PathVariable String modelName) {
        return catalogService.info(modelName);
    }
}
