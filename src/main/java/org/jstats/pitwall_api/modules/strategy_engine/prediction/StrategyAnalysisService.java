package org.jstats.pitwall_api.modules.strategy_engine.prediction;

import org.jspecify.annotations.Nullable;
import org.jstats.pitwall_api.modules.strategy_engine.exception.ModelNotReadyException;
import org.jstats.pitwall_api.modules.strategy_engine.model.FullAnalysisRequest;
import org.jstats.pitwall_api.modules.strategy_engine.model.FullAnalysisResponse;
import org.jstats.pitwall_api.modules.strategy_engine.model.FullAnalysisResponse.ExecutiveSummary;
import org.jstats.pitwall_api.modules.strategy_engine.model.PitStopResponse;
import org.jstats.pitwall_api.modules.strategy_engine.model.PositionResponse;
import org.jstats.pitwall_api.modules.strategy_engine.model.RacePaceResponse;
import org.jstats.pitwall_api.modules.strategy_engine.model.TireStrategyResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Runs every domain prediction and condenses them into an executive summary.
 */
@Service
public class StrategyAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(StrategyAnalysisService.class);

    static final int CRITICAL_URGENCY = 70;
    static final double OVERTAKE_OPPORTUNITY = 0.5;
    static final double PACE_DEGRADATION = 0.1;

    private final TireStrategyPredictionService tireService;
    private final PitStopPredictionService pitStopService;
    private final RacePacePredictionService racePaceService;
    private final PositionPredictionService positionService;

    public StrategyAnalysisService(TireStrategyPredictionService tireService,
                                   PitStopPredictionService pitStopService,
                                   RacePacePredictionService racePaceService,
                                   PositionPredictionService positionService) {
        this.tireService = tireService;
        this.pitStopService = pitStopService;
        this.racePaceService = racePaceService;
        this.positionService = positionService;
    }

    public FullAnalysisResponse analyze(FullAnalysisRequest request) {
        TireStrategyResponse tire = ifReady(() -> tireService.predict(request.tireData()));
        PitStopResponse pit = ifReady(() -> pitStopService.predict(request.pitData()));
        RacePaceResponse pace = ifReady(() -> racePaceService.predict(request.paceData()));
        PositionResponse position = ifReady(() -> positionService.predict(request.positionData()));
        return new FullAnalysisResponse(tire, pit, pace, position, summarize(tire, pit, pace, position));
    }

    static ExecutiveSummary summarize(@Nullable TireStrategyResponse tire,
                                      @Nullable PitStopResponse pit,
                                      @Nullable RacePaceResponse pace,
                                      @Nullable PositionResponse position) {
        List<String> critical = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();
        List<String> risks = new ArrayList<>();

        if (pit != null && pit.pitUrgency() > CRITICAL_URGENCY) {
            critical.add("Consider pit stop - high urgency");
        }
        if (position != null && position.overtakeProbability() > OVERTAKE_OPPORTUNITY) {
            critical.add("Overtaking opportunity detected");
        }
        if (tire != null) {
            recommendations.add("Recommended compound: " + tire.recommendedCompound());
        }
        if (pace != null && pace.paceTrendPerLap() > PACE_DEGRADATION) {
            risks.add("Pace degradation detected");
        }
        return new ExecutiveSummary(critical, recommendations, risks);
    }

    private static <T> @Nullable T ifReady(Supplier<T> prediction) {
        try {
            return prediction.get();
        } catch (ModelNotReadyException e) {
            log.debug("Skipping section: {}", e.getMessage());
            return null;
        }
    }
}
