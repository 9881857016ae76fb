package org.jstats.pitwall_api.modules.strategy_engine.prediction;

import org.jstats.pitwall_api.modules.strategy_engine.config.StrategyEngineProperties;
import org.jstats.pitwall_api.modules.strategy_engine.domain.DomainRules;
import org.jstats.pitwall_api.modules.strategy_engine.domain.StrategyDomain;
import org.jstats.pitwall_api.modules.strategy_engine.model.RacePaceRequest;
import org.jstats.pitwall_api.modules.strategy_engine.model.RacePaceResponse;
import org.jstats.pitwall_api.modules.strategy_engine.model.RacePaceResponse.LapPrediction;
import org.jstats.pitwall_api.modules.strategy_engine.model.RacePaceResponse.PerformanceAssessment;
import org.jstats.pitwall_api.modules.strategy_engine.registry.ModelArtifact;
import org.jstats.pitwall_api.modules.strategy_engine.registry.ModelRegistry;
import org.jstats.pitwall_api.modules.strategy_engine.training.FeatureEncoder;
import org.jstats.pitwall_api.modules.strategy_engine.training.TrainedRegressor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

import static org.jstats.pitwall_api.modules.strategy_engine.domain.Targets.*;

/**
 * Lap-time projection over the next laps and a qualitative pace assessment.
 */
@Service
public class RacePacePredictionService {

    static final String IMPROVING = "improving";
    static final String DEGRADING = "degrading";

    record Facts(double trend, RacePaceRequest request) {}

    static final RuleBook<Facts> RECOMMENDATIONS = RuleBook.<Facts>builder()
            .rule("degradation", f -> f.trend() > 0.1,
                    "Significant pace degradation - consider pit stop soon")
            .rule("tire-wear", f -> f.request().tireAge() > 20 && f.trend() > 0.05,
                    "High tire wear affecting pace")
            .rule("heavy-fuel", f -> f.request().fuelLoad() > 80,
                    "Heavy fuel load - pace will improve as fuel burns")
            .rule("traffic", f -> f.request().traffic() > 0,
                    "Traffic affecting lap time - clean air needed")
            .rule("push", f -> f.request().pushLevel() < 70,
                    "Room to push harder if needed")
            .build();

    static final String STABLE = "Pace is stable - maintain current rhythm";

    private final ModelRegistry registry;
    private final FeatureEncoder encoder;
    private final StrategyEngineProperties properties;

    public RacePacePredictionService(ModelRegistry registry, FeatureEncoder encoder,
                                     StrategyEngineProperties properties) {
        this.registry = registry;
        this.encoder = encoder;
        this.properties = properties;
    }

    public RacePaceResponse predict(RacePaceRequest request) {
        ModelArtifact artifact = registry.require(StrategyDomain.RACE_PACE);
        TrainedRegressor lapTimeModel = artifact.regressor(LAP_TIME);
        double[] x = encoder.encode(artifact.schema(), request.toFeatures());

        double lapTime = lapTimeModel.predict(x);
        double fuelEffect = artifact.regressor(FUEL_EFFECT).predict(x);
        double trend = artifact.regressor(PACE_TREND).predict(x);

        List<LapPrediction> laps = new ArrayList<>();
        for (int i = 1; i <= properties.getHeuristics().getLapHorizon(); i++) {
            int lap = request.lapNumber() + i;
            double fuel = Math.max(DomainRules.MIN_FUEL, request.fuelLoad() - i * DomainRules.FUEL_BURN_PER_LAP);
            int tireAge = request.tireAge() + i;
            double time = lapTimeModel.predict(encoder.encode(artifact.schema(),
                    request.atLap(lap, fuel, tireAge).toFeatures()));
            laps.add(new LapPrediction(lap, Numbers.round(time, 3), Numbers.round(fuel, 1), tireAge,
                    Numbers.round(time - request.bestLapTime(), 3)));
        }

        double deltaToBest = lapTime - request.bestLapTime();
        return new RacePaceResponse(
                Numbers.round(lapTime, 3),
                Numbers.round(fuelEffect, 4),
                Numbers.round(trend, 4),
                Numbers.round(deltaToBest, 3),
                laps,
                assess(deltaToBest, lapTime - request.avgLapTime(),
                        trendOf(laps, properties.getHeuristics().getTrendWindow())),
                RECOMMENDATIONS.applyOrElse(new Facts(trend, request), Integer.MAX_VALUE, STABLE));
    }

    /**
     * {@code improving} when the last {@code window} predicted deltas strictly decrease.
     */
    static String trendOf(List<LapPrediction> laps, int window) {
        if (laps.size() < 2) {
            return DEGRADING;
        }
        int from = Math.max(0, laps.size() - window);
        for (int i = from + 1; i < laps.size(); i++) {
            if (laps.get(i).deltaToBest() >= laps.get(i - 1).deltaToBest()) {
                return DEGRADING;
            }
        }
        return IMPROVING;
    }

    static PerformanceAssessment assess(double deltaToBest, double deltaToAverage, String trend) {
        String level;
        String color;
        if (deltaToBest < 0.5) {
            level = "EXCELLENT";
            color = "green";
        } else if (deltaToBest < 1.0) {
            level = "GOOD";
            color = "lime";
        } else if (deltaToBest < 1.5) {
            level = "AVERAGE";
            color = "yellow";
        } else {
            level = "BELOW PAR";
            color = "red";
        }
        return new PerformanceAssessment(level, color, Numbers.round(deltaToBest, 3),
                Numbers.round(deltaToAverage, 3), trend);
    }
}
