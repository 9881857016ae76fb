package org.jstats.pitwall_api.modules.strategy_engine.prediction;

import org.jstats.pitwall_api.modules.strategy_engine.config.StrategyEngineProperties;
import org.jstats.pitwall_api.modules.strategy_engine.domain.StrategyDomain;
import org.jstats.pitwall_api.modules.strategy_engine.model.PositionRequest;
import org.jstats.pitwall_api.modules.strategy_engine.model.PositionResponse;
import org.jstats.pitwall_api.modules.strategy_engine.model.PositionResponse.AttackAnalysis;
import org.jstats.pitwall_api.modules.strategy_engine.model.PositionResponse.DefenseAnalysis;
import org.jstats.pitwall_api.modules.strategy_engine.model.PositionResponse.PositionChangeProbabilities;
import org.jstats.pitwall_api.modules.strategy_engine.registry.ModelArtifact;
import org.jstats.pitwall_api.modules.strategy_engine.registry.ModelRegistry;
import org.jstats.pitwall_api.modules.strategy_engine.training.FeatureEncoder;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.jstats.pitwall_api.modules.strategy_engine.domain.Targets.*;

/**
 * Overtake and position-change outlook for the car and its immediate rivals.
 */
@Service
public class PositionPredictionService {

    static final int FIRST_POSITION = 1;
    static final int LAST_POSITION = 20;
    static final double BATTLE_GAP = 1.5;
    static final double CLEAN_AIR_GAP = 5.0;

    record Facts(double overtake, double lose, PositionRequest request) {}

    static final RuleBook<Facts> BATTLE_STATUS = RuleBook.<Facts>builder()
            .rule("both-sides", f -> f.request().gapToCarAhead() < BATTLE_GAP && f.request().gapToCarBehind() < BATTLE_GAP,
                    f -> "IN BATTLE - both sides, %d%% overtake chance".formatted(percent(f.overtake())))
            .rule("attacking", f -> f.request().gapToCarAhead() < BATTLE_GAP,
                    f -> "ATTACKING - car ahead at %.1fs, %d%% overtake chance"
                            .formatted(f.request().gapToCarAhead(), percent(f.overtake())))
            .rule("defending", f -> f.request().gapToCarBehind() < BATTLE_GAP,
                    f -> "DEFENDING - car behind at %.1fs".formatted(f.request().gapToCarBehind()))
            .rule("clean-air", f -> f.request().gapToCarAhead() > CLEAN_AIR_GAP && f.request().gapToCarBehind() > CLEAN_AIR_GAP,
                    "CLEAN AIR - no immediate battle")
            .build();

    static final String MONITORING = "MONITORING - gaps manageable";

    static final RuleBook<Facts> TACTICS = RuleBook.<Facts>builder()
            .rule("commit", f -> f.overtake() > 0.5,
                    "High overtake probability - commit to the move")
            .rule("pressure", f -> f.overtake() > 0.3 && f.overtake() <= 0.5,
                    "Build pressure, wait for a mistake")
            .rule("defend", f -> f.request().gapToCarBehind() < 1.0 && f.lose() > 0.3,
                    "Defensive driving recommended")
            .rule("tire-advantage", f -> f.request().tireAdvantage() > 10,
                    "Tire advantage - attack late in the stint")
            .rule("tire-disadvantage", f -> f.request().tireAdvantage() < -10,
                    "Tire disadvantage - consider an early pit")
            .rule("drs", f -> f.request().gapToCarAhead() < 2.0 && f.request().drsAvailable() == 1,
                    "DRS active - use it on the main straight")
            .rule("final-laps", f -> f.request().remainingLaps() < 10,
                    "Final laps - increased aggression warranted")
            .build();

    static final String HOLD = "Maintain current strategy";

    private final ModelRegistry registry;
    private final FeatureEncoder encoder;
    private final StrategyEngineProperties properties;

    public PositionPredictionService(ModelRegistry registry, FeatureEncoder encoder,
                                     StrategyEngineProperties properties) {
        this.registry = registry;
        this.encoder = encoder;
        this.properties = properties;
    }

    public PositionResponse predict(PositionRequest request) {
        ModelArtifact artifact = registry.require(StrategyDomain.POSITION);
        double[] x = encoder.encode(artifact.schema(), request.toFeatures());

        double overtake = artifact.classifier(OVERTAKE_SUCCESS).probabilityOf(x, YES);
        Map<String, Double> change = artifact.classifier(POSITION_CHANGE)
                .probabilities(x, List.of(LOSE, MAINTAIN, GAIN));
        double lose = change.getOrDefault(LOSE, 0.0);
        double delta = artifact.regressor(POSITION_DELTA).predict(x);
        int predictedFinal = Numbers.clamp((int) Math.round(request.currentPosition() + delta),
                FIRST_POSITION, LAST_POSITION);

        Facts facts = new Facts(overtake, lose, request);
        return new PositionResponse(
                request.currentPosition(),
                predictedFinal,
                Numbers.round(overtake, 4),
                new PositionChangeProbabilities(
                        Numbers.round(lose, 4),
                        Numbers.round(change.getOrDefault(MAINTAIN, 0.0), 4),
                        Numbers.round(change.getOrDefault(GAIN, 0.0), 4)),
                attack(request, overtake),
                defense(request, lose),
                BATTLE_STATUS.first(facts).orElse(MONITORING),
                TACTICS.applyOrElse(facts, properties.getHeuristics().getMaxTacticalRecommendations(), HOLD));
    }

    static AttackAnalysis attack(PositionRequest request, double overtake) {
        List<String> factors = new ArrayList<>(3);
        double gap = request.gapToCarAhead();
        if (gap < 1.0) {
            factors.add("Within striking distance");
        } else if (gap < 2.0) {
            factors.add("Close but needs work");
        } else {
            factors.add("Too far to attack");
        }
        factors.add(request.drsAvailable() == 1 ? "DRS available" : "No DRS");
        factors.add(request.relativePace() < 0 ? "Pace advantage" : "No pace advantage");
        return new AttackAnalysis(Numbers.round(gap, 3), Numbers.round(overtake * 100, 1), factors,
                overtake > 0.4 ? "ATTACK" : "PRESSURE");
    }

    static DefenseAnalysis defense(PositionRequest request, double lose) {
        double gap = request.gapToCarBehind();
        String level;
        String color;
        if (gap > 3.0) {
            level = "LOW";
            color = "green";
        } else if (gap > 1.5) {
            level = "MEDIUM";
            color = "yellow";
        } else {
            level = "HIGH";
            color = "red";
        }
        return new DefenseAnalysis(Numbers.round(gap, 3), level, color, Numbers.round(lose * 100, 1),
                lose > 0.3 ? "DEFEND" : "MAINTAIN");
    }

    private static long percent(double probability) {
        return Math.round(probability * 100);
    }
}
