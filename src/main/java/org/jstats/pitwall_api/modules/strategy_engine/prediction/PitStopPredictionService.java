package org.jstats.pitwall_api.modules.strategy_engine.prediction;

import org.jstats.pitwall_api.modules.strategy_engine.config.StrategyEngineProperties;
import org.jstats.pitwall_api.modules.strategy_engine.domain.StrategyDomain;
import org.jstats.pitwall_api.modules.strategy_engine.model.PitStopRequest;
import org.jstats.pitwall_api.modules.strategy_engine.model.PitStopResponse;
import org.jstats.pitwall_api.modules.strategy_engine.model.PitStopResponse.StrategyOption;
import org.jstats.pitwall_api.modules.strategy_engine.registry.ModelArtifact;
import org.jstats.pitwall_api.modules.strategy_engine.registry.ModelRegistry;
import org.jstats.pitwall_api.modules.strategy_engine.training.FeatureEncoder;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

import static org.jstats.pitwall_api.modules.strategy_engine.domain.Targets.*;

/**
 * Pit window, undercut and timing advice.
 */
@Service
public class PitStopPredictionService {

    static final int URGENCY_AGE_THRESHOLD = 15;

    record Facts(boolean inWindow, boolean undercut, int urgency, boolean safetyCar) {}

    static final RuleBook<Facts> RECOMMENDATIONS = RuleBook.<Facts>builder()
            .rule("critical", f -> f.urgency() > 80,
                    "CRITICAL: Pit immediately - severe tire degradation")
            .rule("undercut", f -> f.undercut() && f.inWindow(),
                    "UNDERCUT: Pit now to gain position on car ahead")
            .rule("window-urgent", f -> f.inWindow() && f.urgency() > 50,
                    "WINDOW OPEN: Good time to pit - within optimal range")
            .rule("window", Facts::inWindow,
                    "WINDOW OPEN: Pit window available, monitor gaps")
            .rule("safety-car", Facts::safetyCar,
                    "SAFETY CAR: Cheap pit stop opportunity")
            .build();

    static final String STAY_OUT = "STAY OUT: Continue current stint";

    private final ModelRegistry registry;
    private final FeatureEncoder encoder;
    private final StrategyEngineProperties properties;

    public PitStopPredictionService(ModelRegistry registry, FeatureEncoder encoder,
                                    StrategyEngineProperties properties) {
        this.registry = registry;
        this.encoder = encoder;
        this.properties = properties;
    }

    public PitStopResponse predict(PitStopRequest request) {
        ModelArtifact artifact = registry.require(StrategyDomain.PIT_STOP);
        double[] x = encoder.encode(artifact.schema(), request.toFeatures());

        boolean inWindow = YES.equals(artifact.classifier(IN_PIT_WINDOW).predict(x));
        double windowProbability = artifact.classifier(IN_PIT_WINDOW).probabilityOf(x, YES);
        double undercutProbability = artifact.classifier(UNDERCUT_OPPORTUNITY).probabilityOf(x, YES);
        int currentLap = request.currentLap();
        int optimalLap = Math.max(currentLap, (int) Math.floor(artifact.regressor(OPTIMAL_PIT_LAP).predict(x)));

        int urgency = pitUrgency(request.tireAge(), request.tireDegradationRate());
        boolean undercut = undercutOpportunity(request, properties.getHeuristics().getUndercutTireMargin());
        String recommendation = RECOMMENDATIONS
                .first(new Facts(inWindow, undercut, urgency, request.safetyCarDeployed()))
                .orElse(STAY_OUT);

        return new PitStopResponse(
                inWindow,
                Numbers.round(windowProbability, 4),
                undercut,
                Numbers.round(undercutProbability, 4),
                optimalLap,
                Math.max(0, optimalLap - currentLap),
                urgency,
                recommendation,
                strategyOptions(request, optimalLap));
    }

    /**
     * 0-100 score that never decreases as the tires age.
     */
    static int pitUrgency(int tireAge, double degradationRate) {
        double wear = tireAge * Math.max(0, degradationRate) * 100;
        double overAge = 2.0 * Math.max(0, tireAge - URGENCY_AGE_THRESHOLD);
        return Numbers.clamp((int) Math.floor(wear + overAge), 0, 100);
    }

    static boolean undercutOpportunity(PitStopRequest request, int tireMargin) {
        return request.gapToCarAhead() < request.pitDelta()
                && request.competitorTireAge() > request.tireAge() + tireMargin;
    }

    static List<StrategyOption> strategyOptions(PitStopRequest request, int optimalLap) {
        int currentLap = request.currentLap();
        List<StrategyOption> options = new ArrayList<>(3);
        options.add(option("Optimal Strategy", optimalLap, optimalLap,
                request.remainingLaps() > 20 ? "MEDIUM" : "SOFT", "+0.0s"));

        if (optimalLap + 5 < request.totalLaps()) {
            options.add(option("Extended Stint", optimalLap + 5, optimalLap, "SOFT", "-2.5s"));
        } else {
            options.add(option("Early Stop", Math.max(currentLap, optimalLap - 3), optimalLap, "MEDIUM", "-1.0s"));
        }

        if (currentLap < optimalLap - 2) {
            options.add(option("Undercut Attempt", currentLap + 1, optimalLap, "MEDIUM", "+3.0s (if successful)"));
        }
        return options;
    }

    static String riskTier(int pitLap, int optimalLap) {
        int deviation = Math.abs(pitLap - optimalLap);
        if (deviation <= 2) {
            return "Low";
        }
        return deviation <= 5 ? "Medium" : "High";
    }

    private static StrategyOption option(String name, int pitLap, int optimalLap, String compound, String gain) {
        return new StrategyOption(name, pitLap, compound, gain, riskTier(pitLap, optimalLap));
    }
}
