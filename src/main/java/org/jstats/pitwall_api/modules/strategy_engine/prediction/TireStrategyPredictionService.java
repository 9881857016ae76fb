package org.jstats.pitwall_api.modules.strategy_engine.prediction;

import org.jstats.pitwall_api.modules.strategy_engine.domain.Compound;
import org.jstats.pitwall_api.modules.strategy_engine.domain.StrategyDomain;
import org.jstats.pitwall_api.modules.strategy_engine.model.TireStrategyRequest;
import org.jstats.pitwall_api.modules.strategy_engine.model.TireStrategyResponse;
import org.jstats.pitwall_api.modules.strategy_engine.registry.ModelArtifact;
import org.jstats.pitwall_api.modules.strategy_engine.registry.ModelRegistry;
import org.jstats.pitwall_api.modules.strategy_engine.training.FeatureEncoder;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.jstats.pitwall_api.modules.strategy_engine.domain.Targets.*;

/**
 * Recommends a compound, expected stint length and degradation for the current conditions.
 */
@Service
public class TireStrategyPredictionService {

    static final int MIN_STINT = 5;
    static final double MIN_DEGRADATION = 0.01;

    record NoteFacts(Compound compound, int stintLength, double degradation, TireStrategyRequest request) {}

    static final RuleBook<NoteFacts> NOTES = RuleBook.<NoteFacts>builder()
            .rule("rain", f -> f.request().rainProbability() > 50,
                    "High rain probability - monitor weather closely, intermediates on standby")
            .rule("soft", f -> f.compound() == Compound.SOFT,
                    "Soft compound: maximum grip but high degradation")
            .rule("medium", f -> f.compound() == Compound.MEDIUM,
                    "Medium compound: balanced performance")
            .rule("hard", f -> f.compound() == Compound.HARD,
                    "Hard compound: lower grip but excellent durability")
            .rule("intermediate", f -> f.compound() == Compound.INTERMEDIATE,
                    "Intermediate compound: damp track, watch for a drying line")
            .rule("wet", f -> f.compound() == Compound.WET,
                    "Full wet compound: standing water on track")
            .rule("short-stint", f -> f.stintLength() < 15,
                    "Short stint expected - plan for an additional stop")
            .rule("long-stint", f -> f.stintLength() > 30,
                    "Long stint possible - one-stop strategy viable")
            .rule("safety-car", f -> f.request().safetyCarDeployed(),
                    "Safety car - consider an opportunistic pit stop")
            .rule("hot-track", f -> f.request().trackTemperature() > 45,
                    "High track temperature - expect increased degradation")
            .build();

    private static final List<String> COMPOUNDS = Arrays.stream(Compound.values()).map(Enum::name).toList();

    private final ModelRegistry registry;
    private final FeatureEncoder encoder;

    public TireStrategyPredictionService(ModelRegistry registry, FeatureEncoder encoder) {
        this.registry = registry;
        this.encoder = encoder;
    }

    public TireStrategyResponse predict(TireStrategyRequest request) {
        ModelArtifact artifact = registry.require(StrategyDomain.TIRE_STRATEGY);
        double[] x = encoder.encode(artifact.schema(), request.toFeatures());

        Map<String, Double> probabilities = artifact.classifier(COMPOUND).probabilities(x, COMPOUNDS);
        Map<String, Double> ordered = new LinkedHashMap<>();
        String recommended = COMPOUNDS.get(0);
        for (String compound : COMPOUNDS) {
            double p = probabilities.getOrDefault(compound, 0.0);
            ordered.put(compound, p);
            if (p > ordered.get(recommended)) {
                recommended = compound;
            }
        }

        int stint = Math.max(MIN_STINT, (int) Math.floor(artifact.regressor(STINT_LENGTH).predict(x)));
        double degradation = Math.max(MIN_DEGRADATION, artifact.regressor(DEGRADATION_RATE).predict(x));
        Compound compound = Compound.valueOf(recommended);

        return new TireStrategyResponse(
                recommended,
                Numbers.round(ordered.get(recommended), 4),
                ordered,
                stint,
                Numbers.round(degradation, 4),
                Numbers.round(degradation * 1000, 1),
                NOTES.apply(new NoteFacts(compound, stint, degradation, request), Integer.MAX_VALUE));
    }
}
