package org.jstats.pitwall_api.modules.strategy_engine.prediction;

import org.jstats.pitwall_api.modules.strategy_engine.model.StrategyScenario;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class StrategyScenarioCatalog {

    private static final Map<String, StrategyScenario> SCENARIOS = index(List.of(
            new StrategyScenario("aggressive_one_stop", "Aggressive One-Stop",
                    "Maximize stint length for single pit stop",
                    List.of("MEDIUM", "HARD"), List.of(30), null, "Medium"),
            new StrategyScenario("conservative_two_stop", "Conservative Two-Stop",
                    "Safer strategy with two pit stops",
                    List.of("SOFT", "MEDIUM", "MEDIUM"), List.of(15, 35), null, "Low"),
            new StrategyScenario("undercut_aggressive", "Undercut Strategy",
                    "Early pit to gain track position",
                    List.of("MEDIUM", "HARD"), List.of(), "When within 2s of car ahead", "High"),
            new StrategyScenario("overcut_defensive", "Overcut Strategy",
                    "Stay out to benefit from clear track",
                    List.of("HARD", "MEDIUM"), List.of(), "When car behind pits first", "Medium")));

    public List<String> names() {
        return List.copyOf(SCENARIOS.keySet());
    }

    public StrategyScenario get(String id) {
        StrategyScenario scenario = SCENARIOS.get(id);
        if (scenario == null) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Scenario not found: " + id);
        }
        return scenario;
    }

    private static Map<String, StrategyScenario> index(List<StrategyScenario> scenarios) {
        Map<String, StrategyScenario> byId = new LinkedHashMap<>();
        scenarios.forEach(s -> byId.put(s.id(), s));
        return byId;
    }
}
