package org.jstats.pitwall_api.modules.strategy_engine.prediction;

import org.jstats.pitwall_api.modules.strategy_engine.model.StrategyScenario;
import org.junit.jupiter.api.Test;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StrategyScenarioCatalogTests {

    private final StrategyScenarioCatalog catalog = new StrategyScenarioCatalog();

    @Test
    void names_areListedInCatalogOrder() {
        assertEquals(List.of("aggressive_one_stop", "conservative_two_stop", "undercut_aggressive", "overcut_defensive"),
                catalog.names());
    }

    @Test
    void get_returnsScenario() {
        StrategyScenario scenario = catalog.get("conservative_two_stop");

        assertEquals(List.of("SOFT", "MEDIUM", "MEDIUM"), scenario.tireSequence());
        assertEquals(List.of(15, 35), scenario.targetPitLaps());
        assertEquals("Low", scenario.riskLevel());
        assertNull(scenario.trigger());
    }

    @Test
    void get_unknownScenario_is404() {
        ResponseStatusException ex = assertThrows(ResponseStatusException.class, () -> catalog.get("three_stop"));

        assertEquals(404, ex.getStatusCode().value());
        assertTrue(ex.getReason().contains("three_stop"));
    }
}
