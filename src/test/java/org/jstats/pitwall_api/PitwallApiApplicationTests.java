package org.jstats.pitwall_api;

import io.swagger.v3.oas.models.OpenAPI;
import org.jstats.pitwall_api.modules.openf1_gatherer.ingest.OpenF1SessionRecordProvider;
import org.jstats.pitwall_api.modules.strategy_engine.data.SessionRecordProvider;
import org.jstats.pitwall_api.modules.strategy_engine.registry.ModelRegistry;
import org.jstats.pitwall_api.modules.strategy_engine.registry.ModelStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Boots the whole application against an empty models directory. No OpenF1 call is made at start-up.
 */
@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.NONE,
        properties = "pitwall.engine.models-dir=target/context-test-models/empty")
class PitwallApiApplicationTests {

    @Autowired
    ModelRegistry registry;

    @Autowired
    SessionRecordProvider sessions;

    @Autowired
    @Qualifier("openf1")
    RestClient openF1;

    @Autowired
    Clock clock;

    @Autowired
    OpenAPI openApi;

    @Test
    void context_wiresEngineAndGatherer() {
        assertNotNull(openF1);
        assertInstanceOf(OpenF1SessionRecordProvider.class, sessions);
        assertEquals(ZoneOffset.UTC, clock.getZone());
        assertEquals("Pitwall Strategy API", openApi.getInfo().getTitle());
    }

    @Test
    void startup_withoutArtifacts_leavesEveryModelNotLoaded() {
        var statuses = registry.status();

        assertEquals(4, statuses.size());
        for (ModelStatus status : statuses) {
            assertEquals("not_loaded", status.status(), status.name());
            assertFalse(status.ready());
        }
    }
}
