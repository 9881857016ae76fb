package org.jstats.pitwall_api.modules.openf1_gatherer.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.jstats.pitwall_api.modules.strategy_engine.data.RawSessionRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class OpenF1SessionRecordProviderTests {

    OpenF1Client client;
    ObjectMapper mapper;

    OpenF1SessionRecordProvider provider;

    @BeforeEach
    void setUp() {
        client = mock(OpenF1Client.class);
        mapper = Jackson2ObjectMapperBuilder.json()
                .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .build();
        provider = new OpenF1SessionRecordProvider(new OpenF1Reader(client, mapper), new SessionRecordAssembler());
        when(client.get(anyString(), anyMap())).thenReturn(JsonNodeFactory.instance.arrayNode());
    }

    @Test
    void fetchSession_decodesEveryEndpointAndAssembles() throws Exception {
        when(client.get("laps", Map.of("session_key", 9158))).thenReturn(json("""
                [{"driver_number":44,"lap_number":7,"date_start":"2024-03-02T15:10:00+00:00",
                  "lap_duration":93.4,"duration_sector_1":30.2,"duration_sector_2":33.1,
                  "is_pit_out_lap":false,"segments_sector_1":[2048,2049]}]
                """));
        when(client.get("stints", Map.of("session_key", 9158))).thenReturn(json("""
                [{"driver_number":44,"stint_number":1,"lap_start":1,"lap_end":20,
                  "compound":"MEDIUM","tyre_age_at_start":0}]
                """));
        when(client.get("weather", Map.of("session_key", 9158))).thenReturn(json("""
                [{"date":"2024-03-02T15:09:00+00:00","air_temperature":24.1,"track_temperature":38.7,
                  "humidity":41.0,"rainfall":0,"wind_speed":1.9}]
                """));
        when(client.get("intervals", Map.of("session_key", 9158))).thenReturn(json("""
                [{"date":"2024-03-02T15:09:30+00:00","driver_number":44,"gap_to_leader":4.512,"interval":1.2}]
                """));
        when(client.get("position", Map.of("session_key", 9158))).thenReturn(json("""
                [{"date":"2024-03-02T15:00:00+00:00","driver_number":44,"position":4}]
                """));

        List<RawSessionRecord> records = provider.fetchSession(9158);

        assertEquals(1, records.size());
        RawSessionRecord record = records.get(0);
        assertEquals(7, record.lapNumber());
        assertEquals(30.2, record.sector1Duration());
        assertEquals("MEDIUM", record.compound());
        assertEquals(38.7, record.trackTemperature());
        assertEquals(4.512, record.gapToLeader());
        assertEquals(1.2, record.interval());
        assertEquals(4, record.position());
        verify(client).get("pit", Map.of("session_key", 9158));
        verify(client).get("race_control", Map.of("session_key", 9158));
    }

    @Test
    void noRecords_fallbackReturnsEmpty() {
        assertTrue(provider.noRecords(9158, new IllegalStateException("circuit open")).isEmpty());
    }

    private JsonNode json(String body) throws Exception {
        return mapper.readTree(body);
    }
}
