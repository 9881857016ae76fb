package org.jstats.pitwall_api.modules.openf1_gatherer.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class OpenF1ReaderTests {

    OpenF1Client client;
    ObjectMapper mapper;

    OpenF1Reader reader;

    @BeforeEach
    void setUp() {
        client = mock(OpenF1Client.class);
        mapper = Jackson2ObjectMapperBuilder.json()
                .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .build();
        reader = new OpenF1Reader(client, mapper);
    }

    @Test
    void read_passesQueryThroughAndDecodesSessions() throws Exception {
        Map<String, Object> query = Map.of("year", 2024, "session_type", "Race");
        when(client.get("sessions", query)).thenReturn(json("""
                [{"session_key":9472,"meeting_key":1229,"session_name":"Race","session_type":"Race",
                  "country_name":"Bahrain","country_code":"BRN","circuit_short_name":"Sakhir",
                  "date_start":"2024-03-02T15:00:00+00:00","date_end":"2024-03-02T17:00:00+00:00",
                  "year":2024,"gmt_offset":"03:00:00"}]
                """));

        List<OpenF1Payload.Session> sessions = reader.read(OpenF1Endpoint.SESSIONS, query);

        assertEquals(1, sessions.size());
        OpenF1Payload.Session session = sessions.get(0);
        assertEquals(9472, session.sessionKey());
        assertEquals("Sakhir", session.circuitShortName());
        assertEquals(OffsetDateTime.parse("2024-03-02T15:00:00+00:00"), session.dateStart());
        assertEquals(2024, session.year());
    }

    @Test
    void forSession_queriesBySessionKey() {
        when(client.get("drivers", Map.of("session_key", 9158))).thenReturn(JsonNodeFactory.instance.arrayNode());

        assertTrue(reader.forSession(OpenF1Endpoint.DRIVERS, 9158).isEmpty());
        verify(client).get("drivers", Map.of("session_key", 9158));
    }

    @Test
    void read_unexpectedShape_isParseError() throws Exception {
        when(client.get("laps", Map.of("session_key", 1))).thenReturn(json("[{\"lap_number\":\"seven\"}]"));

        var ex = assertThrows(OpenF1Client.UpstreamJsonParseException.class,
                () -> reader.forSession(OpenF1Endpoint.LAPS, 1));
        assertTrue(ex.getMessage().startsWith("Unexpected laps payload"));
    }

    private JsonNode json(String body) throws Exception {
        return mapper.readTree(body);
    }
}
