package org.jstats.pitwall_api.modules.openf1_gatherer.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.NullMarked;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Typed reads over {@link OpenF1Client}: one endpoint, one query, one list of payload records.
 */
@NullMarked
@Component
public class OpenF1Reader {

    private final OpenF1Client client;
    private final ObjectMapper mapper;

    public OpenF1Reader(OpenF1Client client, ObjectMapper mapper) {
        this.client = client;
        this.mapper = mapper;
    }

    public <T> List<T> read(OpenF1Endpoint<T> endpoint, Map<String, ?> query) {
        JsonNode body = client.get(endpoint.resource(), query);
        try {
            return Arrays.asList(mapper.treeToValue(body, endpoint.arrayType()));
        } catch (JsonProcessingException e) {
            throw new OpenF1Client.UpstreamJsonParseException(
                    "Unexpected %s payload: %s".formatted(endpoint.resource(), e.getOriginalMessage()));
        }
    }

    public <T> List<T> forSession(OpenF1Endpoint<T> endpoint, int sessionKey) {
        return read(endpoint, Map.of("session_key", sessionKey));
    }
}
