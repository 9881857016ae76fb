package org.jstats.pitwall_api.modules.openf1_gatherer.ingest;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import org.jspecify.annotations.NullMarked;
import org.jstats.pitwall_api.modules.openf1_gatherer.ingest.SessionRecordAssembler.SessionPayloads;
import org.jstats.pitwall_api.modules.strategy_engine.data.RawSessionRecord;
import org.jstats.pitwall_api.modules.strategy_engine.data.SessionRecordProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Session records backed by the OpenF1 API. An unreachable upstream degrades to no records.
 */
@NullMarked
@Service
public class OpenF1SessionRecordProvider implements SessionRecordProvider {

    private static final Logger log = LoggerFactory.getLogger(OpenF1SessionRecordProvider.class);

    private final OpenF1Reader reader;
    private final SessionRecordAssembler assembler;

    public OpenF1SessionRecordProvider(OpenF1Reader reader, SessionRecordAssembler assembler) {
        this.reader = reader;
        this.assembler = assembler;
    }

    @Override
    @CircuitBreaker(name = "openf1", fallbackMethod = "noRecords")
    public List<RawSessionRecord> fetchSession(int sessionKey) {
        var payloads = new SessionPayloads(
                reader.forSession(OpenF1Endpoint.LAPS, sessionKey),
                reader.forSession(OpenF1Endpoint.STINTS, sessionKey),
                reader.forSession(OpenF1Endpoint.WEATHER, sessionKey),
                reader.forSession(OpenF1Endpoint.INTERVALS, sessionKey),
                reader.forSession(OpenF1Endpoint.POSITIONS, sessionKey),
                reader.forSession(OpenF1Endpoint.PIT_STOPS, sessionKey),
                reader.forSession(OpenF1Endpoint.RACE_CONTROL, sessionKey));
        List<RawSessionRecord> records = assembler.assemble(sessionKey, payloads);
        log.info("Fetched {} lap records for OpenF1 session {}", records.size(), sessionKey);
        return records;
    }

    List<RawSessionRecord> noRecords(int sessionKey, Throwable cause) {
        log.warn("OpenF1 session {} unavailable, continuing without real data: {}", sessionKey, cause.toString());
        return List.of();
    }
}
