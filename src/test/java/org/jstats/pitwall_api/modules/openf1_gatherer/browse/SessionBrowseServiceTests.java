package org.jstats.pitwall_api.modules.openf1_gatherer.browse;

import org.jstats.pitwall_api.modules.openf1_gatherer.browse.SessionViews.SessionList;
import org.jstats.pitwall_api.modules.openf1_gatherer.browse.SessionViews.Standing;
import org.jstats.pitwall_api.modules.openf1_gatherer.ingest.OpenF1Endpoint;
import org.jstats.pitwall_api.modules.openf1_gatherer.ingest.OpenF1Payload;
import org.jstats.pitwall_api.modules.openf1_gatherer.ingest.OpenF1Reader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class SessionBrowseServiceTests {

    static final Instant NOW = Instant.parse("2024-03-02T16:00:00Z");

    OpenF1Reader reader;

    SessionBrowseService service;

    @BeforeEach
    void setUp() {
        reader = mock(OpenF1Reader.class);
        service = new SessionBrowseService(reader, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void sessions_hideFutureAndListNewestFirst() {
        when(reader.read(eq(OpenF1Endpoint.SESSIONS), anyMap())).thenReturn(List.of(
                session(9468, "Sakhir", "2024-02-29T11:30:00Z", "2024-02-29T12:30:00Z"),
                session(9480, "Jeddah", "2024-03-09T17:00:00Z", "2024-03-09T19:00:00Z"),
                session(9472, "Sakhir", "2024-03-02T15:00:00Z", "2024-03-02T17:00:00Z")));

        SessionList list = service.sessions(2024, null, "Race", 20, false);

        assertEquals(2, list.total());
        assertEquals(9472, list.sessions().get(0).sessionKey());
        assertEquals("live", list.sessions().get(0).status());
        assertEquals(9468, list.sessions().get(1).sessionKey());
        assertEquals("finished", list.sessions().get(1).status());
        verify(reader).read(OpenF1Endpoint.SESSIONS, Map.of("year", 2024, "session_type", "Race"));
    }

    @Test
    void sessions_includeFuture_appliesLimitAfterOrdering() {
        when(reader.read(eq(OpenF1Endpoint.SESSIONS), anyMap())).thenReturn(List.of(
                session(9472, "Sakhir", "2024-03-02T15:00:00Z", "2024-03-02T17:00:00Z"),
                session(9480, "Jeddah", "2024-03-09T17:00:00Z", "2024-03-09T19:00:00Z")));

        SessionList list = service.sessions(null, " ", null, 1, true);

        assertEquals(1, list.total());
        assertEquals(9480, list.sessions().get(0).sessionKey());
        assertEquals("upcoming", list.sessions().get(0).status());
        verify(reader).read(OpenF1Endpoint.SESSIONS, Map.of());
    }

    @Test
    void status_openEndedSessionStaysLiveForFourHours() {
        OffsetDateTime start = OffsetDateTime.parse("2024-03-02T13:00:00Z");

        assertEquals("live", SessionBrowseService.status(start, null, NOW));
        assertEquals("finished", SessionBrowseService.status(start.minusHours(2), null, NOW));
        assertEquals("finished", SessionBrowseService.status(null, null, NOW));
    }

    @Test
    void latest_withoutSession_isNotFound() {
        when(reader.read(OpenF1Endpoint.SESSIONS, Map.of("session_key", "latest"))).thenReturn(List.of());

        var ex = assertThrows(ResponseStatusException.class, () -> service.latest());
        assertEquals(404, ex.getStatusCode().value());
    }

    @Test
    void session_unknownKey_isNotFound() {
        when(reader.forSession(OpenF1Endpoint.SESSIONS, 1)).thenReturn(List.of());

        var ex = assertThrows(ResponseStatusException.class, () -> service.session(1));
        assertEquals(404, ex.getStatusCode().value());
        assertEquals("Session not found: 1", ex.getReason());
    }

    @Test
    void session_countsDataAndReportsLatestWeather() {
        var early = weather("2024-03-02T15:00:00Z", 0);
        var late = weather("2024-03-02T15:30:00Z", 1);
        when(reader.forSession(OpenF1Endpoint.SESSIONS, 9472))
                .thenReturn(List.of(session(9472, "Sakhir", "2024-03-02T15:00:00Z", "2024-03-02T17:00:00Z")));
        when(reader.forSession(OpenF1Endpoint.WEATHER, 9472)).thenReturn(List.of(early, late));
        when(reader.forSession(OpenF1Endpoint.DRIVERS, 9472)).thenReturn(List.of(driver(1, "VER"), driver(44, "HAM")));
        when(reader.forSession(OpenF1Endpoint.LAPS, 9472)).thenReturn(List.of(lap(1, 1, 95.0)));

        var detail = service.session(9472);

        assertEquals(2, detail.driverCount());
        assertEquals(1, detail.totalLaps());
        assertEquals(0, detail.stintCount());
        assertEquals(2, detail.weatherSamples());
        assertSame(late, detail.weatherLatest());
    }

    @Test
    void standings_orderByLatestGapToLeader() {
        when(reader.forSession(OpenF1Endpoint.DRIVERS, 9472))
                .thenReturn(List.of(driver(16, "LEC"), driver(44, "HAM"), driver(1, "VER")));
        when(reader.forSession(OpenF1Endpoint.INTERVALS, 9472)).thenReturn(List.of(
                interval("2024-03-02T15:30:00Z", 1, "0", null),
                interval("2024-03-02T15:30:00Z", 16, "2.1", "2.1"),
                interval("2024-03-02T15:31:00Z", 16, "+1 LAP", "+1 LAP"),
                interval("2024-03-02T15:30:00Z", 44, "8.4", "6.3")));
        when(reader.forSession(OpenF1Endpoint.LAPS, 9472)).thenReturn(List.of(
                lap(1, 1, 96.0), lap(1, 2, 95.1), lap(44, 1, 97.0), lap(16, 1, 96.5)));

        List<Standing> standings = service.standings(9472).standings();

        assertEquals(List.of(1, 44, 16), standings.stream().map(Standing::driverNumber).toList());
        assertEquals(List.of(1, 2, 3), standings.stream().map(Standing::position).toList());
        assertEquals(0.0, standings.get(0).gapToLeader());
        assertEquals(2, standings.get(0).laps());
        assertEquals(95.1, standings.get(0).bestLap());
        assertNull(standings.get(2).gapToLeader());
        assertEquals("HAM", standings.get(1).name());
    }

    @Test
    void standings_withoutIntervals_orderByLapsThenBestLap() {
        when(reader.forSession(OpenF1Endpoint.DRIVERS, 9472))
                .thenReturn(List.of(driver(16, "LEC"), driver(44, "HAM"), driver(1, "VER")));
        when(reader.forSession(OpenF1Endpoint.INTERVALS, 9472)).thenReturn(List.of());
        when(reader.forSession(OpenF1Endpoint.LAPS, 9472)).thenReturn(List.of(
                lap(16, 1, 96.5), lap(44, 1, 97.0), lap(44, 2, 94.8), lap(1, 1, 96.0), lap(1, 2, 95.1)));

        List<Standing> standings = service.standings(9472).standings();

        assertEquals(List.of(44, 1, 16), standings.stream().map(Standing::driverNumber).toList());
    }

    @Test
    void shortName_fallsBackFromAcronymToFullName() {
        var noAcronym = new OpenF1Payload.Driver(55, null, "Carlos Sainz", null, null, null, null, null);
        var nothing = new OpenF1Payload.Driver(99, null, null, null, null, null, null, null);

        assertEquals("CSA", SessionBrowseService.shortName(noAcronym));
        assertEquals("DRV99", SessionBrowseService.shortName(nothing));
    }

    @Test
    void yearsAndCircuits_areDistinct() {
        when(reader.read(OpenF1Endpoint.SESSIONS, Map.of())).thenReturn(List.of(
                session(7763, "Sakhir", "2023-03-05T15:00:00Z", null, 2023),
                session(9472, "Sakhir", "2024-03-02T15:00:00Z", null, 2024),
                session(9480, "Jeddah", "2024-03-09T17:00:00Z", null, 2024)));

        assertEquals(List.of(2024, 2023), service.years().years());
        assertEquals(List.of("Sakhir", "Jeddah"),
                service.circuits(null).circuits().stream().map(SessionViews.Circuit::circuitShortName).toList());
    }

    private static OpenF1Payload.Session session(int key, String circuit, String start, String end) {
        return session(key, circuit, start, end, 2024);
    }

    private static OpenF1Payload.Session session(int key, String circuit, String start, String end, int year) {
        return new OpenF1Payload.Session(key, 1229, "Race", "Race", "Bahrain", "BRN", circuit,
                OffsetDateTime.parse(start), end == null ? null : OffsetDateTime.parse(end), year);
    }

    private static OpenF1Payload.Driver driver(int number, String acronym) {
        return new OpenF1Payload.Driver(number, null, null, acronym, "Team " + number, "3671C6", null, null);
    }

    private static OpenF1Payload.Lap lap(int driver, int lap, double duration) {
        return new OpenF1Payload.Lap(driver, lap, null, duration, null, null, false);
    }

    private static OpenF1Payload.Interval interval(String date, int driver, String gap, String interval) {
        return new OpenF1Payload.Interval(OffsetDateTime.parse(date), driver, gap, interval);
    }

    private static OpenF1Payload.Weather weather(String date, int rainfall) {
        return new OpenF1Payload.Weather(OffsetDateTime.parse(date), 24.0, 38.0, 40.0, rainfall, 2.0);
    }
}
