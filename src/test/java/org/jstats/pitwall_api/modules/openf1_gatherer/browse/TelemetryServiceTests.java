package org.jstats.pitwall_api.modules.openf1_gatherer.browse;

import org.jstats.pitwall_api.modules.openf1_gatherer.browse.TelemetryViews.DriverSummary;
import org.jstats.pitwall_api.modules.openf1_gatherer.browse.TelemetryViews.IntervalRow;
import org.jstats.pitwall_api.modules.openf1_gatherer.ingest.OpenF1Endpoint;
import org.jstats.pitwall_api.modules.openf1_gatherer.ingest.OpenF1Payload;
import org.jstats.pitwall_api.modules.openf1_gatherer.ingest.OpenF1Reader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class TelemetryServiceTests {

    OpenF1Reader reader;

    TelemetryService service;

    @BeforeEach
    void setUp() {
        reader = mock(OpenF1Reader.class);
        service = new TelemetryService(reader);
    }

    @Test
    void laps_narrowToDriverWhenGiven() {
        when(reader.read(OpenF1Endpoint.LAPS, Map.of("session_key", 9158, "driver_number", 44)))
                .thenReturn(List.of(lap(44, 1, 95.2), lap(44, 2, null)));

        var laps = service.laps(9158, 44);

        assertEquals(2, laps.totalLaps());
        assertEquals(95.2, laps.laps().get(0).lapDuration());
        assertNull(laps.laps().get(1).lapDuration());
    }

    @Test
    void stintsAndPitStops_withoutDriver_querySessionOnly() {
        service.stints(9158, null);
        service.pitStops(9158, null);

        verify(reader).read(OpenF1Endpoint.STINTS, Map.of("session_key", 9158));
        verify(reader).read(OpenF1Endpoint.PIT_STOPS, Map.of("session_key", 9158));
    }

    @Test
    void raceControl_addsCategoryFilter() {
        service.raceControl(9158, "Flag");

        verify(reader).read(OpenF1Endpoint.RACE_CONTROL, Map.of("session_key", 9158, "category", "Flag"));
    }

    @Test
    void intervals_keepLatestPerDriver_andDropLappedMarkers() {
        when(reader.forSession(OpenF1Endpoint.INTERVALS, 9158)).thenReturn(List.of(
                new OpenF1Payload.Interval(OffsetDateTime.parse("2024-03-02T15:30:00Z"), 44, "8.4", "6.3"),
                new OpenF1Payload.Interval(OffsetDateTime.parse("2024-03-02T15:31:00Z"), 44, "9.1", "6.0"),
                new OpenF1Payload.Interval(OffsetDateTime.parse("2024-03-02T15:31:00Z"), 2, "+1 LAP", "+1 LAP")));

        List<IntervalRow> rows = service.intervals(9158).intervals();

        assertEquals(2, rows.size());
        assertEquals(44, rows.get(0).driverNumber());
        assertEquals(9.1, rows.get(0).gapToLeader());
        assertNull(rows.get(1).gapToLeader());
        assertNull(rows.get(1).interval());
    }

    @Test
    void weather_reportsLastSampleAsCurrent() {
        var first = new OpenF1Payload.Weather(OffsetDateTime.parse("2024-03-02T15:00:00Z"), 24.0, 38.0, 40.0, 0, 2.0);
        var last = new OpenF1Payload.Weather(OffsetDateTime.parse("2024-03-02T15:01:00Z"), 24.1, 38.2, 41.0, 1, 2.2);
        when(reader.forSession(OpenF1Endpoint.WEATHER, 9158)).thenReturn(List.of(first, last));

        var weather = service.weather(9158);

        assertSame(last, weather.current());
        assertEquals(2, weather.timeline().size());
        assertNull(service.weather(1).current());
    }

    @Test
    void driverSummary_computesLapStatisticsAndKeepsRecentLaps() {
        Map<String, Object> query = Map.of("session_key", 9158, "driver_number", 44);
        List<OpenF1Payload.Lap> laps = new ArrayList<>();
        for (int i = 1; i <= 12; i++) {
            laps.add(lap(44, i, i == 1 ? null : 90.0 + i));
        }
        when(reader.read(OpenF1Endpoint.LAPS, query)).thenReturn(laps);
        when(reader.read(OpenF1Endpoint.PIT_STOPS, query))
                .thenReturn(List.of(new OpenF1Payload.PitStop(null, 44, 6, 22.4)));
        when(reader.read(OpenF1Endpoint.DRIVERS, query)).thenReturn(List.of(
                new OpenF1Payload.Driver(44, "L HAMILTON", "Lewis HAMILTON", "HAM", "Mercedes", "27F4D2", null, "GBR")));

        DriverSummary summary = service.driverSummary(9158, 44);

        assertEquals("Lewis HAMILTON", summary.driver().name());
        assertEquals("Mercedes", summary.driver().team());
        assertEquals(12, summary.statistics().totalLaps());
        assertEquals(92.0, summary.statistics().bestLap());
        assertEquals(97.0, summary.statistics().averageLap(), 1e-9);
        assertEquals(1, summary.statistics().totalPitStops());
        assertEquals(TelemetryService.RECENT_LAPS, summary.recentLaps().size());
        assertEquals(3, summary.recentLaps().get(0).lapNumber());
    }

    @Test
    void driverSummary_unknownDriver_usesPlaceholders() {
        DriverSummary summary = service.driverSummary(9158, 7);

        assertEquals("Driver 7", summary.driver().name());
        assertEquals("Unknown", summary.driver().team());
        assertEquals("FFFFFF", summary.driver().teamColour());
        assertNull(summary.statistics().bestLap());
        assertNull(summary.statistics().averageLap());
    }

    @Test
    void comparison_keepsRequestedDriverOrder() {
        when(reader.read(OpenF1Endpoint.LAPS, Map.of("session_key", 9158, "driver_number", 16)))
                .thenReturn(List.of(lap(16, 1, 96.0), lap(16, 2, 94.0)));
        when(reader.read(OpenF1Endpoint.LAPS, Map.of("session_key", 9158, "driver_number", 1)))
                .thenReturn(List.of(lap(1, 1, 95.0)));

        var comparison = service.comparison(9158, List.of(16, 1));

        assertEquals(List.of(16, 1), List.copyOf(comparison.comparison().keySet()));
        assertEquals(94.0, comparison.comparison().get(16).bestLap());
        assertEquals(95.0, comparison.comparison().get(16).averageLap());
        assertEquals(List.of(96.0, 94.0), comparison.comparison().get(16).lapTimes());
        assertEquals(1, comparison.comparison().get(1).lapCount());
    }

    private static OpenF1Payload.Lap lap(int driver, int lap, Double duration) {
        return new OpenF1Payload.Lap(driver, lap, null, duration, null, null, false);
    }
}
