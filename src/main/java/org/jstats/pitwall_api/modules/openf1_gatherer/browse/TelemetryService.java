package org.jstats.pitwall_api.modules.openf1_gatherer.browse;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.jstats.pitwall_api.modules.openf1_gatherer.browse.TelemetryViews.Comparison;
import org.jstats.pitwall_api.modules.openf1_gatherer.browse.TelemetryViews.DriverCard;
import org.jstats.pitwall_api.modules.openf1_gatherer.browse.TelemetryViews.DriverComparison;
import org.jstats.pitwall_api.modules.openf1_gatherer.browse.TelemetryViews.DriverSummary;
import org.jstats.pitwall_api.modules.openf1_gatherer.browse.TelemetryViews.IntervalRow;
import org.jstats.pitwall_api.modules.openf1_gatherer.browse.TelemetryViews.Intervals;
import org.jstats.pitwall_api.modules.openf1_gatherer.browse.TelemetryViews.LapRow;
import org.jstats.pitwall_api.modules.openf1_gatherer.browse.TelemetryViews.LapStatistics;
import org.jstats.pitwall_api.modules.openf1_gatherer.browse.TelemetryViews.Laps;
import org.jstats.pitwall_api.modules.openf1_gatherer.browse.TelemetryViews.PitStops;
import org.jstats.pitwall_api.modules.openf1_gatherer.browse.TelemetryViews.RaceControl;
import org.jstats.pitwall_api.modules.openf1_gatherer.browse.TelemetryViews.Stints;
import org.jstats.pitwall_api.modules.openf1_gatherer.browse.TelemetryViews.Weather;
import org.jstats.pitwall_api.modules.openf1_gatherer.ingest.OpenF1Endpoint;
import org.jstats.pitwall_api.modules.openf1_gatherer.ingest.OpenF1Payload;
import org.jstats.pitwall_api.modules.openf1_gatherer.ingest.OpenF1Reader;
import org.jstats.pitwall_api.modules.openf1_gatherer.ingest.SessionRecordAssembler;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-session telemetry views, optionally narrowed to one driver.
 */
@NullMarked
@Service
public class TelemetryService {

    static final int RECENT_LAPS = 10;

    private final OpenF1Reader reader;

    public TelemetryService(OpenF1Reader reader) {
        this.reader = reader;
    }

    public Laps laps(int sessionKey, @Nullable Integer driverNumber) {
        List<LapRow> rows = reader.read(OpenF1Endpoint.LAPS, query(sessionKey, driverNumber)).stream()
                .map(l -> new LapRow(l.driverNumber(), l.lapNumber(), l.lapDuration(),
                        l.durationSector1(), l.durationSector2(), l.isPitOutLap()))
                .toList();
        return new Laps(sessionKey, rows.size(), rows);
    }

    public Stints stints(int sessionKey, @Nullable Integer driverNumber) {
        return new Stints(sessionKey, reader.read(OpenF1Endpoint.STINTS, query(sessionKey, driverNumber)));
    }

    /**
     * Latest gap per driver; lapped markers such as {@code +1 LAP} become null.
     */
    public Intervals intervals(int sessionKey) {
        List<IntervalRow> rows = SessionBrowseService
                .latestIntervals(reader.forSession(OpenF1Endpoint.INTERVALS, sessionKey))
                .entrySet().stream()
                .map(e -> new IntervalRow(e.getKey(),
                        SessionRecordAssembler.seconds(e.getValue().gapToLeader()),
                        SessionRecordAssembler.seconds(e.getValue().interval()),
                        e.getValue().date()))
                .toList();
        return new Intervals(sessionKey, rows);
    }

    public Weather weather(int sessionKey) {
        List<OpenF1Payload.Weather> timeline = reader.forSession(OpenF1Endpoint.WEATHER, sessionKey);
        return new Weather(sessionKey, timeline.isEmpty() ? null : timeline.get(timeline.size() - 1), timeline);
    }

    public RaceControl raceControl(int sessionKey, @Nullable String category) {
        Map<String, Object> query = query(sessionKey, null);
        if (category != null && !category.isBlank()) {
            query.put("category", category);
        }
        return new RaceControl(sessionKey, reader.read(OpenF1Endpoint.RACE_CONTROL, query));
    }

    public PitStops pitStops(int sessionKey, @Nullable Integer driverNumber) {
        return new PitStops(sessionKey, reader.read(OpenF1Endpoint.PIT_STOPS, query(sessionKey, driverNumber)));
    }

    public DriverSummary driverSummary(int sessionKey, int driverNumber) {
        Map<String, Object> query = query(sessionKey, driverNumber);
        List<OpenF1Payload.Lap> laps = reader.read(OpenF1Endpoint.LAPS, query);
        List<OpenF1Payload.Stint> stints = reader.read(OpenF1Endpoint.STINTS, query);
        List<OpenF1Payload.PitStop> pits = reader.read(OpenF1Endpoint.PIT_STOPS, query);
        OpenF1Payload.Driver info = firstOrNull(reader.read(OpenF1Endpoint.DRIVERS, query));

        DriverCard card = new DriverCard(driverNumber,
                info != null && info.fullName() != null ? info.fullName() : "Driver " + driverNumber,
                info != null && info.teamName() != null ? info.teamName() : "Unknown",
                info != null && info.teamColour() != null ? info.teamColour() : "FFFFFF");
        List<Double> times = lapTimes(laps);
        return new DriverSummary(card, sessionKey,
                new LapStatistics(laps.size(), best(times), average(times), pits.size()),
                stints, pits, laps.subList(Math.max(0, laps.size() - RECENT_LAPS), laps.size()));
    }

    public Comparison comparison(int sessionKey, List<Integer> driverNumbers) {
        Map<Integer, DriverComparison> comparison = new LinkedHashMap<>();
        for (Integer driverNumber : driverNumbers) {
            Map<String, Object> query = query(sessionKey, driverNumber);
            List<OpenF1Payload.Lap> laps = reader.read(OpenF1Endpoint.LAPS, query);
            List<Double> times = lapTimes(laps);
            comparison.put(driverNumber, new DriverComparison(
                    firstOrNull(reader.read(OpenF1Endpoint.DRIVERS, query)),
                    laps.size(), best(times), average(times),
                    reader.read(OpenF1Endpoint.STINTS, query), times));
        }
        return new Comparison(sessionKey, List.copyOf(driverNumbers), comparison);
    }

    private static Map<String, Object> query(int sessionKey, @Nullable Integer driverNumber) {
        Map<String, Object> query = new LinkedHashMap<>();
        query.put("session_key", sessionKey);
        if (driverNumber != null) {
            query.put("driver_number", driverNumber);
        }
        return query;
    }

    private static List<Double> lapTimes(List<OpenF1Payload.Lap> laps) {
        return laps.stream().map(OpenF1Payload.Lap::lapDuration).filter(Objects::nonNull).toList();
    }

    private static @Nullable Double best(List<Double> times) {
        return times.stream().min(Double::compare).orElse(null);
    }

    private static @Nullable Double average(List<Double> times) {
        return times.isEmpty() ? null : times.stream().mapToDouble(Double::doubleValue).average().orElse(0);
    }

    private static <T> @Nullable T firstOrNull(List<T> items) {
        return items.isEmpty() ? null : items.get(0);
    }
}
