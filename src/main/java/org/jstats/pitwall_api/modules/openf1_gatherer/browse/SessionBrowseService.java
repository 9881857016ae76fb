package org.jstats.pitwall_api.modules.openf1_gatherer.browse;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.jstats.pitwall_api.modules.openf1_gatherer.browse.SessionViews.Circuit;
import org.jstats.pitwall_api.modules.openf1_gatherer.browse.SessionViews.Circuits;
import org.jstats.pitwall_api.modules.openf1_gatherer.browse.SessionViews.DriverList;
import org.jstats.pitwall_api.modules.openf1_gatherer.browse.SessionViews.SessionDetail;
import org.jstats.pitwall_api.modules.openf1_gatherer.browse.SessionViews.SessionList;
import org.jstats.pitwall_api.modules.openf1_gatherer.browse.SessionViews.SessionSummary;
import org.jstats.pitwall_api.modules.openf1_gatherer.browse.SessionViews.Standing;
import org.jstats.pitwall_api.modules.openf1_gatherer.browse.SessionViews.Standings;
import org.jstats.pitwall_api.modules.openf1_gatherer.browse.SessionViews.Years;
import org.jstats.pitwall_api.modules.openf1_gatherer.ingest.OpenF1Endpoint;
import org.jstats.pitwall_api.modules.openf1_gatherer.ingest.OpenF1Payload;
import org.jstats.pitwall_api.modules.openf1_gatherer.ingest.OpenF1Reader;
import org.jstats.pitwall_api.modules.openf1_gatherer.ingest.SessionRecordAssembler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Session discovery over OpenF1: what ran, who drove, and where they stand.
 */
@NullMarked
@Service
public class SessionBrowseService {

    private static final Logger log = LoggerFactory.getLogger(SessionBrowseService.class);

    // a session without an end date counts as live this long after its start
    static final Duration OPEN_ENDED_LIVE_WINDOW = Duration.ofHours(4);
    static final double UNKNOWN_GAP = 9999;

    private final OpenF1Reader reader;
    private final Clock clock;

    public SessionBrowseService(OpenF1Reader reader, Clock clock) {
        this.reader = reader;
        this.clock = clock;
    }

    /**
     * Newest sessions first. Sessions that have not started are left out unless {@code includeFuture}.
     */
    public SessionList sessions(@Nullable Integer year, @Nullable String country, @Nullable String sessionType,
                                int limit, boolean includeFuture) {
        Map<String, Object> query = new LinkedHashMap<>();
        if (year != null) query.put("year", year);
        if (country != null && !country.isBlank()) query.put("country_name", country);
        if (sessionType != null && !sessionType.isBlank()) query.put("session_type", sessionType);

        Instant now = clock.instant();
        List<SessionSummary> sessions = reader.read(OpenF1Endpoint.SESSIONS, query).stream()
                .filter(s -> includeFuture || s.dateStart() == null || !s.dateStart().toInstant().isAfter(now))
                .sorted(Comparator.comparing(OpenF1Payload.Session::dateStart,
                        Comparator.nullsLast(Comparator.<OffsetDateTime>reverseOrder())))
                .limit(limit)
                .map(s -> summary(s, now))
                .toList();
        return new SessionList(sessions.size(), sessions);
    }

    public SessionSummary latest() {
        return reader.read(OpenF1Endpoint.SESSIONS, Map.of("session_key", "latest")).stream()
                .findFirst()
                .map(s -> summary(s, clock.instant()))
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "No session found"));
    }

    public SessionDetail session(int sessionKey) {
        OpenF1Payload.Session meta = reader.forSession(OpenF1Endpoint.SESSIONS, sessionKey).stream()
                .findFirst()
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Session not found: " + sessionKey));
        List<OpenF1Payload.Weather> weather = reader.forSession(OpenF1Endpoint.WEATHER, sessionKey);
        return new SessionDetail(
                summary(meta, clock.instant()),
                reader.forSession(OpenF1Endpoint.DRIVERS, sessionKey).size(),
                reader.forSession(OpenF1Endpoint.LAPS, sessionKey).size(),
                reader.forSession(OpenF1Endpoint.STINTS, sessionKey).size(),
                weather.size(),
                reader.forSession(OpenF1Endpoint.RACE_CONTROL, sessionKey).size(),
                weather.isEmpty() ? null : weather.get(weather.size() - 1));
    }

    public DriverList drivers(int sessionKey) {
        List<OpenF1Payload.Driver> drivers = reader.forSession(OpenF1Endpoint.DRIVERS, sessionKey);
        return new DriverList(sessionKey, drivers.size(), drivers);
    }

    /**
     * Orders drivers by their latest gap to the leader; without interval data, by laps completed then best lap.
     */
    public Standings standings(int sessionKey) {
        List<OpenF1Payload.Driver> drivers = reader.forSession(OpenF1Endpoint.DRIVERS, sessionKey);
        List<OpenF1Payload.Interval> intervals = reader.forSession(OpenF1Endpoint.INTERVALS, sessionKey);
        List<OpenF1Payload.Lap> laps = reader.forSession(OpenF1Endpoint.LAPS, sessionKey);

        Map<Integer, OpenF1Payload.Interval> latestGap = latestIntervals(intervals);
        Map<Integer, Integer> lapCounts = new HashMap<>();
        Map<Integer, Double> bestLaps = new HashMap<>();
        for (OpenF1Payload.Lap lap : laps) {
            if (lap.driverNumber() == null) continue;
            lapCounts.merge(lap.driverNumber(), 1, Integer::sum);
            if (lap.lapDuration() != null) {
                bestLaps.merge(lap.driverNumber(), lap.lapDuration(), Math::min);
            }
        }

        List<Standing> rows = new ArrayList<>();
        for (OpenF1Payload.Driver driver : drivers) {
            Integer number = driver.driverNumber();
            if (number == null) continue;
            OpenF1Payload.Interval gap = latestGap.get(number);
            rows.add(new Standing(0, number, shortName(driver), fullName(driver),
                    Objects.requireNonNullElse(driver.teamName(), ""),
                    Objects.requireNonNullElse(driver.teamColour(), "333333"),
                    gap == null ? null : SessionRecordAssembler.seconds(gap.gapToLeader()),
                    gap == null ? null : SessionRecordAssembler.seconds(gap.interval()),
                    lapCounts.getOrDefault(number, 0),
                    bestLaps.get(number)));
        }

        Comparator<Standing> order = intervals.isEmpty()
                ? Comparator.comparingInt(Standing::laps).reversed()
                        .thenComparingDouble(s -> s.bestLap() == null ? UNKNOWN_GAP : s.bestLap())
                : Comparator.<Standing>comparingDouble(s -> s.gapToLeader() == null ? UNKNOWN_GAP : s.gapToLeader())
                        .thenComparingInt(Standing::laps);
        rows.sort(order);

        List<Standing> ranked = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            Standing s = rows.get(i);
            ranked.add(new Standing(i + 1, s.driverNumber(), s.name(), s.fullName(), s.teamName(), s.teamColour(),
                    s.gapToLeader(), s.interval(), s.laps(), s.bestLap()));
        }
        log.info("Built standings for {} drivers in session {}", ranked.size(), sessionKey);
        return new Standings(sessionKey, ranked);
    }

    public Years years() {
        List<Integer> years = reader.read(OpenF1Endpoint.SESSIONS, Map.of()).stream()
                .map(OpenF1Payload.Session::year)
                .filter(Objects::nonNull)
                .distinct()
                .sorted(Comparator.reverseOrder())
                .toList();
        return new Years(years);
    }

    public Circuits circuits(@Nullable Integer year) {
        Map<String, Object> query = year == null ? Map.of() : Map.of("year", year);
        Map<String, Circuit> circuits = new LinkedHashMap<>();
        for (OpenF1Payload.Session s : reader.read(OpenF1Endpoint.SESSIONS, query)) {
            String name = s.circuitShortName();
            if (name != null && !circuits.containsKey(name)) {
                circuits.put(name, new Circuit(name, s.countryName(), s.countryCode()));
            }
        }
        return new Circuits(List.copyOf(circuits.values()));
    }

    static Map<Integer, OpenF1Payload.Interval> latestIntervals(List<OpenF1Payload.Interval> intervals) {
        Map<Integer, OpenF1Payload.Interval> latest = new LinkedHashMap<>();
        for (OpenF1Payload.Interval interval : intervals) {
            Integer number = interval.driverNumber();
            if (number == null) continue;
            OpenF1Payload.Interval current = latest.get(number);
            if (current == null || isLater(interval.date(), current.date())) {
                latest.put(number, interval);
            }
        }
        return latest;
    }

    private static boolean isLater(@Nullable OffsetDateTime candidate, @Nullable OffsetDateTime current) {
        return candidate != null && (current == null || candidate.isAfter(current));
    }

    static String status(@Nullable OffsetDateTime start, @Nullable OffsetDateTime end, Instant now) {
        if (start == null) {
            return "finished";
        }
        if (now.isBefore(start.toInstant())) {
            return "upcoming";
        }
        Instant liveUntil = end != null ? end.toInstant() : start.toInstant().plus(OPEN_ENDED_LIVE_WINDOW);
        return now.isBefore(liveUntil) ? "live" : "finished";
    }

    static String shortName(OpenF1Payload.Driver driver) {
        if (driver.nameAcronym() != null && !driver.nameAcronym().isBlank()) return driver.nameAcronym();
        if (driver.broadcastName() != null && !driver.broadcastName().isBlank()) return driver.broadcastName();
        String full = driver.fullName();
        if (full != null && !full.isBlank()) {
            String[] parts = full.trim().split("\\s+");
            if (parts.length >= 2) {
                String last = parts[parts.length - 1];
                return (parts[0].charAt(0) + last.substring(0, Math.min(2, last.length()))).toUpperCase();
            }
            return parts[0].substring(0, Math.min(3, parts[0].length())).toUpperCase();
        }
        return "DRV" + driver.driverNumber();
    }

    private static String fullName(OpenF1Payload.Driver driver) {
        String full = driver.fullName();
        return full != null && !full.isBlank() ? full : "Driver " + driver.driverNumber();
    }

    private static SessionSummary summary(OpenF1Payload.Session s, Instant now) {
        return new SessionSummary(s.sessionKey(), s.sessionName(), s.sessionType(), s.countryName(), s.countryCode(),
                s.circuitShortName(), s.dateStart(), s.dateEnd(), s.year(), status(s.dateStart(), s.dateEnd(), now));
    }
}
