package org.jstats.pitwall_api.modules.openf1_gatherer.ingest;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.jstats.pitwall_api.modules.strategy_engine.data.RawSessionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;

/**
 * Joins the per-endpoint OpenF1 payloads of one session into one record per driver lap.
 * Time-stamped streams (weather, intervals, positions) are sampled at the lap's start time.
 */
@NullMarked
@Component
public class SessionRecordAssembler {

    private static final Logger log = LoggerFactory.getLogger(SessionRecordAssembler.class);

    static final String SAFETY_CAR_CATEGORY = "SafetyCar";

    public record SessionPayloads(
            List<OpenF1Payload.Lap> laps,
            List<OpenF1Payload.Stint> stints,
            List<OpenF1Payload.Weather> weather,
            List<OpenF1Payload.Interval> intervals,
            List<OpenF1Payload.Position> positions,
            List<OpenF1Payload.PitStop> pitStops,
            List<OpenF1Payload.RaceControl> raceControl
    ) {

        public static SessionPayloads empty() {
            return new SessionPayloads(List.of(), List.of(), List.of(), List.of(), List.of(), List.of(), List.of());
        }
    }

    public List<RawSessionRecord> assemble(int sessionKey, SessionPayloads payloads) {
        NavigableMap<OffsetDateTime, OpenF1Payload.Weather> weather = new TreeMap<>();
        payloads.weather().forEach(w -> {
            if (w.date() != null) weather.put(w.date(), w);
        });
        Map<Integer, NavigableMap<OffsetDateTime, OpenF1Payload.Interval>> intervals = new HashMap<>();
        payloads.intervals().forEach(i -> {
            if (i.date() != null && i.driverNumber() != null) {
                intervals.computeIfAbsent(i.driverNumber(), d -> new TreeMap<>()).put(i.date(), i);
            }
        });
        Map<Integer, NavigableMap<OffsetDateTime, OpenF1Payload.Position>> positions = new HashMap<>();
        payloads.positions().forEach(p -> {
            if (p.date() != null && p.driverNumber() != null) {
                positions.computeIfAbsent(p.driverNumber(), d -> new TreeMap<>()).put(p.date(), p);
            }
        });
        Map<Integer, List<OpenF1Payload.Stint>> stints = new HashMap<>();
        payloads.stints().forEach(s -> {
            if (s.driverNumber() != null) {
                stints.computeIfAbsent(s.driverNumber(), d -> new ArrayList<>()).add(s);
            }
        });
        Set<String> pitLaps = new HashSet<>();
        payloads.pitStops().forEach(p -> {
            if (p.driverNumber() != null && p.lapNumber() != null) {
                pitLaps.add(p.driverNumber() + ":" + p.lapNumber());
            }
        });
        Set<Integer> safetyCarLaps = new HashSet<>();
        Set<Integer> vscLaps = new HashSet<>();
        payloads.raceControl().forEach(rc -> {
            if (rc.lapNumber() != null && SAFETY_CAR_CATEGORY.equalsIgnoreCase(rc.category())) {
                String message = rc.message() == null ? "" : rc.message().toUpperCase(Locale.ROOT);
                (message.contains("VIRTUAL") ? vscLaps : safetyCarLaps).add(rc.lapNumber());
            }
        });

        List<RawSessionRecord> records = new ArrayList<>(payloads.laps().size());
        int skipped = 0;
        for (OpenF1Payload.Lap lap : payloads.laps()) {
            if (lap.driverNumber() == null || lap.lapNumber() == null) {
                skipped++;
                continue;
            }
            int driver = lap.driverNumber();
            int lapNumber = lap.lapNumber();
            OffsetDateTime at = lap.dateStart();

            var builder = RawSessionRecord.builder(sessionKey, driver)
                    .lap(lapNumber, lap.lapDuration())
                    .sectors(lap.durationSector1(), lap.durationSector2())
                    .flags(pitLaps.contains(driver + ":" + lapNumber),
                            safetyCarLaps.contains(lapNumber),
                            vscLaps.contains(lapNumber));

            OpenF1Payload.Stint stint = stintFor(stints.getOrDefault(driver, List.of()), lapNumber);
            if (stint != null) {
                builder.stint(stint.compound(), stint.stintNumber(), stint.lapStart(), stint.lapEnd(), stint.tyreAgeAtStart());
            }
            OpenF1Payload.Weather w = at(weather, at);
            if (w != null) {
                builder.weather(w.trackTemperature(), w.airTemperature(), w.humidity(),
                        w.rainfall() != null && w.rainfall() > 0, w.windSpeed());
            }
            OpenF1Payload.Interval gap = at(intervals.get(driver), at);
            if (gap != null) {
                builder.gaps(seconds(gap.gapToLeader()), seconds(gap.interval()));
            }
            OpenF1Payload.Position position = at(positions.get(driver), at);
            if (position != null) {
                builder.position(position.position());
            }
            records.add(builder.build());
        }
        if (log.isDebugEnabled()) {
            log.debug("Assembled {} records for session {} ({} laps without driver or lap number)",
                    records.size(), sessionKey, skipped);
        }
        return records;
    }

    private static OpenF1Payload.@Nullable Stint stintFor(List<OpenF1Payload.Stint> stints, int lap) {
        for (OpenF1Payload.Stint stint : stints) {
            if (stint.covers(lap)) {
                return stint;
            }
        }
        return null;
    }

    /**
     * Latest sample at or before {@code time}, or the earliest sample when the lap predates them all.
     */
    private static <T> @Nullable T at(@Nullable NavigableMap<OffsetDateTime, T> series, @Nullable OffsetDateTime time) {
        if (series == null || series.isEmpty()) {
            return null;
        }
        if (time == null) {
            return series.lastEntry().getValue();
        }
        var entry = series.floorEntry(time);
        return entry != null ? entry.getValue() : series.firstEntry().getValue();
    }

    /**
     * Parses a gap in seconds; lapped markers such as {@code +1 LAP} yield null.
     */
    public static @Nullable Double seconds(@Nullable String gap) {
        if (gap == null || gap.isBlank()) {
            return null;
        }
        try {
            return Double.parseDouble(gap.trim().replace("+", ""));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
