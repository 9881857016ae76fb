package org.jstats.pitwall_api.modules.openf1_gatherer.browse;

import org.jspecify.annotations.Nullable;
import org.jstats.pitwall_api.modules.openf1_gatherer.ingest.OpenF1Payload;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

/**
 * Response shapes of the per-session telemetry endpoints.
 */
public final class TelemetryViews {

    private TelemetryViews() {
    }

    public record LapRow(
            @Nullable Integer driverNumber,
            @Nullable Integer lapNumber,
            @Nullable Double lapDuration,
            @Nullable Double sector1Time,
            @Nullable Double sector2Time,
            @Nullable Boolean isPitOutLap
    ) {}

    public record Laps(int sessionKey, int totalLaps, List<LapRow> laps) {}

    public record Stints(int sessionKey, List<OpenF1Payload.Stint> stints) {}

    public record IntervalRow(
            int driverNumber,
            @Nullable Double gapToLeader,
            @Nullable Double interval,
            @Nullable OffsetDateTime date
    ) {}

    public record Intervals(int sessionKey, List<IntervalRow> intervals) {}

    public record Weather(int sessionKey, OpenF1Payload.@Nullable Weather current, List<OpenF1Payload.Weather> timeline) {}

    public record RaceControl(int sessionKey, List<OpenF1Payload.RaceControl> messages) {}

    public record PitStops(int sessionKey, List<OpenF1Payload.PitStop> pitStops) {}

    public record DriverCard(int number, String name, String team, String teamColour) {}

    public record LapStatistics(int totalLaps, @Nullable Double bestLap, @Nullable Double averageLap, int totalPitStops) {}

    public record DriverSummary(
            DriverCard driver,
            int sessionKey,
            LapStatistics statistics,
            List<OpenF1Payload.Stint> stints,
            List<OpenF1Payload.PitStop> pitStops,
            List<OpenF1Payload.Lap> recentLaps
    ) {}

    public record DriverComparison(
            OpenF1Payload.@Nullable Driver driverInfo,
            int lapCount,
            @Nullable Double bestLap,
            @Nullable Double averageLap,
            List<OpenF1Payload.Stint> stints,
            List<Double> lapTimes
    ) {}

    public record Comparison(int sessionKey, List<Integer> drivers, Map<Integer, DriverComparison> comparison) {}
}
