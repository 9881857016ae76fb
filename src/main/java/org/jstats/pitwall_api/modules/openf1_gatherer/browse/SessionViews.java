package org.jstats.pitwall_api.modules.openf1_gatherer.browse;

import org.jspecify.annotations.Nullable;
import org.jstats.pitwall_api.modules.openf1_gatherer.ingest.OpenF1Payload;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Response shapes of the session discovery endpoints.
 */
public final class SessionViews {

    private SessionViews() {
    }

    /**
     * @param status {@code upcoming}, {@code live} or {@code finished}, relative to now
     */
    public record SessionSummary(
            @Nullable Integer sessionKey,
            @Nullable String sessionName,
            @Nullable String sessionType,
            @Nullable String countryName,
            @Nullable String countryCode,
            @Nullable String circuitShortName,
            @Nullable OffsetDateTime dateStart,
            @Nullable OffsetDateTime dateEnd,
            @Nullable Integer year,
            String status
    ) {}

    public record SessionList(int total, List<SessionSummary> sessions) {}

    public record SessionDetail(
            SessionSummary session,
            int driverCount,
            int totalLaps,
            int stintCount,
            int weatherSamples,
            int raceControlMessages,
            OpenF1Payload.@Nullable Weather weatherLatest
    ) {}

    public record DriverList(int sessionKey, int driverCount, List<OpenF1Payload.Driver> drivers) {}

    public record Standing(
            int position,
            int driverNumber,
            String name,
            String fullName,
            String teamName,
            String teamColour,
            @Nullable Double gapToLeader,
            @Nullable Double interval,
            int laps,
            @Nullable Double bestLap
    ) {}

    public record Standings(int sessionKey, List<Standing> standings) {}

    public record Years(List<Integer> years) {}

    public record Circuit(String circuitShortName, @Nullable String countryName, @Nullable String countryCode) {}

    public record Circuits(List<Circuit> circuits) {}
}
