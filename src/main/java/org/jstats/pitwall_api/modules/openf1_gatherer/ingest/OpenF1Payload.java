package org.jstats.pitwall_api.modules.openf1_gatherer.ingest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.time.OffsetDateTime;

/**
 * Raw OpenF1 v1 records. Every field is optional upstream.
 */
@NullMarked
public final class OpenF1Payload {

    private OpenF1Payload() {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Lap(
            @Nullable Integer driverNumber,
            @Nullable Integer lapNumber,
            @Nullable OffsetDateTime dateStart,
            @Nullable Double lapDuration,
            @JsonProperty("duration_sector_1") @Nullable Double durationSector1,
            @JsonProperty("duration_sector_2") @Nullable Double durationSector2,
            @Nullable Boolean isPitOutLap
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Stint(
            @Nullable Integer driverNumber,
            @Nullable Integer stintNumber,
            @Nullable Integer lapStart,
            @Nullable Integer lapEnd,
            @Nullable String compound,
            @Nullable Integer tyreAgeAtStart
    ) {

        boolean covers(int lap) {
            return lapStart != null && lapStart <= lap && (lapEnd == null || lap <= lapEnd);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Weather(
            @Nullable OffsetDateTime date,
            @Nullable Double airTemperature,
            @Nullable Double trackTemperature,
            @Nullable Double humidity,
            @Nullable Integer rainfall,
            @Nullable Double windSpeed
    ) {}

    /**
     * Gaps arrive either as seconds or as text such as {@code +1 LAP}.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Interval(
            @Nullable OffsetDateTime date,
            @Nullable Integer driverNumber,
            @Nullable String gapToLeader,
            @Nullable String interval
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Position(
            @Nullable OffsetDateTime date,
            @Nullable Integer driverNumber,
            @Nullable Integer position
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PitStop(
            @Nullable OffsetDateTime date,
            @Nullable Integer driverNumber,
            @Nullable Integer lapNumber,
            @Nullable Double pitDuration
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RaceControl(
            @Nullable OffsetDateTime date,
            @Nullable Integer lapNumber,
            @Nullable String category,
            @Nullable String flag,
            @Nullable String message
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Session(
            @Nullable Integer sessionKey,
            @Nullable Integer meetingKey,
            @Nullable String sessionName,
            @Nullable String sessionType,
            @Nullable String countryName,
            @Nullable String countryCode,
            @Nullable String circuitShortName,
            @Nullable OffsetDateTime dateStart,
            @Nullable OffsetDateTime dateEnd,
            @Nullable Integer year
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Driver(
            @Nullable Integer driverNumber,
            @Nullable String broadcastName,
            @Nullable String fullName,
            @Nullable String nameAcronym,
            @Nullable String teamName,
            @Nullable String teamColour,
            @Nullable String headshotUrl,
            @Nullable String countryCode
    ) {}
}
