package org.jstats.pitwall_api.modules.strategy_engine.data;

import org.jspecify.annotations.Nullable;

/**
 * One observed lap of one driver in one session, joined from the telemetry endpoints.
 * Every field except the identifiers may be absent.
 */
public record RawSessionRecord(
        int sessionKey,
        int driverNumber,
        @Nullable Integer lapNumber,
        @Nullable Double lapDuration,
        @Nullable Double sector1Duration,
        @Nullable Double sector2Duration,
        @Nullable String compound,
        @Nullable Integer stintNumber,
        @Nullable Integer stintLapStart,
        @Nullable Integer stintLapEnd,
        @Nullable Integer tyreAgeAtStart,
        @Nullable Double trackTemperature,
        @Nullable Double airTemperature,
        @Nullable Double humidity,
        @Nullable Boolean rainfall,
        @Nullable Double windSpeed,
        @Nullable Double gapToLeader,
        @Nullable Double interval,
        @Nullable Integer position,
        boolean pitInLap,
        boolean safetyCar,
        boolean virtualSafetyCar
) {

    public boolean hasWeather() {
        return trackTemperature != null && airTemperature != null && humidity != null;
    }

    public boolean hasStint() {
        return compound != null && stintLapStart != null && stintLapEnd != null;
    }

    public static Builder builder(int sessionKey, int driverNumber) {
        return new Builder(sessionKey, driverNumber);
    }

    public static final class Builder {
        private final int sessionKey;
        private final int driverNumber;
        private @Nullable Integer lapNumber;
        private @Nullable Double lapDuration;
        private @Nullable Double sector1Duration;
        private @Nullable Double sector2Duration;
        private @Nullable String compound;
        private @Nullable Integer stintNumber;
        private @Nullable Integer stintLapStart;
        private @Nullable Integer stintLapEnd;
        private @Nullable Integer tyreAgeAtStart;
        private @Nullable Double trackTemperature;
        private @Nullable Double airTemperature;
        private @Nullable Double humidity;
        private @Nullable Boolean rainfall;
        private @Nullable Double windSpeed;
        private @Nullable Double gapToLeader;
        private @Nullable Double interval;
        private @Nullable Integer position;
        private boolean pitInLap;
        private boolean safetyCar;
        private boolean virtualSafetyCar;

        private Builder(int sessionKey, int driverNumber) {
            this.sessionKey = sessionKey;
            this.driverNumber = driverNumber;
        }

        public Builder lap(@Nullable Integer lapNumber, @Nullable Double lapDuration) {
            this.lapNumber = lapNumber;
            this.lapDuration = lapDuration;
            return this;
        }

        public Builder sectors(@Nullable Double sector1, @Nullable Double sector2) {
            this.sector1Duration = sector1;
            this.sector2Duration = sector2;
            return this;
        }

        public Builder stint(@Nullable String compound, @Nullable Integer stintNumber,
                             @Nullable Integer lapStart, @Nullable Integer lapEnd, @Nullable Integer tyreAgeAtStart) {
            this.compound = compound;
            this.stintNumber = stintNumber;
            this.stintLapStart = lapStart;
            this.stintLapEnd = lapEnd;
            this.tyreAgeAtStart = tyreAgeAtStart;
            return this;
        }

        public Builder weather(@Nullable Double trackTemperature, @Nullable Double airTemperature,
                               @Nullable Double humidity, @Nullable Boolean rainfall, @Nullable Double windSpeed) {
            this.trackTemperature = trackTemperature;
            this.airTemperature = airTemperature;
            this.humidity = humidity;
            this.rainfall = rainfall;
            this.windSpeed = windSpeed;
            return this;
        }

        public Builder gaps(@Nullable Double gapToLeader, @Nullable Double interval) {
            this.gapToLeader = gapToLeader;
            this.interval = interval;
            return this;
        }

        public Builder position(@Nullable Integer position) {
            this.position = position;
            return this;
        }

        public Builder flags(boolean pitInLap, boolean safetyCar, boolean virtualSafetyCar) {
            this.pitInLap = pitInLap;
            this.safetyCar = safetyCar;
            this.virtualSafetyCar = virtualSafetyCar;
            return this;
        }

        public RawSessionRecord build() {
            return new RawSessionRecord(sessionKey, driverNumber, lapNumber, lapDuration,
                    sector1Duration, sector2Duration, compound, stintNumber, stintLapStart, stintLapEnd,
                    tyreAgeAtStart, trackTemperature, airTemperature, humidity, rainfall, windSpeed,
                    gapToLeader, interval, position, pitInLap, safetyCar, virtualSafetyCar);
        }
    }
}
