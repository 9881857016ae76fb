package org.jstats.pitwall_api.modules.strategy_engine.training;

import org.jstats.pitwall_api.modules.strategy_engine.data.RawSessionRecord;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.function.Function;

/**
 * Observed weather ranges that replace the synthetic generator's default bounds.
 * A null range keeps the default.
 */
public record SyntheticContext(
        @Nullable Range trackTemperature,
        @Nullable Range airTemperature,
        @Nullable Range humidity
) {

    static final double MARGIN = 5.0;

    public record Range(double min, double max) {
    }

    public static SyntheticContext empty() {
        return new SyntheticContext(null, null, null);
    }

    public static SyntheticContext fromRecords(List<RawSessionRecord> records) {
        return new SyntheticContext(
                observed(records, RawSessionRecord::trackTemperature),
                observed(records, RawSessionRecord::airTemperature),
                observed(records, RawSessionRecord::humidity));
    }

    Range trackTemperatureOr(double min, double max) {
        return trackTemperature != null ? trackTemperature : new Range(min, max);
    }

    Range airTemperatureOr(double min, double max) {
        return airTemperature != null ? airTemperature : new Range(min, max);
    }

    Range humidityOr(double min, double max) {
        return humidity != null ? humidity : new Range(min, max);
    }

    private static @Nullable Range observed(List<RawSessionRecord> records, Function<RawSessionRecord, @Nullable Double> field) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (RawSessionRecord record : records) {
            Double value = field.apply(record);
            if (value != null) {
                min = Math.min(min, value);
                max = Math.max(max, value);
            }
        }
        if (min > max) {
            return null;
        }
        return new Range(min - MARGIN, max + MARGIN);
    }
}
