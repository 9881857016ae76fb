package org.jstats.pitwall_api.modules.strategy_engine.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Tire chemistry classes, in the order used for probability maps.
 */
public enum Compound {
    SOFT(0, -1),
    MEDIUM(1, 0),
    HARD(2, 1),
    INTERMEDIATE(1, 0),
    WET(1, 0);

    private final int index;
    private final int hardness;

    Compound(int index, int hardness) {
        this.index = index;
        this.hardness = hardness;
    }

    /**
     * Dry-compound index used by the pit-stop and pace feature vectors (0=SOFT, 1=MEDIUM, 2=HARD).
     * Wet-weather compounds map to the medium slot.
     */
    public int index() {
        return index;
    }

    /**
     * Relative hardness (-1 soft, 0 medium, 1 hard) used for compound advantage.
     */
    public int hardness() {
        return hardness;
    }

    public static Optional<Compound> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Compound.valueOf(raw.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
