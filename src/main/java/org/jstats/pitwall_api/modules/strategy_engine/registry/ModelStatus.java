package org.jstats.pitwall_api.modules.strategy_engine.registry;

import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * Caller-facing view of one domain's registry entry.
 *
 * @param status one of {@code not_loaded}, {@code training}, {@code trained}, {@code loaded}, {@code error}
 * @param ready  whether predictions can be served right now
 */
public record ModelStatus(
        String name,
        String status,
        String description,
        boolean ready,
        @Nullable Instant trainedAt,
        @Nullable String lastError
) {}
