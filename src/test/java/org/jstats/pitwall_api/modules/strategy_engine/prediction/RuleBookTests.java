package org.jstats.pitwall_api.modules.strategy_engine.prediction;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RuleBookTests {

    private final RuleBook<Integer> book = RuleBook.<Integer>builder()
            .rule("big", n -> n > 100, "big")
            .rule("even", n -> n % 2 == 0, n -> "even " + n)
            .rule("positive", n -> n > 0, "positive")
            .build();

    @Test
    void apply_returnsMatchingTextsInRuleOrder() {
        assertEquals(List.of("big", "even 102", "positive"), book.apply(102, Integer.MAX_VALUE));
    }

    @Test
    void apply_stopsAtLimit() {
        assertEquals(List.of("big", "even 102"), book.apply(102, 2));
    }

    @Test
    void applyOrElse_usesFallbackOnlyWhenNothingMatches() {
        assertEquals(List.of("none"), book.applyOrElse(-3, 5, "none"));
        assertEquals(List.of("positive"), book.applyOrElse(3, 5, "none"));
    }

    @Test
    void first_isHighestPriorityMatch() {
        assertEquals(Optional.of("even 4"), book.first(4));
        assertEquals(Optional.empty(), book.first(-1));
    }

    @Test
    void matchingIds_ignoresLimit() {
        assertEquals(List.of("even", "positive"), book.matchingIds(8));
    }
}
