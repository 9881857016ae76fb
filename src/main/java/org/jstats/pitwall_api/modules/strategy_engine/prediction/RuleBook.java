package org.jstats.pitwall_api.modules.strategy_engine.prediction;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Ordered condition-to-text rules, evaluated in priority order.
 *
 * @param <C> the facts a rule inspects
 */
public final class RuleBook<C> {

    public record Rule<C>(String id, Predicate<C> when, Function<C, String> text) {}

    private final List<Rule<C>> rules;

    private RuleBook(List<Rule<C>> rules) {
        this.rules = List.copyOf(rules);
    }

    public static <C> Builder<C> builder() {
        return new Builder<>();
    }

    /**
     * Text of the first {@code limit} matching rules.
     */
    public List<String> apply(C facts, int limit) {
        List<String> out = new ArrayList<>();
        for (Rule<C> rule : rules) {
            if (out.size() >= limit) {
                break;
            }
            if (rule.when().test(facts)) {
                out.add(rule.text().apply(facts));
            }
        }
        return out;
    }

    public List<String> applyOrElse(C facts, int limit, String fallback) {
        List<String> out = apply(facts, limit);
        return out.isEmpty() ? List.of(fallback) : out;
    }

    public Optional<String> first(C facts) {
        return apply(facts, 1).stream().findFirst();
    }

    public List<String> matchingIds(C facts) {
        List<String> ids = new ArrayList<>();
        for (Rule<C> rule : rules) {
            if (rule.when().test(facts)) {
                ids.add(rule.id());
            }
        }
        return ids;
    }

    public static final class Builder<C> {
        private final List<Rule<C>> rules = new ArrayList<>();

        private Builder() {
        }

        public Builder<C> rule(String id, Predicate<C> when, String text) {
            rules.add(new Rule<>(id, when, facts -> text));
            return this;
        }

        public Builder<C> rule(String id, Predicate<C> when, Function<C, String> template) {
            rules.add(new Rule<>(id, when, template));
            return this;
        }

        public RuleBook<C> build() {
            return new RuleBook<>(rules);
        }
    }
}
