package com.promptguard.detection;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable, ordered collection of {@link InjectionRule}s. Shared by reference
 * across concurrent detector calls; changing the rules means building a new
 * instance.
 */
public final class RuleSet {

    private static final RuleSet EMPTY = new RuleSet(List.of());

    private final List<InjectionRule> rules;

    private RuleSet(List<InjectionRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static RuleSet empty() { return EMPTY; }

    public static RuleSet defaults() {
        return builder().addAll(DefaultRules.all()).build();
    }

    public static Builder builder() { return new Builder(); }

    public List<InjectionRule> rules() { return rules; }

    public int size() { return rules.size(); }

    public boolean isEmpty() { return rules.isEmpty(); }

    /** Returns a builder pre-populated with this set's rules. */
    public Builder toBuilder() {
        return new Builder().addAll(rules);
    }

    public static final class Builder {

        private final List<InjectionRule> rules = new ArrayList<>();
        private final Set<String> ids = new HashSet<>();

        private Builder() {}

        public Builder add(InjectionRule rule) {
            if (!ids.add(rule.id())) {
                throw new IllegalArgumentException("Duplicate rule id: " + rule.id());
            }
            rules.add(rule);
            return this;
        }

        public Builder add(String id, ThreatCategory category, ThreatLevel level, String regex) {
            return add(InjectionRule.of(id, category, level, regex));
        }

        public Builder addAll(List<InjectionRule> toAdd) {
            toAdd.forEach(this::add);
            return this;
        }

        public RuleSet build() {
            return new RuleSet(rules);
        }
    }
}
