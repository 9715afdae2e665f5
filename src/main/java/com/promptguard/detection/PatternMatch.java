package com.promptguard.detection;

import java.util.Objects;

/**
 * A single rule hit. Offsets index the text the rule was evaluated against.
 */
public record PatternMatch(String ruleId, ThreatCategory category, ThreatLevel level, int start, int end) {

    public PatternMatch {
        Objects.requireNonNull(ruleId, "ruleId");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(level, "level");
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }
}
