package com.promptguard.detection;

import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

public record InjectionRule(String id, ThreatCategory category, ThreatLevel level, Pattern pattern) {

    public InjectionRule {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(pattern, "pattern");
        if (level == ThreatLevel.SAFE) {
            throw new IllegalArgumentException("Rule " + id + " must have a level above SAFE");
        }
    }

    /**
     * Compiles {@code regex} case-insensitively.
     *
     * @throws IllegalArgumentException if the regex does not compile
     */
    public static InjectionRule of(String id, ThreatCategory category, ThreatLevel level, String regex) {
        try {
            return new InjectionRule(id, category, level,
                    Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Rule " + id + " has an invalid pattern: " + e.getDescription(), e);
        }
    }
}
