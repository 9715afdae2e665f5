package com.promptguard.detection;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public record DetectionResult(ThreatLevel level, List<PatternMatch> matches, Optional<DecodedPayload> decodedFrom) {

    private static final DetectionResult SAFE = new DetectionResult(ThreatLevel.SAFE, List.of(), Optional.empty());

    public DetectionResult {
        matches = List.copyOf(matches);
    }

    public static DetectionResult safe() { return SAFE; }

    /**
     * Builds a result whose level is the maximum over the given matches.
     */
    public static DetectionResult of(List<PatternMatch> matches, DecodedPayload decodedFrom) {
        ThreatLevel level = ThreatLevel.SAFE;
        for (PatternMatch match : matches) {
            level = ThreatLevel.max(level, match.level());
        }
        return new DetectionResult(level, matches, Optional.ofNullable(decodedFrom));
    }

    public boolean isSafe() { return level == ThreatLevel.SAFE; }

    /** Distinct categories in the order they were first matched. */
    public Set<ThreatCategory> categories() {
        Set<ThreatCategory> categories = new LinkedHashSet<>();
        for (PatternMatch match : matches) {
            categories.add(match.category());
        }
        return categories;
    }
}
