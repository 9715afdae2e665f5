package com.promptguard.config;

import com.promptguard.detection.ThreatLevel;

import java.util.Locale;

/**
 * Sensitivity setting. Each level maps to the lowest {@link ThreatLevel}
 * that gets blocked (inclusive).
 */
public enum SecurityLevel {
    /** Blocks critical threats only. */
    LOW(ThreatLevel.CRITICAL),
    /** Blocks medium to critical. */
    MEDIUM(ThreatLevel.MEDIUM),
    /** Blocks anything detected. */
    HIGH(ThreatLevel.LOW);

    private final ThreatLevel threshold;

    SecurityLevel(ThreatLevel threshold) {
        this.threshold = threshold;
    }

    public ThreatLevel threshold() { return threshold; }

    public boolean blocks(ThreatLevel detected) {
        return detected.isAtLeast(threshold);
    }

    /**
     * @throws ConfigurationException for a missing or unrecognised value;
     *         there is no fallback level
     */
    public static SecurityLevel parse(String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Security level is required (LOW, MEDIUM or HIGH)");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unrecognized security level: '" + value
                    + "' (expected LOW, MEDIUM or HIGH)", e);
        }
    }
}
