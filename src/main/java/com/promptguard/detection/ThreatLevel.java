package com.promptguard.detection;

/**
 * Ordinal severity of a detected pattern or payload. Declaration order is the
 * severity order, so {@link #compareTo} can be used directly.
 */
public enum ThreatLevel {
    SAFE(0),
    LOW(1),
    MEDIUM(2),
    HIGH(3),
    CRITICAL(4);

    private final int severity;

    ThreatLevel(int severity) {
        this.severity = severity;
    }

    public int severity() { return severity; }

    public boolean isAtLeast(ThreatLevel other) {
        return severity >= other.severity;
    }

    public static ThreatLevel max(ThreatLevel a, ThreatLevel b) {
        return a.severity >= b.severity ? a : b;
    }
}
