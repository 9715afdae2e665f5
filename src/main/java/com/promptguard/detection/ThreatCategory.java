package com.promptguard.detection;

import java.util.Locale;

public enum ThreatCategory {
    INSTRUCTION_OVERRIDE("instruction-override"),
    ROLE_MANIPULATION("role-manipulation"),
    COMMAND_INJECTION("command-injection"),
    PROMPT_LEAK("prompt-leak"),
    ENCODING_BYPASS("encoding-bypass");

    private final String code;

    ThreatCategory(String code) {
        this.code = code;
    }

    public String code() { return code; }

    /**
     * Accepts either the wire code ({@code prompt-leak}) or the constant name
     * ({@code PROMPT_LEAK}), case-insensitively.
     */
    public static ThreatCategory fromCode(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Threat category must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (ThreatCategory category : values()) {
            if (category.code.equals(normalized)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown threat category: " + value);
    }

    @Override
    public String toString() { return code; }
}
