package com.promptguard.content;

public record SanitizationResult(String cleanedText, boolean truncated, int originalLength) {

    public boolean isEmpty() {
        return cleanedText.isEmpty();
    }

    public boolean changed() {
        return truncated || cleanedText.length() != originalLength;
    }
}
