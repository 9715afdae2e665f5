package com.promptguard.moderation;

import java.time.Duration;

/**
 * Outcome of a sliding-window check. {@code retryAfter} is zero when allowed.
 */
public record RateLimitDecision(boolean allowed, Duration retryAfter, int countInWindow) {

    public static RateLimitDecision allow(int countInWindow) {
        return new RateLimitDecision(true, Duration.ZERO, countInWindow);
    }

    public static RateLimitDecision reject(Duration retryAfter, int countInWindow) {
        return new RateLimitDecision(false, retryAfter, countInWindow);
    }
}
