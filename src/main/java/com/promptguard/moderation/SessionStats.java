package com.promptguard.moderation;

import java.time.Duration;
import java.time.Instant;

public record SessionStats(
        String sessionId,
        int messagesInWindow,
        int limit,
        int remaining,
        Duration window,
        long totalAllowed,
        long totalBlocked,
        Instant lastSeen
) {
}
