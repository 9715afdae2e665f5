package com.promptguard.moderation;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable per-session record owned by {@link ContentModerator}. Every read or
 * write must happen while holding the record's lock. A record is discarded
 * once marked evicted; holders that observe the flag must look the session up
 * again.
 */
final class SessionState {

    private final String sessionId;
    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<Instant> timestamps = new ArrayDeque<>();
    private long totalAllowed;
    private long totalBlocked;
    private Instant lastSeen;
    private boolean evicted;

    SessionState(String sessionId) {
        this.sessionId = sessionId;
    }

    String sessionId() { return sessionId; }

    void lock() { lock.lock(); }

    void unlock() { lock.unlock(); }

    boolean isEvicted() { return evicted; }

    void markEvicted() { evicted = true; }

    /**
     * Drops timestamps at or before {@code now - window}.
     *
     * @return the number of timestamps still inside the window
     */
    int prune(Instant now, Duration window) {
        Instant cutoff = now.minus(window);
        while (!timestamps.isEmpty() && !timestamps.peekFirst().isAfter(cutoff)) {
            timestamps.pollFirst();
        }
        return timestamps.size();
    }

    /** Appends {@code now}, clamped so the deque stays ascending. */
    void record(Instant now) {
        Instant last = timestamps.peekLast();
        timestamps.addLast(last != null && last.isAfter(now) ? last : now);
    }

    Instant oldest() { return timestamps.peekFirst(); }

    int size() { return timestamps.size(); }

    void touch(Instant now) {
        if (lastSeen == null || now.isAfter(lastSeen)) {
            lastSeen = now;
        }
    }

    Instant lastSeen() { return lastSeen; }

    void incrementAllowed() { totalAllowed++; }

    void incrementBlocked() { totalBlocked++; }

    long totalAllowed() { return totalAllowed; }

    long totalBlocked() { return totalBlocked; }
}
