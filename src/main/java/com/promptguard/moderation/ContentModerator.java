package com.promptguard.moderation;

import com.promptguard.config.SecurityConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Sliding-window rate limiter and blacklist/whitelist matcher.
 *
 * <p>Session records live in a concurrent map and each carries its own lock,
 * so the read-prune-append sequence for one session is atomic while unrelated
 * sessions never wait on each other. Idle records are dropped by
 * {@link #evictIdleSessions(Instant)}.
 */
public class ContentModerator {

    private static final Logger log = LoggerFactory.getLogger(ContentModerator.class);

    public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(60);
    public static final Duration DEFAULT_IDLE_TTL = Duration.ofMinutes(30);

    private final ConcurrentMap<String, SessionState> sessions = new ConcurrentHashMap<>();
    private final Duration window;
    private final Duration idleTtl;

    public ContentModerator() {
        this(DEFAULT_WINDOW, DEFAULT_IDLE_TTL);
    }

    public ContentModerator(Duration window, Duration idleTtl) {
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("Rate limit window must be positive, got: " + window);
        }
        if (idleTtl == null || idleTtl.compareTo(window) < 0) {
            throw new IllegalArgumentException("Idle TTL must be at least the rate limit window, got: " + idleTtl);
        }
        this.window = window;
        this.idleTtl = idleTtl;
        log.info("ContentModerator initialized: window={}s, idleTtl={}s", window.toSeconds(), idleTtl.toSeconds());
    }

    /**
     * Records a message for {@code sessionId} at {@code now} unless the session
     * already has {@code limit} messages inside the trailing window.
     */
    public RateLimitDecision checkRateLimit(String sessionId, Instant now, int limit) {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(now, "now");
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, got: " + limit);
        }
        while (true) {
            SessionState state = sessions.computeIfAbsent(sessionId, SessionState::new);
            state.lock();
            try {
                if (state.isEvicted()) {
                    continue;
                }
                state.touch(now);
                int count = state.prune(now, window);
                if (count >= limit) {
                    state.incrementBlocked();
                    Duration retryAfter = Duration.between(now, state.oldest().plus(window));
                    log.warn("Rate limit exceeded for session {}: {} messages in {}s, retry in {}ms",
                            sessionId, count, window.toSeconds(), retryAfter.toMillis());
                    return RateLimitDecision.reject(retryAfter, count);
                }
                state.record(now);
                return RateLimitDecision.allow(count + 1);
            } finally {
                state.unlock();
            }
        }
    }

    public boolean matchesBlacklist(String text, SecurityConfig config) {
        return findBlacklistMatch(text, config).isPresent();
    }

    public Optional<String> findBlacklistMatch(String text, SecurityConfig config) {
        Optional<String> match = config.getBlacklist().firstMatch(text);
        match.ifPresent(entry -> log.warn("Blacklisted content detected: {}", entry));
        return match;
    }

    /**
     * A whitelist hit suppresses detector-driven blocking only; it never
     * overrides the blacklist or the rate limit.
     */
    public boolean matchesWhitelist(String text, SecurityConfig config) {
        return config.getWhitelist().matches(text);
    }

    /**
     * Adds a final allow/block decision taken after the rate-limit stage to the
     * session totals. Unknown sessions are ignored.
     */
    public void recordOutcome(String sessionId, boolean allowed) {
        SessionState state = sessions.get(sessionId);
        if (state == null) {
            return;
        }
        state.lock();
        try {
            if (state.isEvicted()) {
                return;
            }
            if (allowed) {
                state.incrementAllowed();
            } else {
                state.incrementBlocked();
            }
        } finally {
            state.unlock();
        }
    }

    public Optional<SessionStats> getSessionStats(String sessionId, Instant now, int limit) {
        SessionState state = sessions.get(sessionId);
        if (state == null) {
            return Optional.empty();
        }
        state.lock();
        try {
            if (state.isEvicted()) {
                return Optional.empty();
            }
            int inWindow = state.prune(now, window);
            return Optional.of(new SessionStats(sessionId, inWindow, limit, Math.max(0, limit - inWindow),
                    window, state.totalAllowed(), state.totalBlocked(), state.lastSeen()));
        } finally {
            state.unlock();
        }
    }

    /**
     * Forgets everything about {@code sessionId}.
     *
     * @return whether a record existed
     */
    public boolean resetSession(String sessionId) {
        SessionState state = sessions.remove(sessionId);
        if (state == null) {
            return false;
        }
        state.lock();
        try {
            state.markEvicted();
        } finally {
            state.unlock();
        }
        log.info("Reset rate limiting for session: {}", sessionId);
        return true;
    }

    /**
     * Drops sessions not seen for longer than the idle TTL. Locks one record
     * at a time.
     *
     * @return number of sessions evicted
     */
    public int evictIdleSessions(Instant now) {
        Instant cutoff = now.minus(idleTtl);
        int evicted = 0;
        for (Map.Entry<String, SessionState> entry : sessions.entrySet()) {
            SessionState state = entry.getValue();
            state.lock();
            try {
                if (state.isEvicted() || state.lastSeen() == null || state.lastSeen().isAfter(cutoff)) {
                    continue;
                }
                state.markEvicted();
                sessions.remove(entry.getKey(), state);
                evicted++;
            } finally {
                state.unlock();
            }
        }
        if (evicted > 0) {
            log.info("Evicted {} idle sessions (idle > {}s)", evicted, idleTtl.toSeconds());
        }
        return evicted;
    }

    public int activeSessions() {
        return sessions.size();
    }

    public Duration getWindow() { return window; }

    public Duration getIdleTtl() { return idleTtl; }
}
