package com.promptguard.moderation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Component
public class SessionEvictionScheduler {

    private static final Logger log = LoggerFactory.getLogger(SessionEvictionScheduler.class);

    private final ContentModerator moderator;
    private final Clock clock;

    public SessionEvictionScheduler(ContentModerator moderator, Clock clock) {
        this.moderator = moderator;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${promptguard.moderation.sweep-interval-ms:60000}")
    public void evictIdleSessions() {
        int evicted = moderator.evictIdleSessions(clock.instant());
        log.debug("Idle session sweep finished: evicted={} remaining={}", evicted, moderator.activeSessions());
    }
}
