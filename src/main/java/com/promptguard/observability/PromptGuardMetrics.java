package com.promptguard.observability;

import com.promptguard.detection.ThreatCategory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Centralized Micrometer metrics for the input-security pipeline.
 */
@Component
public class PromptGuardMetrics {

    private final MeterRegistry registry;

    public PromptGuardMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // --- Pipeline metrics ---

    public void recordDecision(String action, String reason) {
        Counter.builder("promptguard.pipeline.decisions")
                .tag("action", action)
                .tag("reason", reason)
                .register(registry).increment();
    }

    public Timer.Sample startPipelineTimer() {
        return Timer.start(registry);
    }

    public void stopPipelineTimer(Timer.Sample sample, String action) {
        sample.stop(Timer.builder("promptguard.pipeline.latency")
                .tag("action", action)
                .register(registry));
    }

    // --- Detection metrics ---

    public void recordDetectionMatch(ThreatCategory category) {
        Counter.builder("promptguard.detection.matches")
                .tag("category", category.code())
                .register(registry).increment();
    }

    // --- Moderation metrics ---

    public void recordRateLimitExceeded() {
        Counter.builder("promptguard.rate_limit.exceeded")
                .description("Rate limit exceeded events")
                .register(registry).increment();
    }

    public void registerActiveSessions(Supplier<Number> activeSessions) {
        Gauge.builder("promptguard.sessions.active", activeSessions)
                .description("Sessions tracked by the rate limiter")
                .register(registry);
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
