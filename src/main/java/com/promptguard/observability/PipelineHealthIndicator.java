package com.promptguard.observability;

import com.promptguard.config.SecurityConfig;
import com.promptguard.detection.PromptInjectionDetector;
import com.promptguard.moderation.ContentModerator;
import com.promptguard.pipeline.SecurityPipeline;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component
public class PipelineHealthIndicator implements HealthIndicator {

    private final SecurityPipeline pipeline;
    private final PromptInjectionDetector detector;
    private final ContentModerator moderator;

    public PipelineHealthIndicator(SecurityPipeline pipeline, PromptInjectionDetector detector,
                                   ContentModerator moderator) {
        this.pipeline = pipeline;
        this.detector = detector;
        this.moderator = moderator;
    }

    @Override
    public Health health() {
        SecurityConfig config = pipeline.getConfig();
        int rules = detector.getRuleSet().size();

        Health.Builder builder = config.isEnableInjectionDetection() && rules == 0
                ? Health.down().withDetail("reason", "Injection detection enabled with an empty rule set")
                : Health.up();
        return builder
                .withDetail("securityLevel", config.getLevel().name())
                .withDetail("rules", rules)
                .withDetail("activeSessions", moderator.activeSessions())
                .withDetail("sanitization", config.isEnableSanitization())
                .withDetail("injectionDetection", config.isEnableInjectionDetection())
                .withDetail("contentModeration", config.isEnableContentModeration())
                .build();
    }
}
