package com.promptguard.config;

import com.promptguard.detection.InjectionRule;
import com.promptguard.detection.RuleSet;
import com.promptguard.detection.ThreatCategory;
import com.promptguard.detection.ThreatLevel;
import com.promptguard.moderation.ContentModerator;
import com.promptguard.observability.PromptGuardMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds the validated pipeline collaborators from {@link PromptGuardProperties}.
 * Any invalid property stops the application context from starting.
 */
@Configuration
public class PromptGuardConfig {

    private static final Logger log = LoggerFactory.getLogger(PromptGuardConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SecurityConfig securityConfig(PromptGuardProperties properties) {
        return toSecurityConfig(properties.getSecurity());
    }

    @Bean
    public RuleSet ruleSet(PromptGuardProperties properties) {
        return toRuleSet(properties.getDetection());
    }

    @Bean
    public ContentModerator contentModerator(PromptGuardProperties properties, PromptGuardMetrics metrics) {
        PromptGuardProperties.ModerationProperties moderation = properties.getModeration();
        ContentModerator moderator;
        try {
            moderator = new ContentModerator(moderation.getWindow(), moderation.getIdleTtl());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid moderation settings: " + e.getMessage(), e);
        }
        metrics.registerActiveSessions(moderator::activeSessions);
        return moderator;
    }

    static SecurityConfig toSecurityConfig(PromptGuardProperties.SecurityProperties security) {
        List<String> blacklist = new ArrayList<>(security.getBlacklist());
        blacklist.addAll(PhraseList.parse(security.getCustomBlacklistPatterns()).entries());

        SecurityConfig config = SecurityConfig.builder()
                .level(security.getLevel())
                .maxInputLength(security.getMaxInputLength())
                .hardInputLimit(security.getHardInputLimit())
                .rateLimitPerMinute(security.getRateLimitPerMinute())
                .enableSanitization(security.isEnableSanitization())
                .strictSanitization(security.isStrictSanitization())
                .preserveNewlines(security.isPreserveNewlines())
                .enableInjectionDetection(security.isEnableInjectionDetection())
                .enableContentModeration(security.isEnableContentModeration())
                .blacklist(blacklist)
                .whitelist(security.getWhitelist())
                .build();
        log.info("Loaded security configuration: {}", config);
        return config;
    }

    static RuleSet toRuleSet(PromptGuardProperties.DetectionProperties detection) {
        RuleSet.Builder builder = detection.isIncludeDefaultRules()
                ? RuleSet.defaults().toBuilder()
                : RuleSet.builder();
        for (PromptGuardProperties.RuleProperties rule : detection.getCustomRules()) {
            InjectionRule custom = toRule(rule);
            try {
                builder.add(custom);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Invalid custom detection rule " + custom.id() + ": "
                        + e.getMessage(), e);
            }
        }
        RuleSet rules = builder.build();
        log.info("Loaded {} detection rules ({} custom)", rules.size(), detection.getCustomRules().size());
        return rules;
    }

    private static InjectionRule toRule(PromptGuardProperties.RuleProperties rule) {
        if (rule.getId() == null || rule.getId().isBlank()) {
            throw new ConfigurationException("Custom detection rule is missing an id");
        }
        if (rule.getPattern() == null || rule.getPattern().isBlank()) {
            throw new ConfigurationException("Custom detection rule " + rule.getId() + " is missing a pattern");
        }
        try {
            ThreatCategory category = ThreatCategory.fromCode(rule.getCategory());
            ThreatLevel level = ThreatLevel.valueOf(
                    rule.getLevel() == null ? "" : rule.getLevel().trim().toUpperCase(Locale.ROOT));
            return InjectionRule.of(rule.getId(), category, level, rule.getPattern());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid custom detection rule " + rule.getId() + ": "
                    + e.getMessage(), e);
        }
    }
}
