package com.promptguard.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "promptguard")
public class PromptGuardProperties {

    private SecurityProperties security = new SecurityProperties();
    private ModerationProperties moderation = new ModerationProperties();
    private DetectionProperties detection = new DetectionProperties();
    private LoggingProperties logging = new LoggingProperties();

    public SecurityProperties getSecurity() { return security; }
    public void setSecurity(SecurityProperties security) { this.security = security; }

    public ModerationProperties getModeration() { return moderation; }
    public void setModeration(ModerationProperties moderation) { this.moderation = moderation; }

    public DetectionProperties getDetection() { return detection; }
    public void setDetection(DetectionProperties detection) { this.detection = detection; }

    public LoggingProperties getLogging() { return logging; }
    public void setLogging(LoggingProperties logging) { this.logging = logging; }

    public static class SecurityProperties {
        private String level = "MEDIUM";
        private int maxInputLength = SecurityConfig.DEFAULT_MAX_INPUT_LENGTH;
        private int hardInputLimit = SecurityConfig.DEFAULT_HARD_INPUT_LIMIT;
        private int rateLimitPerMinute = SecurityConfig.DEFAULT_RATE_LIMIT_PER_MINUTE;
        private boolean enableSanitization = true;
        private boolean strictSanitization = false;
        private boolean preserveNewlines = false;
        private boolean enableInjectionDetection = true;
        private boolean enableContentModeration = true;
        private List<String> blacklist = new ArrayList<>();
        private List<String> whitelist = new ArrayList<>();
        /** Legacy comma-separated form, merged into {@link #blacklist}. */
        private String customBlacklistPatterns = "";

        public String getLevel() { return level; }
        public void setLevel(String level) { this.level = level; }
        public int getMaxInputLength() { return maxInputLength; }
        public void setMaxInputLength(int maxInputLength) { this.maxInputLength = maxInputLength; }
        public int getHardInputLimit() { return hardInputLimit; }
        public void setHardInputLimit(int hardInputLimit) { this.hardInputLimit = hardInputLimit; }
        public int getRateLimitPerMinute() { return rateLimitPerMinute; }
        public void setRateLimitPerMinute(int v) { this.rateLimitPerMinute = v; }
        public boolean isEnableSanitization() { return enableSanitization; }
        public void setEnableSanitization(boolean v) { this.enableSanitization = v; }
        public boolean isStrictSanitization() { return strictSanitization; }
        public void setStrictSanitization(boolean v) { this.strictSanitization = v; }
        public boolean isPreserveNewlines() { return preserveNewlines; }
        public void setPreserveNewlines(boolean v) { this.preserveNewlines = v; }
        public boolean isEnableInjectionDetection() { return enableInjectionDetection; }
        public void setEnableInjectionDetection(boolean v) { this.enableInjectionDetection = v; }
        public boolean isEnableContentModeration() { return enableContentModeration; }
        public void setEnableContentModeration(boolean v) { this.enableContentModeration = v; }
        public List<String> getBlacklist() { return blacklist; }
        public void setBlacklist(List<String> blacklist) { this.blacklist = blacklist; }
        public List<String> getWhitelist() { return whitelist; }
        public void setWhitelist(List<String> whitelist) { this.whitelist = whitelist; }
        public String getCustomBlacklistPatterns() { return customBlacklistPatterns; }
        public void setCustomBlacklistPatterns(String v) { this.customBlacklistPatterns = v; }
    }

    public static class ModerationProperties {
        private Duration window = Duration.ofSeconds(60);
        private Duration idleTtl = Duration.ofMinutes(30);
        private long sweepIntervalMs = 60_000;

        public Duration getWindow() { return window; }
        public void setWindow(Duration window) { this.window = window; }
        public Duration getIdleTtl() { return idleTtl; }
        public void setIdleTtl(Duration idleTtl) { this.idleTtl = idleTtl; }
        public long getSweepIntervalMs() { return sweepIntervalMs; }
        public void setSweepIntervalMs(long sweepIntervalMs) { this.sweepIntervalMs = sweepIntervalMs; }
    }

    public static class DetectionProperties {
        private boolean includeDefaultRules = true;
        private List<RuleProperties> customRules = new ArrayList<>();

        public boolean isIncludeDefaultRules() { return includeDefaultRules; }
        public void setIncludeDefaultRules(boolean v) { this.includeDefaultRules = v; }
        public List<RuleProperties> getCustomRules() { return customRules; }
        public void setCustomRules(List<RuleProperties> customRules) { this.customRules = customRules; }
    }

    public static class RuleProperties {
        private String id;
        private String category;
        private String level;
        private String pattern;

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }
        public String getCategory() { return category; }
        public void setCategory(String category) { this.category = category; }
        public String getLevel() { return level; }
        public void setLevel(String level) { this.level = level; }
        public String getPattern() { return pattern; }
        public void setPattern(String pattern) { this.pattern = pattern; }
    }

    public static class LoggingProperties {
        private List<String> redactPatterns = new ArrayList<>();

        public List<String> getRedactPatterns() { return redactPatterns; }
        public void setRedactPatterns(List<String> redactPatterns) { this.redactPatterns = redactPatterns; }
    }
}
