package com.promptguard.config;

import com.promptguard.detection.ThreatLevel;

import java.util.Collection;
import java.util.Objects;

/**
 * Immutable settings for one pipeline instance. Validated on {@link Builder#build()};
 * an instance that exists is always valid. To change settings build a new
 * instance and swap it in.
 */
public final class SecurityConfig {

    public static final int DEFAULT_MAX_INPUT_LENGTH = 2000;
    public static final int DEFAULT_HARD_INPUT_LIMIT = 100_000;
    public static final int DEFAULT_RATE_LIMIT_PER_MINUTE = 10;

    private final SecurityLevel level;
    private final int maxInputLength;
    private final int hardInputLimit;
    private final int rateLimitPerMinute;
    private final boolean enableSanitization;
    private final boolean strictSanitization;
    private final boolean preserveNewlines;
    private final boolean enableInjectionDetection;
    private final boolean enableContentModeration;
    private final PhraseList blacklist;
    private final PhraseList whitelist;

    private SecurityConfig(Builder b, SecurityLevel level, PhraseList blacklist, PhraseList whitelist) {
        this.level = level;
        this.maxInputLength = b.maxInputLength;
        this.hardInputLimit = b.hardInputLimit;
        this.rateLimitPerMinute = b.rateLimitPerMinute;
        this.enableSanitization = b.enableSanitization;
        this.strictSanitization = b.strictSanitization;
        this.preserveNewlines = b.preserveNewlines;
        this.enableInjectionDetection = b.enableInjectionDetection;
        this.enableContentModeration = b.enableContentModeration;
        this.blacklist = blacklist;
        this.whitelist = whitelist;
    }

    public static Builder builder() { return new Builder(); }

    public Builder toBuilder() {
        return new Builder()
                .level(level)
                .maxInputLength(maxInputLength)
                .hardInputLimit(hardInputLimit)
                .rateLimitPerMinute(rateLimitPerMinute)
                .enableSanitization(enableSanitization)
                .strictSanitization(strictSanitization)
                .preserveNewlines(preserveNewlines)
                .enableInjectionDetection(enableInjectionDetection)
                .enableContentModeration(enableContentModeration)
                .blacklist(blacklist.entries())
                .whitelist(whitelist.entries());
    }

    public SecurityLevel getLevel() { return level; }
    public ThreatLevel getThreshold() { return level.threshold(); }
    public int getMaxInputLength() { return maxInputLength; }
    public int getHardInputLimit() { return hardInputLimit; }
    public int getRateLimitPerMinute() { return rateLimitPerMinute; }
    public boolean isEnableSanitization() { return enableSanitization; }
    public boolean isStrictSanitization() { return strictSanitization; }
    public boolean isPreserveNewlines() { return preserveNewlines; }
    public boolean isEnableInjectionDetection() { return enableInjectionDetection; }
    public boolean isEnableContentModeration() { return enableContentModeration; }
    public PhraseList getBlacklist() { return blacklist; }
    public PhraseList getWhitelist() { return whitelist; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SecurityConfig that)) return false;
        return maxInputLength == that.maxInputLength
                && hardInputLimit == that.hardInputLimit
                && rateLimitPerMinute == that.rateLimitPerMinute
                && enableSanitization == that.enableSanitization
                && strictSanitization == that.strictSanitization
                && preserveNewlines == that.preserveNewlines
                && enableInjectionDetection == that.enableInjectionDetection
                && enableContentModeration == that.enableContentModeration
                && level == that.level
                && blacklist.equals(that.blacklist)
                && whitelist.equals(that.whitelist);
    }

    @Override
    public int hashCode() {
        return Objects.hash(level, maxInputLength, hardInputLimit, rateLimitPerMinute, enableSanitization,
                strictSanitization, preserveNewlines, enableInjectionDetection, enableContentModeration, blacklist, whitelist);
    }

    @Override
    public String toString() {
        return "SecurityConfig{level=" + level
                + ", maxInputLength=" + maxInputLength
                + ", hardInputLimit=" + hardInputLimit
                + ", rateLimitPerMinute=" + rateLimitPerMinute
                + ", sanitization=" + enableSanitization
                + ", strictSanitization=" + strictSanitization
                + ", preserveNewlines=" + preserveNewlines
                + ", injectionDetection=" + enableInjectionDetection
                + ", contentModeration=" + enableContentModeration
                + ", blacklist=" + blacklist.size()
                + ", whitelist=" + whitelist.size() + "}";
    }

    public static final class Builder {

        private SecurityLevel level;
        private String rawLevel;
        private int maxInputLength = DEFAULT_MAX_INPUT_LENGTH;
        private int hardInputLimit = DEFAULT_HARD_INPUT_LIMIT;
        private int rateLimitPerMinute = DEFAULT_RATE_LIMIT_PER_MINUTE;
        private boolean enableSanitization = true;
        private boolean strictSanitization;
        private boolean preserveNewlines;
        private boolean enableInjectionDetection = true;
        private boolean enableContentModeration = true;
        private Collection<String> blacklist;
        private Collection<String> whitelist;

        private Builder() {}

        public Builder level(SecurityLevel level) {
            this.level = level;
            this.rawLevel = null;
            return this;
        }

        /** Parsed on {@link #build()} so that a bad value surfaces as {@link ConfigurationException}. */
        public Builder level(String level) {
            this.rawLevel = level;
            this.level = null;
            return this;
        }

        public Builder maxInputLength(int maxInputLength) {
            this.maxInputLength = maxInputLength;
            return this;
        }

        public Builder hardInputLimit(int hardInputLimit) {
            this.hardInputLimit = hardInputLimit;
            return this;
        }

        public Builder rateLimitPerMinute(int rateLimitPerMinute) {
            this.rateLimitPerMinute = rateLimitPerMinute;
            return this;
        }

        /**
         * Disabling sanitization forwards raw text unchanged. This is an
         * insecure mode intended for debugging only.
         */
        public Builder enableSanitization(boolean enableSanitization) {
            this.enableSanitization = enableSanitization;
            return this;
        }

        /**
         * Forwards the strict form of the sanitized text (see
         * {@code InputSanitizer#sanitizeStrict}). Matching still runs on the
         * regular sanitized text.
         */
        public Builder strictSanitization(boolean strictSanitization) {
            this.strictSanitization = strictSanitization;
            return this;
        }

        public Builder preserveNewlines(boolean preserveNewlines) {
            this.preserveNewlines = preserveNewlines;
            return this;
        }

        public Builder enableInjectionDetection(boolean enableInjectionDetection) {
            this.enableInjectionDetection = enableInjectionDetection;
            return this;
        }

        public Builder enableContentModeration(boolean enableContentModeration) {
            this.enableContentModeration = enableContentModeration;
            return this;
        }

        public Builder blacklist(Collection<String> blacklist) {
            this.blacklist = blacklist;
            return this;
        }

        public Builder whitelist(Collection<String> whitelist) {
            this.whitelist = whitelist;
            return this;
        }

        /**
         * @throws ConfigurationException if any value is invalid
         */
        public SecurityConfig build() {
            SecurityLevel resolved = level != null ? level : SecurityLevel.parse(rawLevel);
            if (maxInputLength <= 0) {
                throw new ConfigurationException("maxInputLength must be positive, got: " + maxInputLength);
            }
            if (rateLimitPerMinute <= 0) {
                throw new ConfigurationException("rateLimitPerMinute must be positive, got: " + rateLimitPerMinute);
            }
            if (hardInputLimit < maxInputLength) {
                throw new ConfigurationException("hardInputLimit (" + hardInputLimit
                        + ") must not be below maxInputLength (" + maxInputLength + ")");
            }
            if (strictSanitization && preserveNewlines) {
                throw new ConfigurationException("strictSanitization collapses all whitespace and cannot be "
                        + "combined with preserveNewlines");
            }
            if (strictSanitization && !enableSanitization) {
                throw new ConfigurationException("strictSanitization requires enableSanitization");
            }
            return new SecurityConfig(this, resolved, PhraseList.of(blacklist), PhraseList.of(whitelist));
        }
    }
}
