package com.promptguard.pipeline;

import com.promptguard.audit.SecurityAuditLogger;
import com.promptguard.config.SecurityConfig;
import com.promptguard.content.InputSanitizer;
import com.promptguard.content.SanitizationResult;
import com.promptguard.content.ValidationException;
import com.promptguard.detection.DetectionResult;
import com.promptguard.detection.PatternMatch;
import com.promptguard.detection.PromptInjectionDetector;
import com.promptguard.detection.ThreatLevel;
import com.promptguard.moderation.ContentModerator;
import com.promptguard.moderation.RateLimitDecision;
import com.promptguard.moderation.SessionStats;
import com.promptguard.observability.PromptGuardMetrics;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs untrusted text through rate limiting, sanitization, blacklist matching
 * and injection detection, and decides whether it may be forwarded to the
 * model.
 *
 * <p>Stages run in a fixed order and stop at the first block:
 * <ol>
 *   <li>rate limit (when content moderation is enabled)</li>
 *   <li>sanitize (raw text passes through unchanged when sanitization is disabled);
 *       in strict mode the strict form is forwarded while matching still uses
 *       the regular sanitized text</li>
 *   <li>blacklist, which always wins over whitelist and detection</li>
 *   <li>injection detection (when enabled); a whitelist hit forces the level to SAFE</li>
 *   <li>policy: block when the level reaches the configured threshold</li>
 * </ol>
 *
 * <p>The only state carried between calls is the moderator's session table.
 * The active {@link SecurityConfig} is swapped atomically; each call works
 * against the snapshot it read on entry.
 */
@Service
public class SecurityPipeline {

    private static final Logger log = LoggerFactory.getLogger(SecurityPipeline.class);

    private final InputSanitizer sanitizer;
    private final PromptInjectionDetector detector;
    private final ContentModerator moderator;
    private final PromptGuardMetrics metrics;
    private final SecurityAuditLogger auditLogger;
    private final Clock clock;
    private final AtomicReference<SecurityConfig> config;

    public SecurityPipeline(InputSanitizer sanitizer, PromptInjectionDetector detector,
                            ContentModerator moderator, SecurityConfig config,
                            PromptGuardMetrics metrics, SecurityAuditLogger auditLogger, Clock clock) {
        this.sanitizer = sanitizer;
        this.detector = detector;
        this.moderator = moderator;
        this.metrics = metrics;
        this.auditLogger = auditLogger;
        this.clock = clock;
        this.config = new AtomicReference<>(Objects.requireNonNull(config, "config"));
        warnIfInsecure(config);
        log.info("SecurityPipeline initialized: {}", config);
    }

    public SecurityConfig getConfig() {
        return config.get();
    }

    /**
     * Replaces the active configuration. Calls already in progress finish
     * with the configuration they started with.
     */
    public void updateConfig(SecurityConfig newConfig) {
        Objects.requireNonNull(newConfig, "newConfig");
        SecurityConfig previous = config.getAndSet(newConfig);
        warnIfInsecure(newConfig);
        auditLogger.logConfigChange("from=" + previous + " to=" + newConfig);
    }

    public PipelineResult process(String rawText, String sessionId) {
        return process(rawText, sessionId, config.get());
    }

    /**
     * @throws ValidationException for empty input, input above the hard
     *         limit, or a missing session id
     */
    public PipelineResult process(String rawText, String sessionId, SecurityConfig cfg) {
        validate(rawText, sessionId, cfg);
        Timer.Sample sample = metrics.startPipelineTimer();
        PipelineResult result = evaluate(rawText, sessionId, cfg);
        metrics.stopPipelineTimer(sample, result.action().name());
        metrics.recordDecision(result.action().name(), result.reason());

        if (result.isBlocked()) {
            log.warn("Message blocked for session={} reason={} detail={}",
                    sessionId, result.reason(), result.detail());
            auditLogger.logBlocked(sessionId, result);
        }
        return result;
    }

    /**
     * Same as {@link #process(String, String)} but returns the sanitized text
     * directly.
     *
     * @throws SecurityBlockedException when the message is blocked
     */
    public String processOrThrow(String rawText, String sessionId) {
        PipelineResult result = process(rawText, sessionId);
        if (result.isBlocked()) {
            throw new SecurityBlockedException(result);
        }
        return result.sanitizedText().orElseThrow();
    }

    public Optional<SessionStats> sessionStats(String sessionId) {
        return moderator.getSessionStats(sessionId, clock.instant(), config.get().getRateLimitPerMinute());
    }

    public boolean resetSession(String sessionId) {
        return moderator.resetSession(sessionId);
    }

    private PipelineResult evaluate(String rawText, String sessionId, SecurityConfig cfg) {
        // 1. Rate limit
        if (cfg.isEnableContentModeration()) {
            RateLimitDecision decision = moderator.checkRateLimit(sessionId, clock.instant(),
                    cfg.getRateLimitPerMinute());
            if (!decision.allowed()) {
                metrics.recordRateLimitExceeded();
                return PipelineResult.rateLimited(decision.retryAfter());
            }
        }

        // 2. Sanitize
        String text = rawText;
        String forwarded = rawText;
        if (cfg.isEnableSanitization()) {
            SanitizationResult sanitized = sanitizer.sanitize(rawText, cfg.getMaxInputLength(),
                    cfg.isPreserveNewlines());
            if (sanitized.isEmpty()) {
                throw new ValidationException("Input is empty after sanitization");
            }
            if (sanitized.truncated()) {
                log.info("Input for session={} truncated from {} to {} characters",
                        sessionId, sanitized.originalLength(), sanitized.cleanedText().length());
            }
            text = sanitized.cleanedText();
            forwarded = text;
            if (cfg.isStrictSanitization()) {
                forwarded = sanitizer.sanitizeStrict(rawText, cfg.getMaxInputLength()).cleanedText();
                if (forwarded.isEmpty()) {
                    throw new ValidationException("Input is empty after strict sanitization");
                }
            }
        }
        if (log.isDebugEnabled() && sanitizer.detectSuspiciousEncoding(text)) {
            log.debug("Input for session={} carries escape or entity sequences", sessionId);
        }

        // 3. Blacklist
        if (moderator.matchesBlacklist(text, cfg)) {
            return finish(sessionId, cfg, PipelineResult.blacklisted());
        }

        // 4. Detection
        if (!cfg.isEnableInjectionDetection()) {
            return finish(sessionId, cfg, PipelineResult.allow(forwarded, ReasonCodes.PASSED, null));
        }
        DetectionResult detection = detector.detect(text);
        for (PatternMatch match : detection.matches()) {
            metrics.recordDetectionMatch(match.category());
        }
        ThreatLevel effective = detection.level();
        boolean whitelisted = moderator.matchesWhitelist(text, cfg);
        if (whitelisted && effective != ThreatLevel.SAFE) {
            log.info("Whitelist match for session={} overrides detected level {}", sessionId, effective);
            effective = ThreatLevel.SAFE;
        }

        // 5. Policy
        if (cfg.getLevel().blocks(effective)) {
            return finish(sessionId, cfg, PipelineResult.threat(detection));
        }
        if (!detection.isSafe() && !whitelisted) {
            log.debug("Detected level {} below threshold {} for session={}",
                    detection.level(), cfg.getThreshold(), sessionId);
        }
        String reason = whitelisted ? ReasonCodes.WHITELISTED : ReasonCodes.PASSED;
        return finish(sessionId, cfg, PipelineResult.allow(forwarded, reason, detection));
    }

    private PipelineResult finish(String sessionId, SecurityConfig cfg, PipelineResult result) {
        if (cfg.isEnableContentModeration()) {
            moderator.recordOutcome(sessionId, result.isAllowed());
        }
        return result;
    }

    private static void validate(String rawText, String sessionId, SecurityConfig cfg) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new ValidationException("Session id is required");
        }
        if (rawText == null || rawText.isBlank()) {
            throw new ValidationException("Empty message");
        }
        if (rawText.length() > cfg.getHardInputLimit()) {
            throw new ValidationException(String.format(
                    "Message exceeds maximum length (%d > %d characters)",
                    rawText.length(), cfg.getHardInputLimit()));
        }
    }

    private static void warnIfInsecure(SecurityConfig cfg) {
        if (!cfg.isEnableSanitization()) {
            log.warn("Input sanitization is DISABLED: raw text is forwarded unchanged (insecure mode)");
        }
        if (!cfg.isEnableInjectionDetection()) {
            log.warn("Prompt injection detection is DISABLED by configuration");
        }
    }
}
