package com.promptguard.pipeline;

import com.promptguard.detection.DetectionResult;
import com.promptguard.detection.ThreatCategory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one {@link SecurityPipeline#process} call.
 *
 * @param action        allow or block
 * @param sanitizedText text to forward to the model; present only on ALLOW
 * @param reason        machine-readable code, see {@link ReasonCodes}
 * @param detail        human-readable explanation suitable for the end user
 * @param detection     detector output when the detector ran
 * @param retryAfter    present when blocked by the rate limiter
 */
public record PipelineResult(
        PipelineAction action,
        Optional<String> sanitizedText,
        String reason,
        String detail,
        Optional<DetectionResult> detection,
        Optional<Duration> retryAfter
) {
    public PipelineResult {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(reason, "reason");
    }

    public static PipelineResult allow(String sanitizedText, String reason, DetectionResult detection) {
        return new PipelineResult(PipelineAction.ALLOW, Optional.of(sanitizedText), reason,
                "Content approved", Optional.ofNullable(detection), Optional.empty());
    }

    public static PipelineResult rateLimited(Duration retryAfter) {
        long seconds = Math.max(1, (retryAfter.toMillis() + 999) / 1000);
        return new PipelineResult(PipelineAction.BLOCK, Optional.empty(), ReasonCodes.RATE_LIMIT_EXCEEDED,
                "Rate limit exceeded. Please wait " + seconds + " seconds.",
                Optional.empty(), Optional.of(retryAfter));
    }

    public static PipelineResult blacklisted() {
        return new PipelineResult(PipelineAction.BLOCK, Optional.empty(), ReasonCodes.BLACKLIST_MATCH,
                "Content contains blacklisted pattern", Optional.empty(), Optional.empty());
    }

    public static PipelineResult threat(DetectionResult detection) {
        String categories = String.join(", ",
                detection.categories().stream().map(ThreatCategory::code).toList());
        String detail = "Matched " + detection.matches().size() + " suspicious pattern(s): "
                + categories + " (level " + detection.level() + ")";
        return new PipelineResult(PipelineAction.BLOCK, Optional.empty(), ReasonCodes.THREAT_DETECTED,
                detail, Optional.of(detection), Optional.empty());
    }

    public boolean isAllowed() {
        return action == PipelineAction.ALLOW;
    }

    public boolean isBlocked() {
        return action == PipelineAction.BLOCK;
    }
}
