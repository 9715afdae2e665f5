package com.promptguard.audit;

import com.promptguard.detection.DetectionResult;
import com.promptguard.detection.ThreatCategory;
import com.promptguard.pipeline.PipelineResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.stream.Collectors;

/**
 * Writes one structured line per blocked message to the {@value #AUDIT_LOGGER}
 * logger. Where those lines end up is decided by the logging configuration.
 */
@Service
public class SecurityAuditLogger {

    public static final String AUDIT_LOGGER = "promptguard.audit";

    private static final Logger audit = LoggerFactory.getLogger(AUDIT_LOGGER);

    public void logBlocked(String sessionId, PipelineResult result) {
        String level = result.detection().map(d -> d.level().name()).orElse("-");
        String categories = result.detection().map(SecurityAuditLogger::categories).orElse("-");
        audit.warn("audit event=BLOCK session={} reason={} level={} categories={} retryAfterMs={}",
                sessionId, result.reason(), level, categories,
                result.retryAfter().map(d -> String.valueOf(d.toMillis())).orElse("-"));
    }

    public void logConfigChange(String description) {
        audit.info("audit event=CONFIG_CHANGE {}", description);
    }

    private static String categories(DetectionResult detection) {
        String joined = detection.categories().stream()
                .map(ThreatCategory::code)
                .collect(Collectors.joining(","));
        return joined.isEmpty() ? "-" : joined;
    }
}
