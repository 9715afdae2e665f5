package com.promptguard.config;

import com.promptguard.observability.LogRedactionConverter;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.regex.PatternSyntaxException;

/**
 * Pushes configured redaction patterns into the Logback
 * LogRedactionConverter via its static holder.
 */
@Configuration
public class LoggingConfig {

    private static final Logger log = LoggerFactory.getLogger(LoggingConfig.class);

    private final PromptGuardProperties properties;

    public LoggingConfig(PromptGuardProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    public void configureRedaction() {
        List<String> patterns = properties.getLogging().getRedactPatterns();
        if (patterns == null || patterns.isEmpty()) {
            log.info("Using default log redaction patterns (email, card number, encoded blob)");
            return;
        }
        try {
            LogRedactionConverter.setConfiguredPatterns(patterns);
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException("Invalid log redaction pattern: " + e.getDescription(), e);
        }
        log.info("Configuring {} additional log redaction patterns", patterns.size());
    }
}
