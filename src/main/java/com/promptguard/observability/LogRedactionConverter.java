package com.promptguard.observability;

import ch.qos.logback.classic.pattern.ClassicConverter;
import ch.qos.logback.classic.spi.ILoggingEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Logback converter applied to every pipeline log line. Blocked inputs and
 * decoded payloads are logged as previews, and those previews are attacker
 * text: an encoded injection echoed verbatim into the log would reach any
 * tool that later reads or re-decodes it. Long Base64 blobs are therefore
 * masked along with e-mail addresses and card-like digit runs, and line
 * breaks are flattened so user text cannot forge log lines. Extra patterns
 * come from {@code promptguard.logging.redact-patterns} via LoggingConfig.
 */
public class LogRedactionConverter extends ClassicConverter {

    private static final List<Pattern> DEFAULT_PATTERNS = List.of(
            Pattern.compile("[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}"),   // e-mail
            Pattern.compile("\\b(?:\\d[ -]?){13,16}\\b"),                          // card number
            Pattern.compile("[A-Za-z0-9+/]{40,}={0,2}")                            // encoded blob
    );

    private static final Pattern LINE_BREAKS = Pattern.compile("[\\r\\n]+");

    private static volatile List<Pattern> configuredPatterns = null;

    public static void setConfiguredPatterns(List<String> patterns) {
        List<Pattern> compiled = new ArrayList<>(DEFAULT_PATTERNS);
        if (patterns != null) {
            for (String p : patterns) {
                compiled.add(Pattern.compile(p));
            }
        }
        configuredPatterns = List.copyOf(compiled);
    }

    static void resetPatterns() {
        configuredPatterns = null;
    }

    @Override
    public String convert(ILoggingEvent event) {
        return redact(event.getFormattedMessage());
    }

    static String redact(String message) {
        if (message == null) return "";

        List<Pattern> patterns = configuredPatterns != null ? configuredPatterns : DEFAULT_PATTERNS;
        String redacted = LINE_BREAKS.matcher(message).replaceAll(" ");
        for (Pattern pattern : patterns) {
            redacted = pattern.matcher(redacted).replaceAll("[REDACTED]");
        }
        return redacted;
    }
}
