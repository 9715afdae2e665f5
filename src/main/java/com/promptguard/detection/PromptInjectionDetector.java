package com.promptguard.detection;

import com.promptguard.detection.EncodedPayloadScanner.Candidate;
import com.promptguard.detection.EncodedPayloadScanner.ScanBudget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Matcher;

/**
 * Scores text for prompt-injection attempts.
 *
 * <p>Runs two passes and keeps the higher level:
 * <ol>
 *   <li>every rule of the current {@link RuleSet} against a case-folded copy of the text;</li>
 *   <li>Base64, hex, percent-escaped and backslash-escaped candidates are decoded
 *       and the rule pass is repeated on the decoded text, at most
 *       {@value #MAX_DECODE_DEPTH} layers deep. A decoded hit escalates the result
 *       to at least {@link ThreatLevel#HIGH}.</li>
 * </ol>
 *
 * <p>At most {@value #MAX_CANDIDATES} printable candidates are decoded per call.
 * Input that holds more is reported at {@link ThreatLevel#HIGH} as not fully
 * inspected rather than passed as safe.
 *
 * <p>Thread-safe: the rule set is immutable and swapped by reference.
 */
@Component
public class PromptInjectionDetector {

    private static final Logger log = LoggerFactory.getLogger(PromptInjectionDetector.class);

    static final int MAX_DECODE_DEPTH = 2;
    static final int MAX_CANDIDATES = 32;
    static final int MAX_MATCHES_PER_RULE = 16;
    private static final int PREVIEW_LENGTH = 80;

    /** Rule id reported when the candidate budget runs out before the scan finishes. */
    public static final String SCAN_LIMIT_RULE_ID = "encoded-payload.scan-limit";

    private final AtomicReference<RuleSet> ruleSet;
    private final EncodedPayloadScanner scanner = new EncodedPayloadScanner();

    public PromptInjectionDetector(RuleSet ruleSet) {
        this.ruleSet = new AtomicReference<>(Objects.requireNonNull(ruleSet, "ruleSet"));
        log.info("PromptInjectionDetector initialized with {} rules", ruleSet.size());
    }

    public RuleSet getRuleSet() {
        return ruleSet.get();
    }

    /**
     * Swaps in a new rule set. Detections already running finish against the
     * set they started with.
     */
    public void replaceRules(RuleSet newRules) {
        RuleSet previous = ruleSet.getAndSet(Objects.requireNonNull(newRules, "newRules"));
        log.info("Rule set replaced: {} -> {} rules", previous.size(), newRules.size());
    }

    public DetectionResult detect(String text) {
        if (text == null || text.isBlank()) {
            return DetectionResult.safe();
        }
        RuleSet rules = ruleSet.get();

        List<PatternMatch> matches = new ArrayList<>(matchRules(rules, text));

        DecodedPayload firstPayload = null;
        ScanBudget budget = new ScanBudget(MAX_CANDIDATES);
        for (Candidate candidate : scanner.scan(text, budget)) {
            DecodedPayload payload = inspect(rules, text, candidate, 1, budget);
            if (payload == null) {
                continue;
            }
            ThreatLevel inner = ThreatLevel.SAFE;
            for (PatternMatch m : payload.innerMatches()) {
                inner = ThreatLevel.max(inner, m.level());
            }
            matches.add(new PatternMatch(
                    "encoded-payload." + candidate.encoding().name().toLowerCase(Locale.ROOT),
                    ThreatCategory.ENCODING_BYPASS,
                    ThreatLevel.max(ThreatLevel.HIGH, inner),
                    candidate.start(), candidate.end()));
            if (firstPayload == null) {
                firstPayload = payload;
            }
        }
        if (budget.exhausted()) {
            log.warn("Encoded candidate limit of {} reached; input flagged as not fully inspected", MAX_CANDIDATES);
            matches.add(new PatternMatch(SCAN_LIMIT_RULE_ID, ThreatCategory.ENCODING_BYPASS, ThreatLevel.HIGH,
                    0, text.length()));
        }

        if (matches.isEmpty()) {
            return DetectionResult.safe();
        }
        DetectionResult result = DetectionResult.of(matches, firstPayload);
        log.debug("Detection level={} matches={} encoded={}", result.level(), matches.size(),
                result.decodedFrom().isPresent());
        return result;
    }

    /**
     * Runs the rule pass over a decoded candidate and, while the depth bound
     * allows, over anything still encoded inside it.
     */
    private DecodedPayload inspect(RuleSet rules, String scanned, Candidate candidate, int depth,
                                   ScanBudget budget) {
        List<PatternMatch> inner = introducedByDecoding(rules, scanned, candidate);
        if (!inner.isEmpty()) {
            return new DecodedPayload(candidate.encoding(), candidate.start(), candidate.end(),
                    depth, preview(candidate.decoded()), inner);
        }
        if (depth >= MAX_DECODE_DEPTH) {
            return null;
        }
        for (Candidate nested : scanner.scan(candidate.decoded(), budget)) {
            DecodedPayload found = inspect(rules, candidate.decoded(), nested, depth + 1, budget);
            if (found != null) {
                // report against the outer span, which is what the caller can see
                return new DecodedPayload(candidate.encoding(), candidate.start(), candidate.end(),
                        found.depth(), found.preview(), found.innerMatches());
            }
        }
        return null;
    }

    /**
     * Rule hits on the decoded text of {@code candidate}. Base64 and hex
     * candidates are fully encoded, so every hit counts. Escape candidates also
     * carry plain text; a hit there counts only when it covers a decoded escape
     * and the same rule does not already match the same raw span.
     */
    private static List<PatternMatch> introducedByDecoding(RuleSet rules, String scanned, Candidate candidate) {
        List<PatternMatch> decodedMatches = matchRules(rules, candidate.decoded());
        if (!candidate.isMixed() || decodedMatches.isEmpty()) {
            return decodedMatches;
        }
        List<PatternMatch> rawMatches = matchRules(rules, scanned.substring(candidate.start(), candidate.end()));
        List<PatternMatch> introduced = new ArrayList<>();
        for (PatternMatch match : decodedMatches) {
            if (!candidate.touchesEscape(match.start(), match.end())) {
                continue;
            }
            int rawStart = candidate.sourceOffset(match.start());
            int rawEnd = candidate.sourceOffset(match.end());
            boolean alreadyVisible = rawMatches.stream().anyMatch(raw -> raw.ruleId().equals(match.ruleId())
                    && raw.start() == rawStart && raw.end() == rawEnd);
            if (!alreadyVisible) {
                introduced.add(match);
            }
        }
        return introduced;
    }

    private static List<PatternMatch> matchRules(RuleSet rules, String text) {
        String folded = fold(text);
        List<PatternMatch> matches = new ArrayList<>();
        for (InjectionRule rule : rules.rules()) {
            Matcher m = rule.pattern().matcher(folded);
            int hits = 0;
            while (hits < MAX_MATCHES_PER_RULE && m.find()) {
                matches.add(new PatternMatch(rule.id(), rule.category(), rule.level(), m.start(), m.end()));
                hits++;
            }
        }
        return matches;
    }

    /**
     * Lower-cases char by char so that match offsets stay valid in {@code text}.
     */
    private static String fold(String text) {
        char[] chars = text.toCharArray();
        for (int i = 0; i < chars.length; i++) {
            chars[i] = Character.toLowerCase(chars[i]);
        }
        return new String(chars);
    }

    private static String preview(String decoded) {
        return decoded.length() <= PREVIEW_LENGTH ? decoded : decoded.substring(0, PREVIEW_LENGTH);
    }
}
