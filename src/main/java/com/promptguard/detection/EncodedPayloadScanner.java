package com.promptguard.detection;

import com.promptguard.detection.DecodedPayload.Encoding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Base64;
import java.util.HexFormat;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds runs of text that look like an encoded payload (Base64, hex, percent
 * escapes, backslash escapes) and decodes them. Candidates that fail to decode
 * or decode to non-printable data are dropped and cost nothing; only printable
 * candidates are charged to the {@link ScanBudget}.
 */
final class EncodedPayloadScanner {

    private static final Logger log = LoggerFactory.getLogger(EncodedPayloadScanner.class);

    static final int MIN_BASE64_LENGTH = 20;
    static final int MIN_HEX_LENGTH = 20;
    static final int MIN_ESCAPES = 3;
    static final int MIN_DECODED_LENGTH = 4;
    static final int MAX_CANDIDATE_LENGTH = 4096;
    static final int ESCAPE_CONTEXT = 256;

    private static final Pattern BASE64_RUN = Pattern.compile(
            "[A-Za-z0-9+/]{" + MIN_BASE64_LENGTH + ",}={0,2}");
    private static final Pattern HEX_RUN = Pattern.compile(
            "(?<![0-9A-Fa-f])(?:[0-9A-Fa-f]{2}){" + (MIN_HEX_LENGTH / 2) + ",}(?![0-9A-Fa-f])");
    private static final Pattern PERCENT_ESCAPE = Pattern.compile("%[0-9A-Fa-f]{2}");
    private static final Pattern BACKSLASH_ESCAPE = Pattern.compile("\\\\(?:u[0-9A-Fa-f]{4}|x[0-9A-Fa-f]{2})");

    /**
     * A decoded region of the scanned text.
     *
     * <p>For escape encodings the region mixes plain characters with decoded
     * escapes. {@code sourceOffsets[i]} is the region-relative index of the raw
     * character that produced decoded character {@code i} (one extra entry maps
     * the end), and {@code escaped} marks decoded characters that came from an
     * escape. Both are {@code null} for Base64 and hex, where every character is
     * decoded.
     */
    record Candidate(Encoding encoding, int start, int end, String decoded,
                     int[] sourceOffsets, BitSet escaped) {

        Candidate(Encoding encoding, int start, int end, String decoded) {
            this(encoding, start, end, decoded, null, null);
        }

        boolean isMixed() {
            return escaped != null;
        }

        /** Whether decoded span {@code [from, to)} contains a decoded escape. */
        boolean touchesEscape(int from, int to) {
            if (escaped == null) {
                return true;
            }
            int next = escaped.nextSetBit(from);
            return next >= 0 && next < to;
        }

        /** Region-relative raw index for a decoded index; only for mixed candidates. */
        int sourceOffset(int decodedIndex) {
            return sourceOffsets[decodedIndex];
        }
    }

    private record Decoded(String text, int[] sourceOffsets, BitSet escaped) {}

    /**
     * Decodes every candidate in {@code text}. Each printable candidate costs
     * one unit of {@code budget}; scanning stops once the budget refuses one,
     * which leaves {@link ScanBudget#exhausted()} set.
     */
    List<Candidate> scan(String text, ScanBudget budget) {
        List<Candidate> found = new ArrayList<>();
        scanBase64(text, budget, found);
        scanHex(text, budget, found);
        scanEscapes(text, PERCENT_ESCAPE, Encoding.PERCENT, budget, found);
        scanEscapes(text, BACKSLASH_ESCAPE, Encoding.BACKSLASH_ESCAPE, budget, found);
        found.sort((a, b) -> Integer.compare(a.start(), b.start()));
        return found;
    }

    private void scanBase64(String text, ScanBudget budget, List<Candidate> found) {
        Matcher m = BASE64_RUN.matcher(text);
        while (!budget.exhausted() && m.find()) {
            String decoded = decodeBase64(capLength(m.group(), 4));
            if (decoded != null && budget.tryConsume()) {
                found.add(new Candidate(Encoding.BASE64, m.start(), m.end(), decoded));
            }
        }
    }

    private void scanHex(String text, ScanBudget budget, List<Candidate> found) {
        Matcher m = HEX_RUN.matcher(text);
        while (!budget.exhausted() && m.find()) {
            String decoded = decodeUtf8(HexFormat.of().parseHex(capLength(m.group(), 2)));
            if (decoded != null && isPrintable(decoded) && budget.tryConsume()) {
                found.add(new Candidate(Encoding.HEX, m.start(), m.end(), decoded));
            }
        }
    }

    /**
     * Escape sequences are decoded in place, so plain characters mixed in with
     * the escapes survive decoding. The escapes are covered by consecutive
     * windows of at most {@value #MAX_CANDIDATE_LENGTH} characters; each window
     * opens on a word boundary at most {@value #ESCAPE_CONTEXT} characters
     * before its first escape and never cuts an escape in half.
     */
    private void scanEscapes(String text, Pattern escape, Encoding encoding,
                             ScanBudget budget, List<Candidate> found) {
        List<int[]> escapes = new ArrayList<>();
        Matcher m = escape.matcher(text);
        while (m.find()) {
            escapes.add(new int[]{m.start(), m.end()});
        }
        if (escapes.size() < MIN_ESCAPES) {
            return;
        }
        int previousEnd = 0;
        int i = 0;
        while (i < escapes.size() && !budget.exhausted()) {
            int first = escapes.get(i)[0];
            int start = Math.max(previousEnd, windowStart(text, first));
            int end = Math.min(text.length(), start + MAX_CANDIDATE_LENGTH);
            for (int[] e : escapes) {
                if (e[0] < end && e[1] > end) {
                    end = e[0];
                    break;
                }
            }
            Decoded decoded = encoding == Encoding.PERCENT
                    ? decodePercent(text.substring(start, end))
                    : decodeBackslash(text.substring(start, end));
            if (decoded != null && budget.tryConsume()) {
                found.add(new Candidate(encoding, start, end, decoded.text(),
                        decoded.sourceOffsets(), decoded.escaped()));
            }
            previousEnd = end;
            while (i < escapes.size() && escapes.get(i)[0] < end) {
                i++;
            }
        }
    }

    private static int windowStart(String text, int firstEscape) {
        int start = Math.max(0, firstEscape - ESCAPE_CONTEXT);
        while (start > 0 && start < firstEscape && !Character.isWhitespace(text.charAt(start - 1))) {
            start++;
        }
        return start;
    }

    private static String capLength(String run, int unit) {
        if (run.length() <= MAX_CANDIDATE_LENGTH) {
            return run;
        }
        return run.substring(0, MAX_CANDIDATE_LENGTH - (MAX_CANDIDATE_LENGTH % unit));
    }

    private static String decodeBase64(String run) {
        String body = run.endsWith("=") ? run.replaceAll("=+$", "") : run;
        if (body.length() % 4 == 1) {
            return null;
        }
        try {
            String decoded = decodeUtf8(Base64.getDecoder().decode(body));
            return decoded != null && isPrintable(decoded) ? decoded : null;
        } catch (IllegalArgumentException e) {
            log.trace("Base64 candidate rejected: {}", e.getMessage());
            return null;
        }
    }

    /**
     * Consecutive percent escapes are gathered into one byte sequence and
     * decoded as UTF-8 before the next plain character is copied.
     */
    private static Decoded decodePercent(String region) {
        StringBuilder out = new StringBuilder(region.length());
        int[] offsets = new int[region.length() + 1];
        BitSet escaped = new BitSet();
        ByteArrayOutputStream pending = new ByteArrayOutputStream();
        int pendingStart = -1;
        int i = 0;
        while (i < region.length()) {
            char c = region.charAt(i);
            if (c == '%' && isHex(region, i + 1, 2)) {
                if (pendingStart < 0) pendingStart = i;
                pending.write(Integer.parseInt(region, i + 1, i + 3, 16));
                i += 3;
                continue;
            }
            if (pendingStart >= 0 && !flush(pending, pendingStart, out, offsets, escaped)) {
                return null;
            }
            pendingStart = -1;
            offsets[out.length()] = i;
            out.append(c);
            i++;
        }
        if (pendingStart >= 0 && !flush(pending, pendingStart, out, offsets, escaped)) {
            return null;
        }
        offsets[out.length()] = region.length();
        return isPrintable(out) ? new Decoded(out.toString(), offsets, escaped) : null;
    }

    private static boolean flush(ByteArrayOutputStream pending, int rawStart, StringBuilder out,
                                 int[] offsets, BitSet escaped) {
        String chunk = decodeUtf8(pending.toByteArray());
        pending.reset();
        if (chunk == null) {
            return false;
        }
        for (int k = 0; k < chunk.length(); k++) {
            offsets[out.length()] = rawStart;
            escaped.set(out.length());
            out.append(chunk.charAt(k));
        }
        return true;
    }

    private static Decoded decodeBackslash(String region) {
        StringBuilder out = new StringBuilder(region.length());
        int[] offsets = new int[region.length() + 1];
        BitSet escaped = new BitSet();
        int i = 0;
        while (i < region.length()) {
            char c = region.charAt(i);
            offsets[out.length()] = i;
            if (c == '\\' && i + 1 < region.length()) {
                char kind = region.charAt(i + 1);
                int digits = kind == 'u' ? 4 : kind == 'x' ? 2 : 0;
                if (digits > 0 && isHex(region, i + 2, digits)) {
                    escaped.set(out.length());
                    out.append((char) Integer.parseInt(region, i + 2, i + 2 + digits, 16));
                    i += 2 + digits;
                    continue;
                }
            }
            out.append(c);
            i++;
        }
        offsets[out.length()] = region.length();
        return isPrintable(out) ? new Decoded(out.toString(), offsets, escaped) : null;
    }

    private static boolean isHex(String s, int from, int count) {
        if (from + count > s.length()) {
            return false;
        }
        for (int i = from; i < from + count; i++) {
            if (Character.digit(s.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }

    private static String decodeUtf8(byte[] bytes) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            return null;
        }
    }

    private static boolean isPrintable(CharSequence text) {
        if (text.length() < MIN_DECODED_LENGTH) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isISOControl(c) && c != '\n' && c != '\r' && c != '\t') {
                return false;
            }
        }
        return true;
    }

    /**
     * Caps the number of printable candidates decoded for one top-level
     * detection, nested decodes included. Once a candidate is refused the
     * budget reports {@link #exhausted()} and the caller must treat the input
     * as not fully inspected.
     */
    static final class ScanBudget {

        private int remaining;
        private boolean exhausted;

        ScanBudget(int maxCandidates) {
            this.remaining = maxCandidates;
        }

        boolean tryConsume() {
            if (remaining <= 0) {
                exhausted = true;
                return false;
            }
            remaining--;
            return true;
        }

        int remaining() { return remaining; }

        boolean exhausted() { return exhausted; }
    }
}
