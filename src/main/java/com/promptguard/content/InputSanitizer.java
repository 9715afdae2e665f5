package com.promptguard.content;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.text.Normalizer;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Normalizes untrusted text before any matching runs against it. Stateless and
 * deterministic; {@code sanitize(sanitize(x).cleanedText(), n)} returns the
 * same text as {@code sanitize(x, n)}.
 */
@Component
public class InputSanitizer {

    private static final Logger log = LoggerFactory.getLogger(InputSanitizer.class);

    private static final Pattern ANSI_ESCAPE = Pattern.compile("\u001B\\[[0-9;?]*[A-Za-z]");
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern HORIZONTAL_RUN = Pattern.compile("[^\\S\\n]+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern SPACE_AROUND_NEWLINE = Pattern.compile(" ?\n ?");
    private static final Pattern EXCESS_NEWLINES = Pattern.compile("\n{3,}");

    private static final int DROP = -1;

    // Strict mode
    static final int STRICT_MAX_REPEAT = 2;
    private static final Pattern STRICT_DISALLOWED = Pattern.compile("[^\\w\\s.,!?-]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern PUNCTUATION_RUN = Pattern.compile("([.,!?-]){3,}");
    private static final Pattern REPEATED_CHAR = Pattern.compile("(.)\\1{" + STRICT_MAX_REPEAT + ",}", Pattern.DOTALL);

    // Invisible letters that survive NFKC and are not in a control/format category.
    private static final Set<Integer> INVISIBLE_CODEPOINTS = Set.of(
            0x034F,  // combining grapheme joiner
            0x115F, 0x1160, 0x3164, 0xFFA0,  // hangul fillers
            0x2800   // braille blank
    );

    private static final List<Pattern> SUSPICIOUS_ENCODINGS = List.of(
            Pattern.compile("\\\\x[0-9a-fA-F]{2}"),
            Pattern.compile("\\\\u[0-9a-fA-F]{4}"),
            Pattern.compile("%[0-9a-fA-F]{2}"),
            Pattern.compile("&#\\d+;"),
            Pattern.compile("&[a-zA-Z]+;")
    );

    /**
     * @throws EncodingException if {@code raw} holds unpaired surrogates
     * @throws IllegalArgumentException if {@code maxLength} is not positive
     */
    public SanitizationResult sanitize(String raw, int maxLength) {
        return sanitize(raw, maxLength, false);
    }

    /**
     * Same as {@link #sanitize(String, int)}; with {@code preserveNewlines} line
     * breaks survive as {@code \n} (CRLF, CR and Unicode line separators folded
     * into it), runs of other whitespace collapse to one space, and more than
     * one blank line collapses to a single blank line.
     */
    public SanitizationResult sanitize(String raw, int maxLength, boolean preserveNewlines) {
        if (maxLength <= 0) {
            throw new IllegalArgumentException("maxLength must be positive, got: " + maxLength);
        }
        if (raw == null || raw.isEmpty()) {
            return new SanitizationResult("", false, 0);
        }
        requireWellFormed(raw);

        String text = ANSI_ESCAPE.matcher(raw).replaceAll("");
        if (preserveNewlines) {
            text = text.replace("\r\n", "\n");
        }
        // Strip before normalizing so removed joiners cannot leave uncomposed
        // sequences behind, and again after in case NFKC produced new ones.
        text = stripInvisible(text, preserveNewlines);
        text = Normalizer.normalize(text, Normalizer.Form.NFKC);
        text = stripInvisible(text, preserveNewlines);
        text = preserveNewlines ? collapseKeepingLines(text) : WHITESPACE_RUN.matcher(text).replaceAll(" ").strip();

        boolean truncated = false;
        if (text.length() > maxLength) {
            int cut = maxLength;
            if (Character.isHighSurrogate(text.charAt(cut - 1))) {
                cut--;
            }
            log.debug("Input truncated from {} to {} characters", text.length(), cut);
            text = text.substring(0, cut).strip();
            truncated = true;
        }
        return new SanitizationResult(text, truncated, raw.length());
    }

    /**
     * High-security variant for text forwarded verbatim: applies
     * {@link #sanitize(String, int)}, then keeps only word characters,
     * whitespace and {@code . , ! ? -}, shortens punctuation runs to two
     * characters and caps any repeated character at {@value #STRICT_MAX_REPEAT}.
     */
    public SanitizationResult sanitizeStrict(String raw, int maxLength) {
        SanitizationResult base = sanitize(raw, maxLength);
        String text = STRICT_DISALLOWED.matcher(base.cleanedText()).replaceAll("");
        text = WHITESPACE_RUN.matcher(text).replaceAll(" ").strip();
        text = PUNCTUATION_RUN.matcher(text).replaceAll("$1$1");
        text = REPEATED_CHAR.matcher(text).replaceAll("$1".repeat(STRICT_MAX_REPEAT));
        return new SanitizationResult(text, base.truncated(), base.originalLength());
    }

    /**
     * Decodes {@code raw} strictly in {@code charset} and sanitizes the result.
     *
     * @throws EncodingException if the bytes are malformed for {@code charset}
     */
    public SanitizationResult sanitize(byte[] raw, Charset charset, int maxLength) {
        CharsetDecoder decoder = charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return sanitize(decoder.decode(ByteBuffer.wrap(raw)).toString(), maxLength);
        } catch (CharacterCodingException e) {
            throw new EncodingException("Input is not well-formed " + charset.name(), e);
        }
    }

    /**
     * Reports whether the text carries escape or entity sequences commonly
     * used to hide content from plain-text matching.
     */
    public boolean detectSuspiciousEncoding(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        for (Pattern pattern : SUSPICIOUS_ENCODINGS) {
            if (pattern.matcher(text).find()) {
                log.debug("Suspicious encoding pattern detected: {}", pattern.pattern());
                return true;
            }
        }
        return false;
    }

    private static void requireWellFormed(String raw) {
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (Character.isHighSurrogate(c)) {
                if (i + 1 < raw.length() && Character.isLowSurrogate(raw.charAt(i + 1))) {
                    i++;
                    continue;
                }
                throw new EncodingException("Unpaired high surrogate at index " + i);
            }
            if (Character.isLowSurrogate(c)) {
                throw new EncodingException("Unpaired low surrogate at index " + i);
            }
        }
    }

    private static String collapseKeepingLines(String text) {
        String collapsed = HORIZONTAL_RUN.matcher(text).replaceAll(" ");
        collapsed = SPACE_AROUND_NEWLINE.matcher(collapsed).replaceAll("\n");
        return EXCESS_NEWLINES.matcher(collapsed).replaceAll("\n\n").strip();
    }

    /**
     * Removes control and format characters, keeping whitespace controls as a
     * plain space so word boundaries survive. With {@code keepNewlines} line
     * breaks become {@code \n} instead.
     */
    private static String stripInvisible(String text, boolean keepNewlines) {
        StringBuilder out = null;
        int i = 0;
        while (i < text.length()) {
            int cp = text.codePointAt(i);
            int replacement = replacementFor(cp, keepNewlines);
            if (replacement != cp && out == null) {
                out = new StringBuilder(text.length());
                out.append(text, 0, i);
            }
            if (out != null && replacement != DROP) {
                out.appendCodePoint(replacement);
            }
            i += Character.charCount(cp);
        }
        return out == null ? text : out.toString();
    }

    private static int replacementFor(int cp, boolean keepNewlines) {
        if (keepNewlines && isLineBreak(cp)) {
            return '\n';
        }
        if (!isInvisible(cp)) {
            return cp;
        }
        return Character.isWhitespace(cp) || cp == 0x85 ? ' ' : DROP;
    }

    private static boolean isLineBreak(int cp) {
        return cp == '\n' || cp == '\r' || cp == 0x85 || cp == 0x2028 || cp == 0x2029;
    }

    private static boolean isInvisible(int cp) {
        int type = Character.getType(cp);
        return type == Character.CONTROL
                || type == Character.FORMAT
                || type == Character.LINE_SEPARATOR
                || type == Character.PARAGRAPH_SEPARATOR
                || INVISIBLE_CODEPOINTS.contains(cp);
    }
}
