package com.promptguard.detection;

import java.util.List;

/**
 * An obfuscated candidate that decoded to text matching at least one rule.
 *
 * @param encoding     encoding layer that was peeled off
 * @param start        candidate start in the scanned text
 * @param end          candidate end (exclusive) in the scanned text
 * @param depth        1 for a direct decode, 2 when the decoded text was itself encoded
 * @param preview      leading part of the decoded text, for audit output
 * @param innerMatches rule hits against the decoded text
 */
public record DecodedPayload(Encoding encoding, int start, int end, int depth,
                             String preview, List<PatternMatch> innerMatches) {

    public DecodedPayload {
        innerMatches = List.copyOf(innerMatches);
    }

    public enum Encoding {
        BASE64,
        HEX,
        PERCENT,
        BACKSLASH_ESCAPE
    }
}
