package com.promptguard.pipeline;

/**
 * Machine-readable reason codes carried by {@link PipelineResult#reason()}.
 */
public final class ReasonCodes {

    public static final String RATE_LIMIT_EXCEEDED = "rate_limit_exceeded";
    public static final String BLACKLIST_MATCH = "blacklist_match";
    public static final String THREAT_DETECTED = "threat_detected";

    public static final String PASSED = "passed";
    public static final String WHITELISTED = "whitelisted";

    private ReasonCodes() {}
}
