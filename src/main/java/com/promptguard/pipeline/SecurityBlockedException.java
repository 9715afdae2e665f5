package com.promptguard.pipeline;

import com.promptguard.PromptGuardException;

/**
 * Thrown by {@link SecurityPipeline#processOrThrow} when a message is blocked.
 */
public class SecurityBlockedException extends PromptGuardException {

    private final PipelineResult result;

    public SecurityBlockedException(PipelineResult result) {
        super("Content blocked (" + result.reason() + "): " + result.detail());
        this.result = result;
    }

    public PipelineResult getResult() { return result; }

    public String getReason() { return result.reason(); }
}
