package com.promptguard;

/**
 * Root of the unchecked exceptions raised by the input-security pipeline.
 */
public abstract class PromptGuardException extends RuntimeException {

    protected PromptGuardException(String message) {
        super(message);
    }

    protected PromptGuardException(String message, Throwable cause) {
        super(message, cause);
    }
}
