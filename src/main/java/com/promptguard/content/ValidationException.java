package com.promptguard.content;

import com.promptguard.PromptGuardException;

/**
 * Per-message rejection raised before any security stage runs: empty input,
 * or input above the absolute length cap.
 */
public class ValidationException extends PromptGuardException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
