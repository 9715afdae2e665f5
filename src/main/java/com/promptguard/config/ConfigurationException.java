package com.promptguard.config;

import com.promptguard.PromptGuardException;

/**
 * Raised while building a {@link SecurityConfig} or rule set from invalid
 * values. Never raised per message.
 */
public class ConfigurationException extends PromptGuardException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
