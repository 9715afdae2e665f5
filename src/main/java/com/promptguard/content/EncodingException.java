package com.promptguard.content;

/**
 * Input that is not well-formed text in its declared encoding.
 */
public class EncodingException extends ValidationException {

    public EncodingException(String message) {
        super(message);
    }

    public EncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
