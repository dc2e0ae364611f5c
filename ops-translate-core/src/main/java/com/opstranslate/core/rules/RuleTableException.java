package com.opstranslate.core.rules;

/**
 * Thrown when a mapping rule table cannot be read or fails validation.
 *
 * <p>The rule table is loaded once at start-up, so this error stops the run before any
 * document is translated.
 */
public class RuleTableException extends RuntimeException {

    public RuleTableException(String message) {
        super(message);
    }

    public RuleTableException(String message, Throwable cause) {
        super(message, cause);
    }
}
