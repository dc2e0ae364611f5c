package com.opstranslate.core.profile;

/**
 * Thrown when a profile file exists but cannot be read as a YAML mapping.
 */
public class ProfileException extends RuntimeException {

    public ProfileException(String message) {
        super(message);
    }

    public ProfileException(String message, Throwable cause) {
        super(message, cause);
    }
}
