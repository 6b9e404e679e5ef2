package com.forgemind.core.error;

/**
 * Thrown when a definition or request is malformed.
 */
public class ValidationException extends ForgemindException {

    public ValidationException(String message) {
        super(message);
    }
}
