package com.forgemind.core.error;

/**
 * Thrown when a version compare-and-swap loses or an evolution lock is held.
 */
public class ConcurrencyException extends ForgemindException {

    public ConcurrencyException(String message) {
        super(message);
    }
}
