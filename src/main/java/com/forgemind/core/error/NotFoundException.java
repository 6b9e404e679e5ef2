package com.forgemind.core.error;

/**
 * Thrown when a behavior, version or job does not exist.
 */
public class NotFoundException extends ForgemindException {

    public NotFoundException(String message) {
        super(message);
    }
}
