package com.forgemind.core.error;

/**
 * Root of the service's unchecked exception taxonomy.
 */
public abstract class ForgemindException extends RuntimeException {

    protected ForgemindException(String message) {
        super(message);
    }

    protected ForgemindException(String message, Throwable cause) {
        super(message, cause);
    }
}
