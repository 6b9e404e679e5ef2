package com.forgemind.core.error;

/**
 * Thrown when a candidate is explicitly applied despite an overfit rejection.
 */
public class OverfitRejectedException extends ForgemindException {

    public OverfitRejectedException(String message) {
        super(message);
    }
}
