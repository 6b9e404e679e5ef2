package com.forgemind.core.error;

/**
 * Thrown when a test case exceeds its time budget.
 */
public class EvaluationTimeoutException extends ForgemindException {

    public EvaluationTimeoutException(String message) {
        super(message);
    }
}
