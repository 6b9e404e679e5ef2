package com.forgemind.core.model;

/**
 * Classification of an execution's result.
 */
public enum Outcome {
    CORRECT,
    INCORRECT,
    PARTIAL,
    ERROR
}
