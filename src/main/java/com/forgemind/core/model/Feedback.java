package com.forgemind.core.model;

import java.io.Serializable;

/**
 * Explicit human feedback attached to an execution.
 */
public record Feedback(
    Sentiment sentiment,
    String comment
) implements Serializable {

    public enum Sentiment {
        POSITIVE,
        NEGATIVE
    }

    public boolean negative() {
        return sentiment == Sentiment.NEGATIVE;
    }
}
