package com.forgemind.core.error;

import com.forgemind.core.model.LifecycleState;

/**
 * Thrown when a lifecycle edge is not in the allowed graph.
 */
public class InvalidTransitionException extends ForgemindException {

    private final LifecycleState from;
    private final LifecycleState to;

    public InvalidTransitionException(String behaviorId, LifecycleState from, LifecycleState to) {
        super("Transition " + from + " -> " + to + " is not allowed for behavior " + behaviorId);
        this.from = from;
        this.to = to;
    }

    public LifecycleState getFrom() {
        return from;
    }

    public LifecycleState getTo() {
        return to;
    }
}
