package com.forgemind.core.model;

/**
 * Terminal status of an evolution run.
 */
public enum RunStatus {
    COMPLETED,      // a new version was written
    NO_IMPROVEMENT,
    CANCELLED,
    TIMED_OUT,
    ABORTED,        // collaborator outage
    FAILED;

    /** Runs that stopped before the loop finished; their best candidate is never promoted. */
    public boolean partial() {
        return this == CANCELLED || this == TIMED_OUT || this == ABORTED;
    }
}
