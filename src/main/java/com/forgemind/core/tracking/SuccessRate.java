package com.forgemind.core.tracking;

/**
 * Successes over total executions in a window.
 */
public record SuccessRate(long successes, long total) {

    /** Success ratio; a window with no executions reports 1.0 since nothing has failed. */
    public double rate() {
        return total == 0 ? 1.0 : (double) successes / total;
    }
}
