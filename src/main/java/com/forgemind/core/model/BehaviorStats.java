package com.forgemind.core.model;

import java.io.Serializable;

/**
 * Aggregate execution statistics kept on the behavior itself.
 */
public record BehaviorStats(
    long successCount,
    long failureCount,
    double meanLatencyMs
) implements Serializable {

    public static BehaviorStats empty() {
        return new BehaviorStats(0, 0, 0.0);
    }

    public long total() {
        return successCount + failureCount;
    }

    public BehaviorStats record(boolean success, long latencyMs) {
        long total = total() + 1;
        double mean = meanLatencyMs + (latencyMs - meanLatencyMs) / total;
        return success
                ? new BehaviorStats(successCount + 1, failureCount, mean)
                : new BehaviorStats(successCount, failureCount + 1, mean);
    }
}
