package com.forgemind.core.model;

/**
 * Observed and evolved fitness of one behavior version.
 *
 * @param version        behavior version
 * @param executions     executions recorded against the version
 * @param successRate    successes over executions, 0 when there are none
 * @param meanLatencyMs  mean latency of those executions
 * @param evolvedFitness train fitness measured by the evolution run that produced or started from it, nullable
 */
public record VersionFitness(
    String version,
    long executions,
    double successRate,
    double meanLatencyMs,
    Double evolvedFitness
) {
}
