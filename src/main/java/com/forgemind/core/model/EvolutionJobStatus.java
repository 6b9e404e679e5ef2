package com.forgemind.core.model;

import java.time.Instant;

/**
 * Snapshot of a background evolution job.
 *
 * @param jobId             job identifier
 * @param behaviorId        behavior under evolution
 * @param actionName        action under evolution, null until resolved
 * @param state             job state
 * @param triggerReason     why the job was submitted
 * @param currentGeneration last completed generation, -1 before the first
 * @param bestFitness       best validated train fitness so far
 * @param submittedAt       submission time
 * @param startedAt         start time, null while pending
 * @param runStatus         terminal run status, null while active
 */
public record EvolutionJobStatus(
    String jobId,
    String behaviorId,
    String actionName,
    JobState state,
    String triggerReason,
    int currentGeneration,
    double bestFitness,
    Instant submittedAt,
    Instant startedAt,
    RunStatus runStatus
) {
}
