package com.forgemind.core.evolution;

import com.forgemind.core.model.EvolutionJobStatus;
import com.forgemind.core.model.EvolutionResult;
import com.forgemind.core.model.GenerationSummary;
import com.forgemind.core.model.JobState;
import com.forgemind.core.model.RunStatus;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * One submitted evolution run. State is written by the job thread and read by status queries.
 */
public class EvolutionJob {

    private final String jobId;
    private final EvolutionRequest request;
    private final CancellationToken token;
    private final Instant submittedAt;
    private final CompletableFuture<EvolutionResult> result = new CompletableFuture<>();

    private volatile JobState state = JobState.PENDING;
    private volatile Instant startedAt;
    private volatile int currentGeneration = -1;
    private volatile double bestFitness;
    private volatile RunStatus runStatus;

    EvolutionJob(String jobId, EvolutionRequest request, CancellationToken token, Instant submittedAt) {
        this.jobId = jobId;
        this.request = request;
        this.token = token;
        this.submittedAt = submittedAt;
    }

    public String jobId() {
        return jobId;
    }

    public EvolutionRequest request() {
        return request;
    }

    public String behaviorId() {
        return request.behaviorId();
    }

    public CancellationToken token() {
        return token;
    }

    public JobState state() {
        return state;
    }

    /** Completes when the run finishes; never completes exceptionally. */
    public CompletableFuture<EvolutionResult> result() {
        return result;
    }

    public EvolutionJobStatus status() {
        return new EvolutionJobStatus(jobId, request.behaviorId(), request.actionName(), state,
                request.triggerReason(), currentGeneration, bestFitness, submittedAt, startedAt, runStatus);
    }

    void start(Instant now) {
        startedAt = now;
        state = JobState.RUNNING;
    }

    void progress(GenerationSummary summary) {
        currentGeneration = summary.generation();
        bestFitness = summary.bestSoFarFitness();
    }

    void finish(EvolutionResult outcome) {
        runStatus = outcome.status();
        bestFitness = outcome.bestFitness();
        state = switch (outcome.status()) {
            case COMPLETED, NO_IMPROVEMENT, TIMED_OUT -> JobState.COMPLETED;
            case CANCELLED -> JobState.CANCELLED;
            case ABORTED, FAILED -> JobState.FAILED;
        };
        result.complete(outcome);
    }
}
