package com.forgemind.core.evolution;

import com.forgemind.core.error.CollaboratorUnavailableException;
import com.forgemind.core.error.ConcurrencyException;
import com.forgemind.core.error.ForgemindException;
import com.forgemind.core.error.NotFoundException;
import com.forgemind.core.events.EventBus;
import com.forgemind.core.events.ForgeEvent;
import com.forgemind.core.logging.MdcContext;
import com.forgemind.core.metrics.ForgemindMetrics;
import com.forgemind.core.model.Behavior;
import com.forgemind.core.model.EvolutionResult;
import com.forgemind.core.model.EvolutionRunRecord;
import com.forgemind.core.model.GenerationSummary;
import com.forgemind.core.model.RunStatus;
import com.forgemind.core.store.BehaviorStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs evolution jobs on the dedicated job executor.
 * <p>
 * A job holds the behavior's evolution lock from submission until it finishes, so at most one
 * run per behavior is pending or running. Cancellation is cooperative through the job's token;
 * the overall job timeout starts when the job starts running.
 */
@Service
public class EvolutionJobManager {

    private static final Logger log = LoggerFactory.getLogger(EvolutionJobManager.class);

    private final EvolutionEngine engine;
    private final EvolutionLocks locks;
    private final BehaviorStore store;
    private final EventBus eventBus;
    private final ForgemindMetrics metrics;
    private final EvolutionProperties properties;
    private final ExecutorService executor;
    private final Clock clock;

    private final Map<String, EvolutionJob> jobs = new ConcurrentHashMap<>();
    private final Deque<String> finished = new ArrayDeque<>();

    public EvolutionJobManager(EvolutionEngine engine, EvolutionLocks locks, BehaviorStore store,
                               EventBus eventBus, ForgemindMetrics metrics, EvolutionProperties properties,
                               @Qualifier("evolutionJobExecutor") ExecutorService executor, Clock clock) {
        this.engine = engine;
        this.locks = locks;
        this.store = store;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.properties = properties;
        this.executor = executor;
        this.clock = clock;
    }

    /**
     * Queues an evolution run.
     *
     * @throws ConcurrencyException when a run for the behavior is already pending or running
     */
    public EvolutionJob submit(EvolutionRequest request) {
        String jobId = "job-" + UUID.randomUUID().toString().substring(0, 8);
        if (!locks.tryAcquire(request.behaviorId(), jobId)) {
            throw new ConcurrencyException("Evolution of " + request.behaviorId() + " already in progress (job "
                    + locks.holder(request.behaviorId()).orElse("?") + ")");
        }
        EvolutionJob job = new EvolutionJob(jobId, request, CancellationToken.open(clock), clock.instant());
        jobs.put(jobId, job);
        try {
            executor.execute(() -> execute(job));
        } catch (RejectedExecutionException e) {
            jobs.remove(jobId);
            locks.release(request.behaviorId(), jobId);
            throw new CollaboratorUnavailableException("evolution-executor", "job queue rejected " + jobId, e);
        }
        log.info("Submitted evolution job {} for {} ({})", jobId, request.behaviorId(), request.triggerReason());
        return job;
    }

    public Optional<EvolutionJob> get(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    /** Pending and running jobs, optionally for one behavior, oldest first. */
    public List<EvolutionJob> active(String behaviorId) {
        return jobs.values().stream()
                .filter(j -> j.state().active())
                .filter(j -> behaviorId == null || behaviorId.equals(j.behaviorId()))
                .sorted(Comparator.comparing(j -> j.status().submittedAt()))
                .toList();
    }

    /**
     * Requests cancellation. The run stops at its next checkpoint and reports its best candidate.
     *
     * @return false when the job already finished
     */
    public boolean cancel(String jobId) {
        EvolutionJob job = get(jobId).orElseThrow(() -> new NotFoundException("Evolution job " + jobId + " not found"));
        if (!job.state().active()) {
            return false;
        }
        job.token().cancel();
        log.info("Cancellation requested for job {}", jobId);
        return true;
    }

    @PreDestroy
    public void shutdown() {
        jobs.values().stream().filter(j -> j.state().active()).forEach(j -> j.token().cancel());
    }

    // ── job thread ────────────────────────────────────────────────

    void execute(EvolutionJob job) {
        EvolutionRequest request = job.request();
        MdcContext.setJob(request.behaviorId(), job.jobId());
        Instant startedAt = clock.instant();
        job.start(startedAt);
        EvolutionResult result = null;
        try {
            eventBus.publish(ForgeEvent.of(ForgeEvent.EVOLUTION_STARTED, request.behaviorId(), job.jobId(),
                    Map.of("triggerReason", String.valueOf(request.triggerReason()))));
            CancellationToken runToken = job.token().child(properties.getJobTimeout());
            result = engine.run(job.jobId(), request, runToken, summary -> onGeneration(job, summary));
        } catch (ForgemindException e) {
            log.warn("Evolution job {} failed: {}", job.jobId(), e.getMessage());
            result = failed(job, e);
        } catch (RuntimeException e) {
            log.error("Evolution job {} failed unexpectedly", job.jobId(), e);
            result = failed(job, e);
        } finally {
            if (result == null) {
                result = EvolutionResult.failed(job.jobId(), request.behaviorId(), request.actionName(),
                        null, "job terminated abnormally");
            }
            complete(job, result, startedAt);
            MdcContext.clear();
        }
    }

    private void onGeneration(EvolutionJob job, GenerationSummary summary) {
        job.progress(summary);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("generation", summary.generation());
        payload.put("bestTrainFitness", summary.bestTrainFitness());
        payload.put("bestSoFarFitness", summary.bestSoFarFitness());
        payload.put("bestHoldoutFitness", summary.bestHoldoutFitness());
        payload.put("rejected", summary.rejected());
        eventBus.publish(ForgeEvent.of(ForgeEvent.EVOLUTION_GENERATION, job.behaviorId(), job.jobId(), payload));
    }

    private EvolutionResult failed(EvolutionJob job, RuntimeException e) {
        String fromVersion = store.load(job.behaviorId()).map(Behavior::version).orElse(null);
        return EvolutionResult.failed(job.jobId(), job.behaviorId(), job.request().actionName(), fromVersion,
                e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
    }

    private void complete(EvolutionJob job, EvolutionResult result, Instant startedAt) {
        Instant finishedAt = clock.instant();
        try {
            store.saveEvolutionRun(EvolutionRunRecord.of(result, job.jobId(), job.request().triggerReason(),
                    startedAt, finishedAt));
        } catch (CollaboratorUnavailableException e) {
            log.error("Could not persist run record of job {}: {}", job.jobId(), e.getMessage());
        } finally {
            locks.release(job.behaviorId(), job.jobId());
        }
        metrics.recordEvolutionRun(result.status().name(), finishedAt.toEpochMilli() - startedAt.toEpochMilli());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", result.status().name());
        payload.put("improved", result.improved());
        payload.put("bestFitness", result.bestFitness());
        payload.put("generationsRun", result.generationsRun());
        if (result.newVersion() != null) {
            payload.put("newVersion", result.newVersion());
        }
        String type = result.status() == RunStatus.FAILED || result.status() == RunStatus.ABORTED
                ? ForgeEvent.EVOLUTION_FAILED : ForgeEvent.EVOLUTION_COMPLETED;
        eventBus.publish(ForgeEvent.of(type, job.behaviorId(), job.jobId(), payload));
        log.info("Evolution job {} finished: {} improved={}", job.jobId(), result.status(), result.improved());
        retire(job.jobId());
        job.finish(result);
    }

    private void retire(String jobId) {
        synchronized (finished) {
            finished.addLast(jobId);
            while (finished.size() > properties.getRetainedJobs()) {
                jobs.remove(finished.pollFirst());
            }
        }
    }
}
