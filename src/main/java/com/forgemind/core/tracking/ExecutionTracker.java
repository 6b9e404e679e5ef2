package com.forgemind.core.tracking;

import com.forgemind.core.error.ValidationException;
import com.forgemind.core.events.EventBus;
import com.forgemind.core.events.ForgeEvent;
import com.forgemind.core.metrics.ForgemindMetrics;
import com.forgemind.core.model.Behavior;
import com.forgemind.core.model.ExecutionRecord;
import com.forgemind.core.model.FailurePattern;
import com.forgemind.core.model.VersionFitness;
import com.forgemind.core.registry.BehaviorRegistry;
import com.forgemind.core.store.BehaviorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Append-only execution ledger with rolling statistics.
 * <p>
 * Recording is idempotent by execution id and safe under concurrent writers: the store's
 * append decides which writer wins, and only the winner updates the behavior's
 * aggregate stats.
 */
@Service
public class ExecutionTracker {

    private static final Logger log = LoggerFactory.getLogger(ExecutionTracker.class);

    private final BehaviorStore store;
    private final BehaviorRegistry registry;
    private final EventBus eventBus;
    private final ForgemindMetrics metrics;
    private final Clock clock;

    public ExecutionTracker(BehaviorStore store, BehaviorRegistry registry, EventBus eventBus,
                            ForgemindMetrics metrics, Clock clock) {
        this.store = store;
        this.registry = registry;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * @return false when the execution id was already recorded
     */
    public boolean record(ExecutionRecord record) {
        validate(record);
        Behavior behavior = registry.get(record.behaviorId());
        ExecutionRecord stamped = stamp(record, behavior);

        if (!store.recordExecution(stamped)) {
            log.debug("Execution {} already recorded, ignoring", stamped.executionId());
            return false;
        }
        registry.updateStats(stamped.behaviorId(), stamped.success(), stamped.latencyMs());
        metrics.recordExecution(stamped.behaviorId(), stamped.success(), stamped.latencyMs());
        eventBus.publish(ForgeEvent.of(ForgeEvent.EXECUTION_RECORDED, stamped.behaviorId(), null,
                Map.of("executionId", stamped.executionId(), "success", stamped.success(),
                        "version", stamped.behaviorVersion())));
        return true;
    }

    public SuccessRate successRate(String behaviorId, Duration window) {
        List<ExecutionRecord> records = store.executions(behaviorId, clock.instant().minus(window));
        long successes = records.stream().filter(ExecutionRecord::success).count();
        return new SuccessRate(successes, records.size());
    }

    public List<FailurePattern> failurePatterns(String behaviorId, int limit) {
        return FailurePatternAnalyzer.analyze(store.executions(behaviorId, null), limit);
    }

    public long executionsSince(String behaviorId, Instant since) {
        return store.executions(behaviorId, since).size();
    }

    public long negativeFeedbackSince(String behaviorId, Instant since) {
        return store.executions(behaviorId, since).stream().filter(ExecutionRecord::hasNegativeFeedback).count();
    }

    /**
     * Observed statistics of one version; {@code evolvedFitness} is left empty.
     */
    public VersionFitness versionStats(String behaviorId, String version) {
        List<ExecutionRecord> records = store.executions(behaviorId, null).stream()
                .filter(r -> version.equals(r.behaviorVersion()))
                .toList();
        long successes = records.stream().filter(ExecutionRecord::success).count();
        double meanLatency = records.stream().mapToLong(ExecutionRecord::latencyMs).average().orElse(0.0);
        double rate = records.isEmpty() ? 0.0 : (double) successes / records.size();
        return new VersionFitness(version, records.size(), rate, meanLatency, null);
    }

    private static void validate(ExecutionRecord record) {
        if (record.executionId() == null || record.executionId().isBlank()) {
            throw new ValidationException("executionId must not be blank");
        }
        if (record.behaviorId() == null || record.behaviorId().isBlank()) {
            throw new ValidationException("behaviorId must not be blank");
        }
        if (record.actionName() == null || record.actionName().isBlank()) {
            throw new ValidationException("actionName must not be blank");
        }
        if (record.latencyMs() < 0 || record.tokenCost() < 0) {
            throw new ValidationException("latency and token cost must not be negative");
        }
    }

    /** Fills a missing timestamp or version from the clock and the current behavior. */
    private ExecutionRecord stamp(ExecutionRecord r, Behavior behavior) {
        if (r.timestamp() != null && r.behaviorVersion() != null) {
            return r;
        }
        return new ExecutionRecord(r.executionId(), r.behaviorId(),
                r.behaviorVersion() != null ? r.behaviorVersion() : behavior.version(),
                r.actionName(), r.input(), r.output(), r.success(), r.outcome(), r.feedback(),
                r.latencyMs(), r.tokenCost(), r.timestamp() != null ? r.timestamp() : clock.instant(),
                r.sessionId(), r.domainTags());
    }
}
