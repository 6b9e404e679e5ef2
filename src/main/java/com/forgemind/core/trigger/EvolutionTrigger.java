package com.forgemind.core.trigger;

import com.forgemind.core.evolution.EvolutionLocks;
import com.forgemind.core.metrics.ForgemindMetrics;
import com.forgemind.core.model.Behavior;
import com.forgemind.core.model.EvolutionDecision;
import com.forgemind.core.model.LifecycleState;
import com.forgemind.core.registry.BehaviorRegistry;
import com.forgemind.core.tracking.ExecutionTracker;
import com.forgemind.core.tracking.SuccessRate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Decides whether a behavior should be evolved.
 * <p>
 * Vetoes come first: non-evolvable, retired or locked behaviors, and behaviors with fewer
 * than {@code min-executions} executions since their last evolution, are never triggered.
 * Otherwise the first satisfied condition wins, in this order: success rate over the
 * window below threshold, {@code execution-volume} reached, interval since last evolution
 * elapsed, negative feedback count reached.
 */
@Service
public class EvolutionTrigger {

    private static final Logger log = LoggerFactory.getLogger(EvolutionTrigger.class);

    public static final String SUCCESS_RATE_BELOW_THRESHOLD = "success_rate_below_threshold";
    public static final String EXECUTION_VOLUME_REACHED = "execution_volume_reached";
    public static final String EVOLUTION_INTERVAL_ELAPSED = "evolution_interval_elapsed";
    public static final String NEGATIVE_FEEDBACK_THRESHOLD = "negative_feedback_threshold";
    public static final String INSUFFICIENT_EXECUTIONS = "insufficient_executions";
    public static final String NOT_EVOLVABLE = "not_evolvable";
    public static final String RETIRED = "retired";
    public static final String EVOLUTION_IN_PROGRESS = "evolution_in_progress";
    public static final String NO_CONDITION_MET = "no_condition_met";

    private final BehaviorRegistry registry;
    private final ExecutionTracker tracker;
    private final EvolutionLocks locks;
    private final TriggerProperties properties;
    private final ForgemindMetrics metrics;
    private final Clock clock;

    public EvolutionTrigger(BehaviorRegistry registry, ExecutionTracker tracker, EvolutionLocks locks,
                            TriggerProperties properties, ForgemindMetrics metrics, Clock clock) {
        this.registry = registry;
        this.tracker = tracker;
        this.locks = locks;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    public EvolutionDecision shouldEvolve(String behaviorId) {
        Behavior behavior = registry.get(behaviorId);
        if (!behavior.evolvable()) {
            return EvolutionDecision.skip(NOT_EVOLVABLE);
        }
        if (behavior.lifecycle() == LifecycleState.RETIRED) {
            return EvolutionDecision.skip(RETIRED);
        }
        if (locks.isLocked(behaviorId)) {
            return EvolutionDecision.skip(EVOLUTION_IN_PROGRESS);
        }

        Instant now = clock.instant();
        Instant lastEvolution = behavior.lastEvolvedAt() != null ? behavior.lastEvolvedAt() : behavior.createdAt();
        long sinceLast = tracker.executionsSince(behaviorId, lastEvolution);
        if (sinceLast < properties.getMinExecutions()) {
            return EvolutionDecision.skip(INSUFFICIENT_EXECUTIONS);
        }

        EvolutionDecision decision = firstSatisfied(behaviorId, now, lastEvolution, sinceLast);
        if (decision.shouldEvolve()) {
            metrics.incrementTriggers(decision.reason());
            log.info("Behavior {} should evolve: {}", behaviorId, decision.reason());
        }
        return decision;
    }

    private EvolutionDecision firstSatisfied(String behaviorId, Instant now, Instant lastEvolution, long sinceLast) {
        SuccessRate rate = tracker.successRate(behaviorId, properties.getSuccessWindow());
        if (rate.total() > 0 && rate.rate() < properties.getSuccessRateThreshold()) {
            return EvolutionDecision.evolve(SUCCESS_RATE_BELOW_THRESHOLD);
        }
        if (sinceLast >= properties.getExecutionVolume()) {
            return EvolutionDecision.evolve(EXECUTION_VOLUME_REACHED);
        }
        if (lastEvolution != null && Duration.between(lastEvolution, now).compareTo(properties.getMaxInterval()) >= 0) {
            return EvolutionDecision.evolve(EVOLUTION_INTERVAL_ELAPSED);
        }
        if (tracker.negativeFeedbackSince(behaviorId, lastEvolution) >= properties.getNegativeFeedbackThreshold()) {
            return EvolutionDecision.evolve(NEGATIVE_FEEDBACK_THRESHOLD);
        }
        return EvolutionDecision.skip(NO_CONDITION_MET);
    }
}
