package com.forgemind.core.registry;

import com.forgemind.core.error.ConcurrencyException;
import com.forgemind.core.error.InvalidTransitionException;
import com.forgemind.core.error.NotFoundException;
import com.forgemind.core.error.OverfitRejectedException;
import com.forgemind.core.error.PromotionBlockedException;
import com.forgemind.core.error.ValidationException;
import com.forgemind.core.events.EventBus;
import com.forgemind.core.events.ForgeEvent;
import com.forgemind.core.evolution.EvolutionLocks;
import com.forgemind.core.fitness.TestSuiteResult;
import com.forgemind.core.fitness.TestSuiteRunner;
import com.forgemind.core.metrics.ForgemindMetrics;
import com.forgemind.core.model.Behavior;
import com.forgemind.core.model.LifecycleState;
import com.forgemind.core.model.OverfitVerdict;
import com.forgemind.core.model.TestCase;
import com.forgemind.core.model.Trigger;
import com.forgemind.core.model.TriggerKind;
import com.forgemind.core.store.BehaviorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Single entry point for reading and changing behaviors.
 * <p>
 * Changes to one behavior are serialized on a per-id monitor, so statistics updates,
 * promotions and evolved versions never overwrite each other in this process. Evolved
 * versions are additionally written with a store-level compare-and-swap on the version
 * the evolution run started from.
 */
@Service
public class BehaviorRegistry {

    private static final Logger log = LoggerFactory.getLogger(BehaviorRegistry.class);

    private final BehaviorStore store;
    private final BehaviorValidator validator;
    private final TestSuiteRunner testSuiteRunner;
    private final EvolutionLocks locks;
    private final RegistryProperties properties;
    private final EventBus eventBus;
    private final ForgemindMetrics metrics;
    private final Clock clock;

    private final ConcurrentHashMap<String, Object> monitors = new ConcurrentHashMap<>();

    public BehaviorRegistry(BehaviorStore store, BehaviorValidator validator, TestSuiteRunner testSuiteRunner,
                            EvolutionLocks locks, RegistryProperties properties, EventBus eventBus,
                            ForgemindMetrics metrics, Clock clock) {
        this.store = store;
        this.validator = validator;
        this.testSuiteRunner = testSuiteRunner;
        this.locks = locks;
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    // ── reads ─────────────────────────────────────────────────────

    public Behavior get(String behaviorId) {
        return store.load(behaviorId)
                .orElseThrow(() -> new NotFoundException("Behavior not found: " + behaviorId));
    }

    public List<Behavior> list(BehaviorFilter filter) {
        return store.listAll().stream().filter(filter::matches).toList();
    }

    public List<Behavior> search(String query, int limit) {
        return store.search(query, limit);
    }

    /**
     * Non-retired behaviors with a trigger matching the probe, highest trigger priority first.
     */
    public List<Behavior> findByTrigger(TriggerKind kind, String probe) {
        Map<Behavior, Integer> matches = new LinkedHashMap<>();
        for (Behavior behavior : store.listAll()) {
            if (behavior.lifecycle() == LifecycleState.RETIRED) {
                continue;
            }
            behavior.triggers().stream()
                    .filter(t -> t.matches(kind, probe))
                    .mapToInt(Trigger::priority)
                    .max()
                    .ifPresent(priority -> matches.put(behavior, priority));
        }
        return matches.entrySet().stream()
                .sorted(Map.Entry.<Behavior, Integer>comparingByValue().reversed()
                        .thenComparing(e -> e.getKey().id()))
                .map(Map.Entry::getKey)
                .toList();
    }

    public List<Behavior> versions(String behaviorId) {
        get(behaviorId);
        return store.listVersions(behaviorId);
    }

    public Behavior getVersion(String behaviorId, String version) {
        return store.loadVersion(behaviorId, version)
                .orElseThrow(() -> new NotFoundException("Version " + version + " of " + behaviorId + " not found"));
    }

    // ── writes ────────────────────────────────────────────────────

    /**
     * Registers a new behavior in DRAFT at version {@code 1.0.0}, generation 0.
     */
    public Behavior register(Behavior definition) {
        validator.validate(definition);
        synchronized (monitor(definition.id())) {
            if (store.load(definition.id()).isPresent()) {
                throw new ValidationException("Behavior already registered: " + definition.id());
            }
            Behavior registered = definition.registeredAt(clock.instant());
            store.save(registered);
            log.info("Registered behavior {} ({}, {} actions)", registered.id(), registered.tier(),
                    registered.actions().size());
            eventBus.publish(ForgeEvent.of(ForgeEvent.BEHAVIOR_REGISTERED, registered.id(), null,
                    Map.of("version", registered.version(), "tier", registered.tier().name())));
            return registered;
        }
    }

    public Behavior updateStats(String behaviorId, boolean success, long latencyMs) {
        return mutate(behaviorId, b -> b.withStats(b.stats().record(success, latencyMs), clock.instant()));
    }

    /**
     * Adds test cases, replacing existing cases with the same id.
     */
    public Behavior addTestCases(String behaviorId, List<TestCase> cases) {
        return mutate(behaviorId, b -> {
            validator.validateTestCases(b, cases);
            Map<String, TestCase> merged = new LinkedHashMap<>();
            b.testCases().forEach(tc -> merged.put(tc.id(), tc));
            cases.forEach(tc -> merged.put(tc.id(), tc));
            return b.withTestCases(new ArrayList<>(merged.values()), clock.instant());
        });
    }

    /**
     * Marks a behavior as regressed; blocks promotion to ACTIVE until it re-enters STAGING.
     */
    public Behavior flagRollback(String behaviorId, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("Rollback reason must not be blank");
        }
        Behavior flagged = mutate(behaviorId, b -> b.withRollbackReason(reason, clock.instant()));
        log.warn("Rollback flagged for {}: {}", behaviorId, reason);
        return flagged;
    }

    /**
     * Moves a behavior along the lifecycle graph.
     *
     * @throws ConcurrencyException       while an evolution job holds the behavior
     * @throws InvalidTransitionException for edges outside the graph
     * @throws PromotionBlockedException  when the edge's precondition is not met
     */
    public Behavior promote(String behaviorId, LifecycleState target) {
        if (locks.isLocked(behaviorId)) {
            throw new ConcurrencyException("Behavior " + behaviorId + " is being evolved; promotion refused");
        }
        Behavior current = get(behaviorId);
        LifecycleState from = current.lifecycle();
        if (!from.canTransitionTo(target)) {
            metrics.recordPromotion(target.name(), false);
            throw new InvalidTransitionException(behaviorId, from, target);
        }

        Behavior promoted = switch (target) {
            case STAGING -> stage(current);
            case ACTIVE -> activate(current);
            default -> mutate(behaviorId, b -> {
                requireUnchanged(b, current);
                return b.withLifecycle(target, clock.instant());
            });
        };
        metrics.recordPromotion(target.name(), true);
        log.info("Behavior {} promoted {} -> {}", behaviorId, from, target);
        eventBus.publish(ForgeEvent.of(ForgeEvent.BEHAVIOR_PROMOTED, behaviorId, null,
                Map.of("from", from.name(), "to", target.name(), "version", promoted.version())));
        return promoted;
    }

    public Behavior retire(String behaviorId) {
        return promote(behaviorId, LifecycleState.RETIRED);
    }

    /**
     * Writes an evolved instruction as the next minor version. Used only by the evolution engine.
     *
     * @throws OverfitRejectedException when {@code verdict} rejected the candidate
     * @throws ConcurrencyException     when the behavior moved past {@code expectedVersion}
     */
    public Behavior applyEvolvedPrompt(String behaviorId, String expectedVersion, String actionName,
                                       String prompt, OverfitVerdict verdict) {
        if (verdict != null && verdict.decision() == OverfitVerdict.Decision.REJECT) {
            throw new OverfitRejectedException("Candidate for " + behaviorId + " overfits (gap "
                    + String.format("%.3f", verdict.gap()) + ")");
        }
        synchronized (monitor(behaviorId)) {
            Behavior current = get(behaviorId);
            if (!current.version().equals(expectedVersion)) {
                throw new ConcurrencyException("Behavior " + behaviorId + " is at " + current.version()
                        + ", evolution started from " + expectedVersion);
            }
            if (current.action(actionName).isEmpty()) {
                throw new ValidationException("Behavior " + behaviorId + " has no action " + actionName);
            }
            Behavior evolved = current.evolvedTo(actionName, prompt, clock.instant());
            if (!store.compareAndSwap(expectedVersion, evolved)) {
                throw new ConcurrencyException("Version " + expectedVersion + " of " + behaviorId
                        + " was replaced concurrently");
            }
            log.info("Behavior {} evolved {} -> {} (generation {})", behaviorId, expectedVersion,
                    evolved.version(), evolved.generation());
            return evolved;
        }
    }

    /**
     * Stamps a completed evolution run that produced no new version, so the trigger
     * counts executions and time from this run.
     */
    public Behavior recordEvolutionAttempt(String behaviorId) {
        return mutate(behaviorId, b -> b.withLastEvolvedAt(clock.instant()));
    }

    // ── internals ─────────────────────────────────────────────────

    private Behavior stage(Behavior current) {
        if (current.testCases().isEmpty()) {
            metrics.recordPromotion(LifecycleState.STAGING.name(), false);
            throw new PromotionBlockedException(current.id(), "no test cases defined");
        }
        // Tests call the model; run them outside the monitor.
        TestSuiteResult result = testSuiteRunner.run(current);

        synchronized (monitor(current.id())) {
            Behavior latest = get(current.id());
            requireUnchanged(latest, current);
            Instant now = clock.instant();
            if (result.allPassed()) {
                Behavior staged = latest.withStaging(now, now);
                store.save(staged);
                return staged;
            }
            int failures = latest.consecutiveTestFailures() + 1;
            boolean regress = failures >= properties.getMaxTestFailures();
            Behavior updated = regress
                    ? latest.withTestFailures(0, LifecycleState.DRAFT, now)
                    : latest.withTestFailures(failures, latest.lifecycle(), now);
            store.save(updated);
            metrics.recordPromotion(LifecycleState.STAGING.name(), false);

            String condition = (result.total() - result.passed()) + " of " + result.total()
                    + " test cases failed " + result.failedCaseIds();
            if (regress) {
                log.warn("Behavior {} failed staging {} times, regressed to DRAFT", current.id(), failures);
                eventBus.publish(ForgeEvent.of(ForgeEvent.BEHAVIOR_PROMOTED, current.id(), null,
                        Map.of("from", LifecycleState.TESTING.name(), "to", LifecycleState.DRAFT.name(),
                                "version", updated.version())));
                condition += "; regressed to DRAFT after " + failures + " consecutive failures";
            }
            throw new PromotionBlockedException(current.id(), condition);
        }
    }

    private Behavior activate(Behavior current) {
        Instant now = clock.instant();
        if (current.rollbackFlagged()) {
            metrics.recordPromotion(LifecycleState.ACTIVE.name(), false);
            throw new PromotionBlockedException(current.id(), "rollback flagged: " + current.rollbackReason());
        }
        Duration soaked = current.stagedAt() == null ? Duration.ZERO : Duration.between(current.stagedAt(), now);
        if (soaked.compareTo(properties.getMinSoak()) < 0) {
            metrics.recordPromotion(LifecycleState.ACTIVE.name(), false);
            throw new PromotionBlockedException(current.id(), "soaked " + soaked + " in STAGING, minimum "
                    + properties.getMinSoak());
        }
        return mutate(current.id(), b -> {
            requireUnchanged(b, current);
            return b.withLifecycle(LifecycleState.ACTIVE, now);
        });
    }

    private static void requireUnchanged(Behavior latest, Behavior seen) {
        if (latest.lifecycle() != seen.lifecycle() || !latest.version().equals(seen.version())) {
            throw new ConcurrencyException("Behavior " + seen.id() + " changed while being promoted");
        }
    }

    private Behavior mutate(String behaviorId, UnaryOperator<Behavior> change) {
        synchronized (monitor(behaviorId)) {
            Behavior updated = change.apply(get(behaviorId));
            store.save(updated);
            return updated;
        }
    }

    private Object monitor(String behaviorId) {
        return monitors.computeIfAbsent(behaviorId, k -> new Object());
    }
}
