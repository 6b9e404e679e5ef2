package com.forgemind.core.trigger;

import com.forgemind.core.Fixtures;
import com.forgemind.core.MutableClock;
import com.forgemind.core.evolution.EvolutionLocks;
import com.forgemind.core.metrics.ForgemindMetrics;
import com.forgemind.core.model.Behavior;
import com.forgemind.core.model.EvolutionDecision;
import com.forgemind.core.model.LifecycleState;
import com.forgemind.core.registry.BehaviorRegistry;
import com.forgemind.core.tracking.ExecutionTracker;
import com.forgemind.core.tracking.SuccessRate;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class EvolutionTriggerTest {

    private BehaviorRegistry registry;
    private ExecutionTracker tracker;
    private EvolutionLocks locks;
    private TriggerProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private MutableClock clock;
    private EvolutionTrigger trigger;

    @BeforeEach
    void setUp() {
        registry = mock(BehaviorRegistry.class);
        tracker = mock(ExecutionTracker.class);
        locks = new EvolutionLocks();
        properties = new TriggerProperties();
        meterRegistry = new SimpleMeterRegistry();
        clock = new MutableClock(Fixtures.T0.plus(Duration.ofDays(10)));
        trigger = new EvolutionTrigger(registry, tracker, locks, properties,
                new ForgemindMetrics(meterRegistry), clock);

        when(registry.get("b")).thenReturn(active(true));
        when(tracker.successRate(eq("b"), any())).thenReturn(new SuccessRate(95, 100));
        when(tracker.negativeFeedbackSince(eq("b"), any())).thenReturn(0L);
    }

    private static Behavior active(boolean evolvable) {
        Behavior b = Fixtures.behavior("b").registeredAt(Fixtures.T0).withLifecycle(LifecycleState.ACTIVE, Fixtures.T0);
        return new Behavior(b.id(), b.name(), b.description(), b.tier(), b.lifecycle(), b.actions(), b.triggers(),
                b.domainTags(), b.version(), b.generation(), b.parentBehaviorId(), b.stats(), evolvable,
                b.testCases(), b.styleConstraints(), b.stagedAt(), b.rollbackReason(),
                b.consecutiveTestFailures(), b.lastEvolvedAt(), b.createdAt(), b.updatedAt());
    }

    private void executionsSinceLastEvolution(long count) {
        when(tracker.executionsSince(eq("b"), any(Instant.class))).thenReturn(count);
    }

    // ── conditions ───────────────────────────────────────────────────

    @Nested
    @DisplayName("conditions")
    class Conditions {

        @Test
        @DisplayName("success rate 0.72 over 60 executions triggers on the success rate")
        void lowSuccessRate() {
            executionsSinceLastEvolution(60);
            when(tracker.successRate(eq("b"), any())).thenReturn(new SuccessRate(72, 100));

            EvolutionDecision decision = trigger.shouldEvolve("b");

            assertTrue(decision.shouldEvolve());
            assertEquals(EvolutionTrigger.SUCCESS_RATE_BELOW_THRESHOLD, decision.reason());
            assertEquals(1.0, meterRegistry.get("forgemind.trigger.fired")
                    .tag("reason", EvolutionTrigger.SUCCESS_RATE_BELOW_THRESHOLD).counter().count());
        }

        @Test
        @DisplayName("a healthy behavior with enough volume triggers on volume")
        void volume() {
            executionsSinceLastEvolution(50);

            EvolutionDecision decision = trigger.shouldEvolve("b");

            assertEquals(EvolutionDecision.evolve(EvolutionTrigger.EXECUTION_VOLUME_REACHED), decision);
        }

        @Test
        @DisplayName("elapsed interval triggers once volume alone is not enough")
        void interval() {
            properties.setExecutionVolume(500);
            executionsSinceLastEvolution(60);
            clock.advance(Duration.ofDays(20));

            EvolutionDecision decision = trigger.shouldEvolve("b");

            assertEquals(EvolutionDecision.evolve(EvolutionTrigger.EVOLUTION_INTERVAL_ELAPSED), decision);
        }

        @Test
        @DisplayName("negative feedback triggers when nothing earlier does")
        void negativeFeedback() {
            properties.setExecutionVolume(500);
            executionsSinceLastEvolution(60);
            when(tracker.negativeFeedbackSince(eq("b"), any())).thenReturn(3L);

            EvolutionDecision decision = trigger.shouldEvolve("b");

            assertEquals(EvolutionDecision.evolve(EvolutionTrigger.NEGATIVE_FEEDBACK_THRESHOLD), decision);
        }

        @Test
        @DisplayName("nothing satisfied means no evolution")
        void nothing() {
            properties.setExecutionVolume(500);
            executionsSinceLastEvolution(60);

            EvolutionDecision decision = trigger.shouldEvolve("b");

            assertEquals(EvolutionDecision.skip(EvolutionTrigger.NO_CONDITION_MET), decision);
            assertTrue(meterRegistry.find("forgemind.trigger.fired").counters().isEmpty());
        }

        @Test
        @DisplayName("time and volume count from the last evolution, not registration")
        void countsFromLastEvolution() {
            Instant lastEvolved = Fixtures.T0.plus(Duration.ofDays(5));
            when(registry.get("b")).thenReturn(active(true).withLastEvolvedAt(lastEvolved));
            when(tracker.executionsSince("b", lastEvolved)).thenReturn(55L);

            trigger.shouldEvolve("b");

            verify(tracker).executionsSince("b", lastEvolved);
        }
    }

    // ── vetoes ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("vetoes")
    class Vetoes {

        @Test
        @DisplayName("fewer than 50 executions vetoes even a terrible success rate")
        void insufficientExecutions() {
            executionsSinceLastEvolution(49);
            when(tracker.successRate(eq("b"), any())).thenReturn(new SuccessRate(1, 49));
            when(tracker.negativeFeedbackSince(eq("b"), any())).thenReturn(10L);

            EvolutionDecision decision = trigger.shouldEvolve("b");

            assertFalse(decision.shouldEvolve());
            assertEquals(EvolutionTrigger.INSUFFICIENT_EXECUTIONS, decision.reason());
        }

        @Test
        @DisplayName("non-evolvable behaviors are never triggered")
        void notEvolvable() {
            when(registry.get("b")).thenReturn(active(false));
            executionsSinceLastEvolution(500);

            assertEquals(EvolutionDecision.skip(EvolutionTrigger.NOT_EVOLVABLE), trigger.shouldEvolve("b"));
            verifyNoInteractions(tracker);
        }

        @Test
        @DisplayName("retired behaviors are never triggered")
        void retired() {
            when(registry.get("b")).thenReturn(active(true).withLifecycle(LifecycleState.RETIRED, Fixtures.T0));

            assertEquals(EvolutionDecision.skip(EvolutionTrigger.RETIRED), trigger.shouldEvolve("b"));
        }

        @Test
        @DisplayName("a behavior held by an evolution job is not triggered again")
        void locked() {
            executionsSinceLastEvolution(500);
            locks.tryAcquire("b", "job-1");

            assertEquals(EvolutionDecision.skip(EvolutionTrigger.EVOLUTION_IN_PROGRESS), trigger.shouldEvolve("b"));
        }
    }

    @Test
    @DisplayName("thresholds come from configuration")
    void configurableThresholds() {
        properties.setMinExecutions(10);
        properties.setExecutionVolume(10);
        executionsSinceLastEvolution(12);

        assertEquals(EvolutionDecision.evolve(EvolutionTrigger.EXECUTION_VOLUME_REACHED), trigger.shouldEvolve("b"));
    }
}
