package com.forgemind.core.evolution;

import com.forgemind.core.Fixtures;
import com.forgemind.core.MutableClock;
import com.forgemind.core.error.CollaboratorUnavailableException;
import com.forgemind.core.error.ValidationException;
import com.forgemind.core.fitness.FitnessEvaluator;
import com.forgemind.core.metrics.ForgemindMetrics;
import com.forgemind.core.model.Behavior;
import com.forgemind.core.model.EvolutionResult;
import com.forgemind.core.model.FitnessScore;
import com.forgemind.core.model.GenerationSummary;
import com.forgemind.core.model.MutationStrategy;
import com.forgemind.core.model.OverfitVerdict;
import com.forgemind.core.model.RunStatus;
import com.forgemind.core.model.TestCase;
import com.forgemind.core.mutation.MutationOutcome;
import com.forgemind.core.mutation.PromptMutator;
import com.forgemind.core.overfit.OverfitDetector;
import com.forgemind.core.registry.BehaviorRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link EvolutionEngine}.
 * <p>
 * The evaluator is scripted per prompt: 10 single-scenario cases split 8 train / 2 holdout,
 * so a two-case list identifies a holdout evaluation.
 */
class EvolutionEngineTest {

    private static final String ID = "summarizer";
    private static final String PRODUCTION = Fixtures.SUMMARIZE_PROMPT;
    private static final String OVERFIT = "Summarize {{query}} using the exact phrasing of the examples.\nReturn answer.";
    private static final String ROBUST = "Summarize {{query}} in three sentences.\nReturn the answer field.";

    private BehaviorRegistry registry;
    private FitnessEvaluator evaluator;
    private PromptMutator mutator;
    private EvolutionProperties properties;
    private EvolutionEngine engine;
    private Behavior behavior;

    /** prompt → {train, holdout}; unknown prompts score 0.5 on both. */
    private final Map<String, double[]> scores = new HashMap<>();
    private final List<String> mutants = new ArrayList<>();
    private final AtomicInteger mutantIndex = new AtomicInteger();

    @BeforeEach
    void setUp() {
        registry = mock(BehaviorRegistry.class);
        evaluator = mock(FitnessEvaluator.class);
        mutator = mock(PromptMutator.class);
        properties = new EvolutionProperties();
        properties.setPopulationSize(3);
        properties.setMaxGenerations(1);
        properties.setSeed(42L);
        properties.setCrossoverRate(0.0);

        behavior = Fixtures.behaviorWithCases(ID, 10).registeredAt(Fixtures.T0);
        when(registry.get(ID)).thenReturn(behavior);
        when(registry.applyEvolvedPrompt(eq(ID), eq("1.0.0"), eq("summarize"), anyString(), any()))
                .thenAnswer(inv -> behavior.evolvedTo("summarize", inv.getArgument(3), Fixtures.T0));

        when(evaluator.evaluate(anyString(), any(), anyList(), any())).thenAnswer(inv -> {
            String prompt = inv.getArgument(0);
            List<TestCase> cases = inv.getArgument(2);
            double[] s = scores.getOrDefault(prompt, new double[]{0.5, 0.5});
            double fitness = cases.size() == 2 ? s[1] : s[0];
            return new FitnessScore(fitness, fitness, 1.0, 0.5, 0, cases.size(), 0, List.of());
        });

        when(mutator.chooseStrategy(any())).thenReturn(MutationStrategy.ELABORATE);
        when(mutator.mutate(anyString(), any(), any(), any())).thenAnswer(inv -> {
            int i = mutantIndex.getAndIncrement();
            String prompt = i < mutants.size() ? mutants.get(i) : "variant " + i + " of {{query}}\nReturn answer.";
            return Optional.of(new MutationOutcome(prompt, "change " + i, MutationStrategy.ELABORATE.name()));
        });

        engine = new EvolutionEngine(registry, evaluator, mutator, new OverfitDetector(properties), properties,
                new ForgemindMetrics(new SimpleMeterRegistry()));
    }

    private EvolutionResult run(CancellationToken token, GenerationListener listener) {
        return engine.run("run-1", new EvolutionRequest(ID, null, null, null, "manual", 42L), token, listener);
    }

    private EvolutionResult run() {
        return run(CancellationToken.none(), null);
    }

    // ── overfit fallback ─────────────────────────────────────────────

    @Nested
    @DisplayName("Overfit guard")
    class OverfitGuard {

        @Test
        @DisplayName("rejects the overfit leader and promotes the robust runner-up")
        void fallsBackToRobustCandidate() {
            scores.put(PRODUCTION, new double[]{0.70, 0.70});
            scores.put(OVERFIT, new double[]{0.95, 0.60});
            scores.put(ROBUST, new double[]{0.89, 0.87});
            mutants.addAll(List.of(OVERFIT, ROBUST));

            EvolutionResult result = run();

            assertEquals(RunStatus.COMPLETED, result.status());
            assertTrue(result.improved());
            assertEquals("1.1.0", result.newVersion());
            assertEquals(ROBUST, result.bestPrompt());
            assertEquals(0.89, result.bestFitness(), 1e-9);
            assertEquals(0.87, result.holdoutFitness(), 1e-9);
            assertEquals(0.70, result.productionFitness(), 1e-9);
            assertTrue(result.warnings().stream().anyMatch(w -> w.contains("rejected as overfit")));
            assertEquals(1, result.generations().get(0).rejected());
            verify(registry).applyEvolvedPrompt(eq(ID), eq("1.0.0"), eq("summarize"), eq(ROBUST),
                    argThat(v -> v.decision() == OverfitVerdict.Decision.ACCEPT));
        }

        @Test
        @DisplayName("never reports a winner whose train-holdout gap reaches the reject threshold")
        void winnerGapBelowThreshold() {
            properties.setMaxGenerations(4);
            properties.setPopulationSize(5);
            scores.put(PRODUCTION, new double[]{0.40, 0.40});
            scores.put(OVERFIT, new double[]{0.99, 0.50});

            mutants.addAll(List.of(OVERFIT, ROBUST));
            scores.put(ROBUST, new double[]{0.60, 0.55});

            EvolutionResult result = run();

            assertNotEquals(OVERFIT, result.bestPrompt());
            assertTrue(result.bestFitness() - result.holdoutFitness() < 0.2);
        }
    }

    // ── outcomes ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("Outcomes")
    class Outcomes {

        @Test
        @DisplayName("no candidate beating production leaves the behavior unchanged")
        void noImprovement() {
            scores.put(PRODUCTION, new double[]{0.90, 0.90});

            EvolutionResult result = run();

            assertEquals(RunStatus.NO_IMPROVEMENT, result.status());
            assertFalse(result.improved());
            assertNull(result.newVersion());
            verify(registry).recordEvolutionAttempt(ID);
            verify(registry, never()).applyEvolvedPrompt(any(), any(), any(), any(), any());
        }

        @Test
        @DisplayName("best-so-far fitness never decreases across generations")
        void bestSoFarMonotone() {
            properties.setMaxGenerations(5);
            properties.setEarlyStopGenerations(10);
            properties.setTargetFitness(1.1);
            AtomicInteger counter = new AtomicInteger();
            doAnswer(inv -> {
                // Fitness oscillates so later generations can be worse than earlier ones
                double f = (counter.getAndIncrement() % 4) * 0.2 + 0.1;
                List<TestCase> cases = inv.getArgument(2);
                return new FitnessScore(f, f, 1.0, 0.5, 0, cases.size(), 0, List.of());
            }).when(evaluator).evaluate(anyString(), any(), anyList(), any());
            List<GenerationSummary> seen = new ArrayList<>();

            EvolutionResult result = run(CancellationToken.none(), seen::add);

            assertEquals(result.generationsRun(), seen.size());
            for (int i = 1; i < seen.size(); i++) {
                assertTrue(seen.get(i).bestSoFarFitness() >= seen.get(i - 1).bestSoFarFitness(),
                        "generation " + i + " lowered best-so-far");
            }
        }

        @Test
        @DisplayName("stops early once the target fitness is reached")
        void targetReached() {
            properties.setMaxGenerations(6);
            properties.setTargetFitness(0.85);
            scores.put(PRODUCTION, new double[]{0.50, 0.50});
            scores.put(ROBUST, new double[]{0.89, 0.87});
            mutants.add(ROBUST);

            EvolutionResult result = run();

            assertEquals(1, result.generationsRun());
            assertEquals(RunStatus.COMPLETED, result.status());
        }

        @Test
        @DisplayName("a diff from the production prompt is reported")
        void promptDiff() {
            scores.put(PRODUCTION, new double[]{0.70, 0.70});
            scores.put(ROBUST, new double[]{0.89, 0.87});
            mutants.add(ROBUST);

            EvolutionResult result = run();

            assertTrue(result.promptDiff().contains("+ Summarize {{query}} in three sentences."));
            assertTrue(result.promptDiff().contains("- Summarize the text in {{query}}."));
        }
    }

    // ── interruption ─────────────────────────────────────────────────

    @Nested
    @DisplayName("Interruption")
    class Interruption {

        @Test
        @DisplayName("generation deadlines are measured on the run token's clock")
        void deadlineFollowsTokenClock() {
            // A clock years away from system time must not expire the run at its first checkpoint
            MutableClock tokenClock = new MutableClock(Instant.parse("2031-06-01T00:00:00Z"));
            scores.put(PRODUCTION, new double[]{0.90, 0.90});

            EvolutionResult result = run(CancellationToken.open(tokenClock), null);

            assertEquals(RunStatus.NO_IMPROVEMENT, result.status());
            assertEquals(1, result.generationsRun());
        }

        @Test
        @DisplayName("a generation outliving its timeout on the token clock ends the run as timed out")
        void generationTimeout() {
            MutableClock tokenClock = new MutableClock(Fixtures.T0);
            properties.setGenerationTimeout(Duration.ofMinutes(10));
            doAnswer(inv -> {
                tokenClock.advance(Duration.ofMinutes(11));
                List<TestCase> cases = inv.getArgument(2);
                return new FitnessScore(0.5, 0.5, 1.0, 0.5, 0, cases.size(), 0, List.of());
            }).when(evaluator).evaluate(anyString(), any(), anyList(), any());

            EvolutionResult result = run(CancellationToken.open(tokenClock), null);

            assertEquals(RunStatus.TIMED_OUT, result.status());
            assertFalse(result.improved());
            verify(registry, never()).applyEvolvedPrompt(any(), any(), any(), any(), any());
        }

        @Test
        @DisplayName("cancellation after a generation reports the best candidate without promoting it")
        void cancelled() {
            properties.setMaxGenerations(5);
            scores.put(PRODUCTION, new double[]{0.70, 0.70});
            scores.put(ROBUST, new double[]{0.89, 0.87});
            mutants.add(ROBUST);
            CancellationToken token = CancellationToken.none();

            EvolutionResult result = run(token, summary -> token.cancel());

            assertEquals(RunStatus.CANCELLED, result.status());
            assertFalse(result.improved());
            assertEquals(1, result.generationsRun());
            assertEquals(ROBUST, result.bestPrompt());
            verify(registry, never()).applyEvolvedPrompt(any(), any(), any(), any(), any());
        }

        @Test
        @DisplayName("a language model outage aborts the run")
        void aborted() {
            doThrow(new CollaboratorUnavailableException("language-model", "down", null))
                    .when(evaluator).evaluate(anyString(), any(), anyList(), any());

            EvolutionResult result = run();

            assertEquals(RunStatus.ABORTED, result.status());
            assertFalse(result.improved());
            assertTrue(result.warnings().stream().anyMatch(w -> w.contains("language-model unavailable")));
            verify(registry, never()).applyEvolvedPrompt(any(), any(), any(), any(), any());
        }

        @Test
        @DisplayName("a candidate whose evaluation fails scores zero instead of failing the run")
        void evaluationFailureScoresZero() {
            scores.put(PRODUCTION, new double[]{0.70, 0.70});
            doThrow(new IllegalStateException("boom")).when(evaluator).evaluate(eq(ROBUST), any(), anyList(), any());
            mutants.add(ROBUST);

            EvolutionResult result = run();

            assertEquals(RunStatus.NO_IMPROVEMENT, result.status());
        }
    }

    // ── breeding ─────────────────────────────────────────────────────

    @Test
    @DisplayName("crossover combines two parents when the crossover rate is one")
    void crossover() {
        properties.setMaxGenerations(2);
        properties.setCrossoverRate(1.0);
        properties.setMutationRate(0.0);
        properties.setEarlyStopGenerations(5);
        when(mutator.crossover(anyString(), anyString(), any(), any()))
                .thenReturn(Optional.of(new MutationOutcome("crossed {{query}}\nReturn answer.", "merged",
                        PromptMutator.CROSSOVER)));

        EvolutionResult result = run();

        verify(mutator, atLeastOnce()).crossover(anyString(), anyString(), any(), any());
        assertEquals(2, result.generationsRun());
    }

    @Test
    @DisplayName("an action with fewer than two test cases cannot evolve")
    void tooFewCases() {
        when(registry.get("tiny")).thenReturn(Fixtures.behaviorWithCases("tiny", 1).registeredAt(Fixtures.T0));

        assertThrows(ValidationException.class, () -> engine.run("run-2",
                EvolutionRequest.of("tiny", 1, null), CancellationToken.none(), null));
        verifyNoInteractions(evaluator);
    }

    @Test
    @DisplayName("an unknown action name is a validation error")
    void unknownAction() {
        assertThrows(ValidationException.class, () -> engine.run("run-3",
                EvolutionRequest.of(ID, 1, null).withActionName("translate"), CancellationToken.none(), null));
    }
}
