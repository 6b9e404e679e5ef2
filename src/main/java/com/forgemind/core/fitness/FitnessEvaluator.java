package com.forgemind.core.fitness;

import com.forgemind.core.error.CollaboratorUnavailableException;
import com.forgemind.core.error.EvaluationTimeoutException;
import com.forgemind.core.evolution.CancellationToken;
import com.forgemind.core.evolution.EvolutionInterruptedException;
import com.forgemind.core.evolution.EvolutionProperties;
import com.forgemind.core.model.Action;
import com.forgemind.core.model.CaseResult;
import com.forgemind.core.model.FitnessScore;
import com.forgemind.core.model.RunStatus;
import com.forgemind.core.model.TestCase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Scores a prompt against a set of test cases.
 * <p>
 * Cases run concurrently on the shared evaluation pool. Each case is executed through the
 * {@link ActionExecutor} and scored by the {@link CorrectnessJudge}. The composite is
 * {@code 0.6 * correctness + 0.2 * efficiency + 0.2 * preference}, clamped to [0,1]:
 * <ul>
 *   <li>correctness: mean judged score over all cases; failed and timed-out cases score 0</li>
 *   <li>efficiency: mean of inverted, capped latency and token cost; failed cases score 0</li>
 *   <li>preference: mean explicit rating over passed cases, 0.5 when none is rated</li>
 * </ul>
 * A {@link CollaboratorUnavailableException} from any case aborts the whole evaluation.
 */
@Service
public class FitnessEvaluator {

    private static final Logger log = LoggerFactory.getLogger(FitnessEvaluator.class);

    static final double CORRECTNESS_WEIGHT = 0.6;
    static final double EFFICIENCY_WEIGHT = 0.2;
    static final double PREFERENCE_WEIGHT = 0.2;
    static final double NEUTRAL_PREFERENCE = 0.5;

    /** Judging runs after execution inside the same task and gets the same budget again. */
    private static final int BUDGET_MULTIPLIER = 2;

    private final ActionExecutor actionExecutor;
    private final CorrectnessJudge judge;
    private final ExecutorService evaluationExecutor;
    private final EvolutionProperties.Fitness settings;

    public FitnessEvaluator(ActionExecutor actionExecutor, CorrectnessJudge judge,
                            @Qualifier("evaluationExecutor") ExecutorService evaluationExecutor,
                            EvolutionProperties properties) {
        this.actionExecutor = actionExecutor;
        this.judge = judge;
        this.evaluationExecutor = evaluationExecutor;
        this.settings = properties.getFitness();
    }

    public FitnessScore evaluate(String prompt, Action action, List<TestCase> cases) {
        return evaluate(prompt, action, cases, CancellationToken.none());
    }

    /**
     * @throws EvolutionInterruptedException     when {@code token} is cancelled or expires
     * @throws CollaboratorUnavailableException  when the model stays unavailable
     */
    public FitnessScore evaluate(String prompt, Action action, List<TestCase> cases, CancellationToken token) {
        if (cases.isEmpty()) {
            return FitnessScore.empty();
        }
        token.checkpoint();
        Duration budget = Duration.ofMillis(action.timeoutMs());

        // Plain futures: cancel(true) interrupts a hung case and frees its pool worker
        List<Future<CaseResult>> futures = new ArrayList<>();
        for (TestCase testCase : cases) {
            futures.add(evaluationExecutor.submit(() -> runCase(prompt, action, testCase, budget)));
        }

        List<CaseResult> results = new ArrayList<>();
        try {
            for (int i = 0; i < cases.size(); i++) {
                results.add(await(futures.get(i), cases.get(i), budget.multipliedBy(BUDGET_MULTIPLIER), token));
            }
        } catch (RuntimeException e) {
            futures.forEach(f -> f.cancel(true));
            throw e;
        }
        return score(cases, results);
    }

    private CaseResult runCase(String prompt, Action action, TestCase testCase, Duration budget) {
        ActionExecution execution;
        try {
            execution = actionExecutor.execute(action, prompt, testCase.input(), budget);
        } catch (EvaluationTimeoutException e) {
            return CaseResult.timeout(testCase.id(), budget.toMillis());
        }
        if (execution.latencyMs() > budget.toMillis()) {
            return CaseResult.timeout(testCase.id(), budget.toMillis());
        }
        Judgment judgment = judge.judge(action, testCase, execution.output());
        boolean passed = judgment.score() >= settings.getPassThreshold();
        return new CaseResult(testCase.id(), passed, judgment.score(), execution.latencyMs(),
                execution.tokens(), false, null, judgment.reasoning());
    }

    private CaseResult await(Future<CaseResult> future, TestCase testCase, Duration wait,
                             CancellationToken token) {
        Duration capped = token.cap(wait);
        try {
            return future.get(capped.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            token.checkpoint();
            future.cancel(true);
            log.warn("Test case {} timed out after {}ms", testCase.id(), capped.toMillis());
            return CaseResult.timeout(testCase.id(), capped.toMillis());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof CollaboratorUnavailableException unavailable) {
                throw unavailable;
            }
            log.warn("Test case {} failed: {}", testCase.id(), cause.getMessage());
            return CaseResult.failure(testCase.id(), cause.getClass().getSimpleName() + ": " + cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EvolutionInterruptedException(RunStatus.CANCELLED,
                    "interrupted while evaluating " + testCase.id());
        }
    }

    FitnessScore score(List<TestCase> cases, List<CaseResult> results) {
        double correctness = 0.0;
        double efficiency = 0.0;
        double preferenceSum = 0.0;
        int rated = 0;
        int passed = 0;
        int timeouts = 0;

        for (int i = 0; i < results.size(); i++) {
            CaseResult r = results.get(i);
            correctness += r.correctness();
            if (r.timedOut()) {
                timeouts++;
            }
            if (r.completed()) {
                efficiency += efficiency(r);
            }
            if (r.passed()) {
                passed++;
                Double preference = cases.get(i).preference();
                if (preference != null) {
                    preferenceSum += clamp(preference);
                    rated++;
                }
            }
        }
        int n = results.size();
        double meanCorrectness = clamp(correctness / n);
        double meanEfficiency = clamp(efficiency / n);
        double preference = rated > 0 ? clamp(preferenceSum / rated) : NEUTRAL_PREFERENCE;
        double fitness = clamp(CORRECTNESS_WEIGHT * meanCorrectness
                + EFFICIENCY_WEIGHT * meanEfficiency
                + PREFERENCE_WEIGHT * preference);
        return new FitnessScore(fitness, meanCorrectness, meanEfficiency, preference,
                passed, n, timeouts, results);
    }

    private double efficiency(CaseResult r) {
        double latencyCap = Math.max(1, settings.getLatencyCap().toMillis());
        double tokenCap = Math.max(1, settings.getTokenCap());
        double latencyScore = 1.0 - Math.min(r.latencyMs(), latencyCap) / latencyCap;
        double tokenScore = 1.0 - Math.min(r.tokens(), tokenCap) / tokenCap;
        return (latencyScore + tokenScore) / 2.0;
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
