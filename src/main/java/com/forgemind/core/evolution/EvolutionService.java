package com.forgemind.core.evolution;

import com.forgemind.core.error.NotFoundException;
import com.forgemind.core.model.Action;
import com.forgemind.core.model.Behavior;
import com.forgemind.core.model.EvolutionJobStatus;
import com.forgemind.core.model.EvolutionResult;
import com.forgemind.core.model.EvolutionRunRecord;
import com.forgemind.core.model.FailurePattern;
import com.forgemind.core.model.TestCase;
import com.forgemind.core.model.VersionComparison;
import com.forgemind.core.model.VersionComparison.Recommendation;
import com.forgemind.core.model.VersionFitness;
import com.forgemind.core.registry.BehaviorRegistry;
import com.forgemind.core.store.BehaviorStore;
import com.forgemind.core.testing.TestCaseGenerator;
import com.forgemind.core.tracking.ExecutionTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Entry point for evolution: runs, history, status and version comparison.
 */
@Service
public class EvolutionService {

    private static final Logger log = LoggerFactory.getLogger(EvolutionService.class);

    static final int MIN_COMPARABLE_EXECUTIONS = 10;
    static final double EQUIVALENCE_MARGIN = 0.02;
    private static final int RUN_SCAN_LIMIT = 500;

    private final BehaviorRegistry registry;
    private final ExecutionTracker tracker;
    private final BehaviorStore store;
    private final EvolutionJobManager jobManager;
    private final TestCaseGenerator testCaseGenerator;

    public EvolutionService(BehaviorRegistry registry, ExecutionTracker tracker, BehaviorStore store,
                            EvolutionJobManager jobManager, TestCaseGenerator testCaseGenerator) {
        this.registry = registry;
        this.tracker = tracker;
        this.store = store;
        this.jobManager = jobManager;
        this.testCaseGenerator = testCaseGenerator;
    }

    /** Runs evolution on the job executor and waits for the result. */
    public EvolutionResult evolve(String behaviorId, Integer maxGenerations, Double targetFitness) {
        return evolve(EvolutionRequest.of(behaviorId, maxGenerations, targetFitness));
    }

    public EvolutionResult evolve(EvolutionRequest request) {
        return evolveAsync(request).result().join();
    }

    /**
     * Resolves the action to evolve, seeds test cases when it has too few, and queues a job.
     */
    public EvolutionJob evolveAsync(EvolutionRequest request) {
        Behavior behavior = registry.get(request.behaviorId());
        Action action = chooseAction(behavior, request.actionName());
        ensureTestCases(behavior, action);
        return jobManager.submit(request.withActionName(action.name()));
    }

    public List<EvolutionRunRecord> getEvolutionHistory(String behaviorId, int limit) {
        registry.get(behaviorId);
        return store.evolutionRuns(behaviorId, limit);
    }

    public List<EvolutionJobStatus> getEvolutionStatus(String behaviorId) {
        return jobManager.active(behaviorId).stream().map(EvolutionJob::status).toList();
    }

    public EvolutionJobStatus getJob(String jobId) {
        return jobManager.get(jobId).map(EvolutionJob::status)
                .orElseThrow(() -> new NotFoundException("Evolution job " + jobId + " not found"));
    }

    public boolean cancelEvolution(String jobId) {
        return jobManager.cancel(jobId);
    }

    /**
     * Compares two versions by observed success rate when both have enough executions,
     * otherwise by the fitness evolution measured for them.
     */
    public VersionComparison compareVersions(String behaviorId, String versionA, String versionB) {
        Behavior a = registry.getVersion(behaviorId, versionA);
        Behavior b = registry.getVersion(behaviorId, versionB);
        List<EvolutionRunRecord> runs = store.evolutionRuns(behaviorId, RUN_SCAN_LIMIT);
        VersionFitness fitnessA = withEvolvedFitness(tracker.versionStats(behaviorId, versionA), runs);
        VersionFitness fitnessB = withEvolvedFitness(tracker.versionStats(behaviorId, versionB), runs);

        Recommendation recommendation;
        String rationale;
        if (fitnessA.executions() >= MIN_COMPARABLE_EXECUTIONS && fitnessB.executions() >= MIN_COMPARABLE_EXECUTIONS) {
            recommendation = prefer(fitnessA.successRate(), fitnessB.successRate());
            rationale = String.format("success rate %.3f over %d executions vs %.3f over %d executions",
                    fitnessA.successRate(), fitnessA.executions(), fitnessB.successRate(), fitnessB.executions());
        } else if (fitnessA.evolvedFitness() != null && fitnessB.evolvedFitness() != null) {
            recommendation = prefer(fitnessA.evolvedFitness(), fitnessB.evolvedFitness());
            rationale = String.format("evolved fitness %.3f vs %.3f", fitnessA.evolvedFitness(), fitnessB.evolvedFitness());
        } else {
            recommendation = Recommendation.INSUFFICIENT_DATA;
            rationale = "need " + MIN_COMPARABLE_EXECUTIONS + " executions per version or evolved fitness for both";
        }
        return new VersionComparison(behaviorId, fitnessA, fitnessB, diff(a, b), recommendation, rationale);
    }

    // ── internals ─────────────────────────────────────────────────

    /**
     * The named action; else the action with the most recorded failures; else the first
     * action with enough test cases; else the first action.
     */
    Action chooseAction(Behavior behavior, String actionName) {
        if (actionName != null) {
            return EvolutionEngine.resolveAction(behavior, actionName);
        }
        Map<String, Integer> failures = tracker.failurePatterns(behavior.id(), Integer.MAX_VALUE).stream()
                .collect(Collectors.groupingBy(FailurePattern::actionName, Collectors.summingInt(FailurePattern::count)));
        Optional<Action> mostFailing = behavior.actions().stream()
                .filter(a -> failures.containsKey(a.name()))
                .max(Comparator.comparingInt(a -> failures.get(a.name())));
        if (mostFailing.isPresent()) {
            return mostFailing.get();
        }
        return behavior.actions().stream()
                .filter(a -> behavior.testCasesFor(a.name()).size() >= EvolutionEngine.MIN_TEST_CASES)
                .findFirst()
                .orElse(behavior.actions().get(0));
    }

    private void ensureTestCases(Behavior behavior, Action action) {
        if (behavior.testCasesFor(action.name()).size() >= EvolutionEngine.MIN_TEST_CASES) {
            return;
        }
        List<TestCase> generated = new ArrayList<>(testCaseGenerator.fromExamples(action));
        generated.addAll(testCaseGenerator.fromFailurePatterns(behavior.id(), action));
        if (!generated.isEmpty()) {
            log.info("Seeding {} test cases for {}.{}", generated.size(), behavior.id(), action.name());
            registry.addTestCases(behavior.id(), generated);
        }
    }

    private static VersionFitness withEvolvedFitness(VersionFitness stats, List<EvolutionRunRecord> runs) {
        Double evolved = runs.stream()
                .filter(r -> stats.version().equals(r.toVersion()))
                .map(EvolutionRunRecord::bestFitness)
                .findFirst()
                .orElseGet(() -> runs.stream()
                        .filter(r -> stats.version().equals(r.fromVersion()) && r.generationsRun() > 0)
                        .map(EvolutionRunRecord::productionFitness)
                        .findFirst()
                        .orElse(null));
        return new VersionFitness(stats.version(), stats.executions(), stats.successRate(),
                stats.meanLatencyMs(), evolved);
    }

    private static Recommendation prefer(double a, double b) {
        if (Math.abs(a - b) <= EQUIVALENCE_MARGIN) {
            return Recommendation.EQUIVALENT;
        }
        return a > b ? Recommendation.PREFER_A : Recommendation.PREFER_B;
    }

    private static String diff(Behavior a, Behavior b) {
        StringBuilder out = new StringBuilder();
        for (Action action : a.actions()) {
            String other = b.action(action.name()).map(Action::instructionTemplate).orElse("");
            if (!TextDiff.identical(action.instructionTemplate(), other)) {
                out.append("@@ ").append(action.name()).append('\n')
                        .append(TextDiff.lines(action.instructionTemplate(), other)).append('\n');
            }
        }
        for (Action action : b.actions()) {
            if (a.action(action.name()).isEmpty()) {
                out.append("@@ ").append(action.name()).append('\n')
                        .append(TextDiff.lines("", action.instructionTemplate())).append('\n');
            }
        }
        return out.toString().stripTrailing();
    }
}
