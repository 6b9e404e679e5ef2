package com.forgemind.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Persisted history entry for one evolution run.
 */
public record EvolutionRunRecord(
    String runId,
    String jobId,
    String behaviorId,
    String actionName,
    String triggerReason,
    RunStatus status,
    boolean improved,
    String fromVersion,
    String toVersion,
    int generationsRun,
    double bestFitness,
    double holdoutFitness,
    double productionFitness,
    String promptDiff,
    List<String> warnings,
    List<GenerationSummary> generations,
    Instant startedAt,
    Instant finishedAt
) implements Serializable {

    public EvolutionRunRecord {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        generations = generations == null ? List.of() : List.copyOf(generations);
    }

    public static EvolutionRunRecord of(EvolutionResult result, String jobId, String triggerReason,
                                        Instant startedAt, Instant finishedAt) {
        return new EvolutionRunRecord(result.runId(), jobId, result.behaviorId(), result.actionName(),
                triggerReason, result.status(), result.improved(), result.fromVersion(), result.newVersion(),
                result.generationsRun(), result.bestFitness(), result.holdoutFitness(),
                result.productionFitness(), result.promptDiff(), result.warnings(), result.generations(),
                startedAt, finishedAt);
    }
}
