package com.forgemind.core.model;

import java.util.List;

/**
 * Outcome of one evolution run.
 *
 * @param runId             run identifier
 * @param behaviorId        evolved behavior
 * @param actionName        evolved action
 * @param status            terminal status
 * @param improved          true only when a new version was written
 * @param bestFitness       train fitness of the winning candidate
 * @param holdoutFitness    holdout fitness of the winning candidate
 * @param productionFitness train fitness of the production prompt
 * @param generationsRun    completed generations
 * @param promptDiff        line diff from the production prompt to the winner
 * @param fromVersion       version the run started from
 * @param newVersion        version written, null unless improved
 * @param bestPrompt        winning prompt text; for partial runs this is reported but not applied
 * @param warnings          overfit and trend warnings raised during the run
 * @param generations       per-generation checkpoints
 */
public record EvolutionResult(
    String runId,
    String behaviorId,
    String actionName,
    RunStatus status,
    boolean improved,
    double bestFitness,
    double holdoutFitness,
    double productionFitness,
    int generationsRun,
    String promptDiff,
    String fromVersion,
    String newVersion,
    String bestPrompt,
    List<String> warnings,
    List<GenerationSummary> generations
) {

    public EvolutionResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        generations = generations == null ? List.of() : List.copyOf(generations);
    }

    public static EvolutionResult failed(String runId, String behaviorId, String actionName,
                                         String fromVersion, String error) {
        return new EvolutionResult(runId, behaviorId, actionName, RunStatus.FAILED, false, 0.0, 0.0, 0.0,
                0, "", fromVersion, null, null, List.of(error), List.of());
    }
}
