package com.forgemind.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.forgemind.core.model.EvolutionResult;

import java.util.List;

/**
 * Outbound JSON for a finished evolution run.
 */
public record EvolveResponse(
    @JsonProperty("run_id") String runId,
    @JsonProperty("behavior_id") String behaviorId,
    @JsonProperty("action_name") String actionName,
    String status,
    boolean improved,
    @JsonProperty("best_fitness") double bestFitness,
    @JsonProperty("holdout_fitness") double holdoutFitness,
    @JsonProperty("production_fitness") double productionFitness,
    @JsonProperty("generations_run") int generationsRun,
    @JsonProperty("prompt_diff") String promptDiff,
    @JsonProperty("from_version") String fromVersion,
    @JsonProperty("new_version") String newVersion,
    List<String> warnings
) {

    public static EvolveResponse from(EvolutionResult r) {
        return new EvolveResponse(r.runId(), r.behaviorId(), r.actionName(), r.status().name(), r.improved(),
                r.bestFitness(), r.holdoutFitness(), r.productionFitness(), r.generationsRun(), r.promptDiff(),
                r.fromVersion(), r.newVersion(), r.warnings());
    }
}
