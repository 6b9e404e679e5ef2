package com.forgemind.core.evolution;

/**
 * Parameters of one evolution run. Null fields fall back to {@link EvolutionProperties}.
 *
 * @param behaviorId     behavior to evolve
 * @param actionName     action whose instruction evolves; null picks one automatically
 * @param maxGenerations generation cap
 * @param targetFitness  stop once a validated candidate reaches this train fitness
 * @param triggerReason  why the run was requested
 * @param seed           random seed for reproducible runs
 */
public record EvolutionRequest(
    String behaviorId,
    String actionName,
    Integer maxGenerations,
    Double targetFitness,
    String triggerReason,
    Long seed
) {

    public static EvolutionRequest of(String behaviorId, Integer maxGenerations, Double targetFitness) {
        return new EvolutionRequest(behaviorId, null, maxGenerations, targetFitness, "manual", null);
    }

    public EvolutionRequest withActionName(String name) {
        return new EvolutionRequest(behaviorId, name, maxGenerations, targetFitness, triggerReason, seed);
    }
}
