package com.forgemind.core.model;

/**
 * Answer of the evolution trigger.
 *
 * @param shouldEvolve whether an evolution run should start
 * @param reason       first satisfied condition, or the veto that blocked it
 */
public record EvolutionDecision(boolean shouldEvolve, String reason) {

    public static EvolutionDecision evolve(String reason) {
        return new EvolutionDecision(true, reason);
    }

    public static EvolutionDecision skip(String reason) {
        return new EvolutionDecision(false, reason);
    }
}
