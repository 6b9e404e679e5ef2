package com.forgemind.core.mutation;

/**
 * Accepted mutator output.
 *
 * @param prompt            new instruction text
 * @param changeDescription short summary of what changed
 * @param operation         strategy name, or {@code CROSSOVER}
 */
public record MutationOutcome(String prompt, String changeDescription, String operation) {
}
