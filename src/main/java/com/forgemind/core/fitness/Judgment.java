package com.forgemind.core.fitness;

/**
 * Correctness of one output in [0,1] with the judge's reasoning.
 */
public record Judgment(double score, String reasoning) {

    public static Judgment of(double score, String reasoning) {
        return new Judgment(Math.max(0.0, Math.min(1.0, score)), reasoning);
    }
}
