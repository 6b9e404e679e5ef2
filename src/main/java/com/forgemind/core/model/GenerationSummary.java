package com.forgemind.core.model;

import java.io.Serializable;

/**
 * Checkpoint published at the end of every generation.
 *
 * @param generation          zero-based generation index
 * @param bestTrainFitness    best train fitness among all candidates of the generation
 * @param bestSoFarFitness    train fitness of the best holdout-validated candidate so far
 * @param bestHoldoutFitness  holdout fitness of that candidate
 * @param populationSize      candidates evaluated
 * @param rejected            elites rejected as overfitting
 * @param elapsedMs           wall-clock time of the generation
 */
public record GenerationSummary(
    int generation,
    double bestTrainFitness,
    double bestSoFarFitness,
    double bestHoldoutFitness,
    int populationSize,
    int rejected,
    long elapsedMs
) implements Serializable {
}
