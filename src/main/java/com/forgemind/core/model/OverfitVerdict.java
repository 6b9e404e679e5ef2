package com.forgemind.core.model;

import java.io.Serializable;

/**
 * Result of comparing train and holdout fitness of a candidate.
 *
 * @param decision       accept, accept with a warning, or reject
 * @param gap            train minus holdout fitness
 * @param trainFitness   fitness on the train partition
 * @param holdoutFitness fitness on the holdout partition
 */
public record OverfitVerdict(
    Decision decision,
    double gap,
    double trainFitness,
    double holdoutFitness
) implements Serializable {

    public enum Decision {
        ACCEPT,
        ACCEPT_WITH_WARNING,
        REJECT
    }
}
