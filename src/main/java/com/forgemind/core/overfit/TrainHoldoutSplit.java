package com.forgemind.core.overfit;

import com.forgemind.core.model.TestCase;

import java.util.List;

/**
 * Disjoint partitions of a test-case set. The holdout partition only authenticates
 * candidates; it never drives selection or mutation.
 */
public record TrainHoldoutSplit(List<TestCase> train, List<TestCase> holdout) {

    public TrainHoldoutSplit {
        train = List.copyOf(train);
        holdout = List.copyOf(holdout);
    }
}
