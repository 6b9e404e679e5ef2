package com.forgemind.core.model;

import java.io.Serializable;

/**
 * Illustrative request for an action, used to seed test cases.
 *
 * @param userQuery       what a user asked
 * @param expectedOutcome description of a good answer, used as a judging rubric
 * @param scenarioType    scenario label used to stratify train/holdout splits
 */
public record ActionExample(
    String userQuery,
    String expectedOutcome,
    String scenarioType
) implements Serializable {
}
