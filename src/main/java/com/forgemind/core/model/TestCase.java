package com.forgemind.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Input with an expectation, used for staging checks and fitness evaluation.
 *
 * @param id             unique within the behavior
 * @param actionName     action under test
 * @param input          action input
 * @param expectedOutput exact or JSON answer; null means open-ended and LM judged
 * @param rubric         what a correct answer looks like, for open-ended cases
 * @param scenarioType   stratification key for train/holdout splits
 * @param source         where the case came from
 * @param preference     explicit preference rating in [0,1], nullable
 */
public record TestCase(
    String id,
    String actionName,
    Map<String, Object> input,
    String expectedOutput,
    String rubric,
    String scenarioType,
    TestCaseSource source,
    Double preference
) implements Serializable {

    public static final String DEFAULT_SCENARIO = "general";

    public TestCase {
        input = input == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(input));
        scenarioType = scenarioType == null || scenarioType.isBlank() ? DEFAULT_SCENARIO : scenarioType;
        source = source == null ? TestCaseSource.MANUAL : source;
    }

    public boolean openEnded() {
        return expectedOutput == null || expectedOutput.isBlank();
    }
}
