package com.forgemind.core.model;

import java.util.List;
import java.util.Map;

/**
 * Cluster of failing executions that share an outcome and input features.
 *
 * @param outcome       shared outcome classification
 * @param actionName    shared action
 * @param signature     normalized input feature signature
 * @param count         number of executions in the cluster
 * @param exampleInputs a few representative inputs
 */
public record FailurePattern(
    Outcome outcome,
    String actionName,
    String signature,
    int count,
    List<Map<String, Object>> exampleInputs
) {
}
