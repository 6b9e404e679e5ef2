package com.forgemind.core.fitness;

import com.forgemind.core.model.Action;

import java.time.Duration;
import java.util.Map;

/**
 * Runs an action with a given instruction text. The fitness evaluator uses it to try
 * candidate prompts without touching the registered behavior.
 */
public interface ActionExecutor {

    /**
     * @param action      the action being exercised; its schemas describe the expected output
     * @param instruction instruction text to use in place of the action's template
     * @param input       action input
     * @param timeout     time budget for this execution
     * @throws com.forgemind.core.error.EvaluationTimeoutException when the budget is exceeded
     */
    ActionExecution execute(Action action, String instruction, Map<String, Object> input, Duration timeout);
}
