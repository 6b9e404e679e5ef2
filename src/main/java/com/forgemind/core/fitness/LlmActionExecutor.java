package com.forgemind.core.fitness;

import com.forgemind.core.error.EvaluationTimeoutException;
import com.forgemind.core.llm.Completion;
import com.forgemind.core.llm.LanguageModelClient;
import com.forgemind.core.model.Action;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Default {@link ActionExecutor}: the rendered instruction becomes the system prompt and
 * the input is passed as the user message.
 */
@Component
public class LlmActionExecutor implements ActionExecutor {

    private final LanguageModelClient llm;

    public LlmActionExecutor(LanguageModelClient llm) {
        this.llm = llm;
    }

    @Override
    public ActionExecution execute(Action action, String instruction, Map<String, Object> input, Duration timeout) {
        String system = Action.render(instruction, input) + outputContract(action);
        String user = formatInput(input);

        long start = System.currentTimeMillis();
        Completion completion = llm.complete(system, user);
        long latency = System.currentTimeMillis() - start;
        if (latency > timeout.toMillis()) {
            throw new EvaluationTimeoutException("Action " + action.name() + " took " + latency
                    + "ms, budget " + timeout.toMillis() + "ms");
        }
        return new ActionExecution(completion.text(), latency, completion.tokens());
    }

    private static String outputContract(Action action) {
        if (action.outputSchema().isEmpty()) {
            return "";
        }
        return "\n\nReturn a JSON object with the fields: " + action.outputSchema().entrySet().stream()
                .map(e -> e.getKey() + " (" + e.getValue() + ")")
                .collect(Collectors.joining(", ")) + ".";
    }

    static String formatInput(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return "(no input)";
        }
        return input.entrySet().stream()
                .map(e -> e.getKey() + ": " + e.getValue())
                .collect(Collectors.joining("\n"));
    }
}
