package com.forgemind.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A typed step of a behavior. The instruction template is the text under evolution.
 *
 * @param name                 unique within the owning behavior
 * @param instructionTemplate  prompt text with {@code {{field}}} placeholders filled from the input
 * @param inputSchema          input field name to type name
 * @param outputSchema         declared output fields; every evolved prompt must keep mentioning them
 * @param confirmationRequired whether a human confirms before the action takes effect
 * @param timeoutMs            per-execution budget
 * @param examples             illustrative requests that seed test cases
 */
public record Action(
    String name,
    String instructionTemplate,
    Map<String, String> inputSchema,
    Map<String, String> outputSchema,
    boolean confirmationRequired,
    long timeoutMs,
    List<ActionExample> examples
) implements Serializable {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([\\w.-]+)\\s*}}");

    public Action {
        inputSchema = inputSchema == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(inputSchema));
        outputSchema = outputSchema == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(outputSchema));
        examples = examples == null ? List.of() : List.copyOf(examples);
    }

    public Action withInstruction(String instruction) {
        return new Action(name, instruction, inputSchema, outputSchema,
                confirmationRequired, timeoutMs, examples);
    }

    /**
     * Fills {@code {{field}}} placeholders of {@code instruction} from {@code input}.
     * Unknown placeholders are left in place.
     */
    public static String render(String instruction, Map<String, Object> input) {
        if (instruction == null) {
            return "";
        }
        Matcher m = PLACEHOLDER.matcher(instruction);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            Object value = input == null ? null : input.get(m.group(1));
            String replacement = value != null ? String.valueOf(value) : m.group();
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
