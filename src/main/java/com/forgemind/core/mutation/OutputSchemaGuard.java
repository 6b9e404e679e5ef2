package com.forgemind.core.mutation;

import com.forgemind.core.model.Action;

import java.util.List;
import java.util.Locale;

/**
 * Checks that a prompt still names every declared output field of its action.
 */
public final class OutputSchemaGuard {

    private OutputSchemaGuard() {}

    public static List<String> missingFields(String prompt, Action action) {
        String haystack = prompt == null ? "" : prompt.toLowerCase(Locale.ROOT);
        return action.outputSchema().keySet().stream()
                .filter(field -> !haystack.contains(field.toLowerCase(Locale.ROOT)))
                .sorted()
                .toList();
    }

    public static boolean satisfies(String prompt, Action action) {
        return missingFields(prompt, action).isEmpty();
    }
}
