package com.forgemind.core.registry;

import com.forgemind.core.error.ValidationException;
import com.forgemind.core.model.Action;
import com.forgemind.core.model.Behavior;
import com.forgemind.core.model.TestCase;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural checks applied before a behavior definition or test case enters the registry.
 */
@Component
public class BehaviorValidator {

    public void validate(Behavior behavior) {
        List<String> problems = new ArrayList<>();
        if (behavior.id() == null || behavior.id().isBlank()) {
            problems.add("id must not be blank");
        } else if (behavior.id().contains("@")) {
            problems.add("id must not contain '@'");
        }
        if (behavior.name() == null || behavior.name().isBlank()) {
            problems.add("name must not be blank");
        }
        if (behavior.tier() == null) {
            problems.add("tier is required");
        }
        if (behavior.actions().isEmpty()) {
            problems.add("at least one action is required");
        }
        Set<String> names = new HashSet<>();
        for (Action action : behavior.actions()) {
            if (action.name() == null || action.name().isBlank()) {
                problems.add("action name must not be blank");
                continue;
            }
            if (!names.add(action.name())) {
                problems.add("duplicate action name '" + action.name() + "'");
            }
            if (action.instructionTemplate() == null || action.instructionTemplate().isBlank()) {
                problems.add("action '" + action.name() + "' needs an instruction template");
            }
            if (action.timeoutMs() <= 0) {
                problems.add("action '" + action.name() + "' needs a positive timeout");
            }
        }
        behavior.triggers().forEach(t -> {
            if (t.kind() == null || t.pattern() == null || t.pattern().isBlank()) {
                problems.add("triggers need a kind and a pattern");
            }
        });
        behavior.testCases().forEach(tc -> problems.addAll(problems(behavior, tc)));
        if (!problems.isEmpty()) {
            throw new ValidationException("Invalid behavior " + behavior.id() + ": " + String.join("; ", problems));
        }
    }

    public void validateTestCases(Behavior behavior, List<TestCase> cases) {
        List<String> problems = new ArrayList<>();
        cases.forEach(tc -> problems.addAll(problems(behavior, tc)));
        if (!problems.isEmpty()) {
            throw new ValidationException("Invalid test cases for " + behavior.id() + ": " + String.join("; ", problems));
        }
    }

    private static List<String> problems(Behavior behavior, TestCase tc) {
        List<String> problems = new ArrayList<>();
        if (tc.id() == null || tc.id().isBlank()) {
            problems.add("test case id must not be blank");
        }
        if (tc.actionName() == null || behavior.action(tc.actionName()).isEmpty()) {
            problems.add("test case " + tc.id() + " names unknown action '" + tc.actionName() + "'");
        }
        if (tc.preference() != null && (tc.preference() < 0.0 || tc.preference() > 1.0)) {
            problems.add("test case " + tc.id() + " preference must lie in [0,1]");
        }
        return problems;
    }
}
