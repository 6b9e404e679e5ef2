package com.forgemind.core;

import com.forgemind.core.model.Action;
import com.forgemind.core.model.ActionExample;
import com.forgemind.core.model.Behavior;
import com.forgemind.core.model.BehaviorTier;
import com.forgemind.core.model.ExecutionRecord;
import com.forgemind.core.model.Feedback;
import com.forgemind.core.model.Outcome;
import com.forgemind.core.model.TestCase;
import com.forgemind.core.model.TestCaseSource;
import com.forgemind.core.model.Trigger;
import com.forgemind.core.model.TriggerKind;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Shared builders for behaviors, test cases and executions used across tests.
 */
public final class Fixtures {

    public static final Instant T0 = Instant.parse("2026-03-02T09:00:00Z");

    public static final String SUMMARIZE_PROMPT = "Summarize the text in {{query}}.\nReturn the answer field.";

    private Fixtures() {}

    public static Action summarize() {
        return new Action("summarize", SUMMARIZE_PROMPT, Map.of("query", "string"), Map.of("answer", "string"),
                false, 5_000, List.of(new ActionExample("Summarize the release notes", "Mentions every feature",
                        "release_notes")));
    }

    public static Behavior behavior(String id) {
        return Behavior.definition(id, "Summarizer " + id, "Summarizes documents and release notes",
                BehaviorTier.APPLICATION, List.of(summarize()),
                List.of(new Trigger(TriggerKind.COMMAND, "/summarize", 5)),
                List.of("docs", "writing"));
    }

    public static Behavior behaviorWithCases(String id, int caseCount) {
        return behavior(id).withTestCases(testCases("summarize", caseCount), T0);
    }

    public static List<TestCase> testCases(String actionName, int count) {
        List<TestCase> cases = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            cases.add(testCase("tc-" + i, actionName));
        }
        return cases;
    }

    public static TestCase testCase(String id, String actionName) {
        return new TestCase(id, actionName, Map.of("query", "document " + id), null,
                "A faithful summary", "general", TestCaseSource.MANUAL, null);
    }

    public static ExecutionRecord execution(String id, String behaviorId, boolean success, Instant at) {
        return new ExecutionRecord(id, behaviorId, null, "summarize", Map.of("query", "weekly report " + id),
                success ? "ok" : "wrong", success, success ? Outcome.CORRECT : Outcome.INCORRECT, null,
                120, 300, at, "session-1", List.of("docs"));
    }

    public static ExecutionRecord negative(String id, String behaviorId, Instant at) {
        ExecutionRecord r = execution(id, behaviorId, true, at);
        return new ExecutionRecord(r.executionId(), r.behaviorId(), r.behaviorVersion(), r.actionName(), r.input(),
                r.output(), r.success(), r.outcome(), new Feedback(Feedback.Sentiment.NEGATIVE, "too long"),
                r.latencyMs(), r.tokenCost(), r.timestamp(), r.sessionId(), r.domainTags());
    }
}
