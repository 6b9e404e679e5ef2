package com.forgemind.core.fitness;

import com.forgemind.core.model.Action;
import com.forgemind.core.model.Behavior;
import com.forgemind.core.model.FitnessScore;
import com.forgemind.core.model.TestCase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs every test case of a behavior against the current instruction of its action.
 * Used as the gate for promotion to STAGING.
 */
@Service
public class TestSuiteRunner {

    private static final Logger log = LoggerFactory.getLogger(TestSuiteRunner.class);

    private final FitnessEvaluator evaluator;

    public TestSuiteRunner(FitnessEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    public TestSuiteResult run(Behavior behavior) {
        int total = 0;
        int passed = 0;
        List<String> failed = new ArrayList<>();
        for (Action action : behavior.actions()) {
            List<TestCase> cases = behavior.testCasesFor(action.name());
            if (cases.isEmpty()) {
                continue;
            }
            FitnessScore score = evaluator.evaluate(action.instructionTemplate(), action, cases);
            total += score.casesTotal();
            passed += score.casesPassed();
            failed.addAll(score.failedCaseIds());
        }
        // Cases naming an action the behavior no longer has can never pass
        List<String> orphaned = behavior.testCases().stream()
                .filter(tc -> behavior.action(tc.actionName()).isEmpty())
                .map(TestCase::id)
                .toList();
        total += orphaned.size();
        failed.addAll(orphaned);

        log.info("Test suite for {}: {}/{} passed", behavior.id(), passed, total);
        return new TestSuiteResult(total, passed, failed);
    }
}
