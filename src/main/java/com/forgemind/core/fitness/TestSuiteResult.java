package com.forgemind.core.fitness;

import java.util.List;

/**
 * Pass/fail summary of a behavior's test cases.
 */
public record TestSuiteResult(int total, int passed, List<String> failedCaseIds) {

    public TestSuiteResult {
        failedCaseIds = failedCaseIds == null ? List.of() : List.copyOf(failedCaseIds);
    }

    public boolean allPassed() {
        return total > 0 && passed == total;
    }
}
