package com.forgemind.core.model;

import java.util.List;

/**
 * Composite fitness of a prompt over a set of test cases. Every component lies in [0,1].
 */
public record FitnessScore(
    double fitness,
    double correctness,
    double efficiency,
    double preference,
    int casesPassed,
    int casesTotal,
    int timeouts,
    List<CaseResult> caseResults
) {

    public FitnessScore {
        caseResults = caseResults == null ? List.of() : List.copyOf(caseResults);
    }

    public static FitnessScore empty() {
        return new FitnessScore(0.0, 0.0, 0.0, 0.0, 0, 0, 0, List.of());
    }

    public boolean allPassed() {
        return casesTotal > 0 && casesPassed == casesTotal;
    }

    public List<String> failedCaseIds() {
        return caseResults.stream().filter(r -> !r.passed()).map(CaseResult::testCaseId).toList();
    }
}
