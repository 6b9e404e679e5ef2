package com.forgemind.core.model;

/**
 * Outcome of running one test case against a candidate prompt.
 *
 * @param testCaseId  case identifier
 * @param passed      correctness reached the pass threshold
 * @param correctness judged correctness in [0,1]
 * @param latencyMs   execution latency
 * @param tokens      tokens consumed by the execution
 * @param timedOut    the case exceeded its budget
 * @param error       exception summary when the execution failed, otherwise null
 * @param reasoning   judge's explanation, nullable
 */
public record CaseResult(
    String testCaseId,
    boolean passed,
    double correctness,
    long latencyMs,
    long tokens,
    boolean timedOut,
    String error,
    String reasoning
) {

    public static CaseResult timeout(String testCaseId, long budgetMs) {
        return new CaseResult(testCaseId, false, 0.0, budgetMs, 0, true, null, "timed out after " + budgetMs + "ms");
    }

    public static CaseResult failure(String testCaseId, String error) {
        return new CaseResult(testCaseId, false, 0.0, 0, 0, false, error, null);
    }

    /** The action produced an output within budget, whatever its correctness. */
    public boolean completed() {
        return !timedOut && error == null;
    }
}
