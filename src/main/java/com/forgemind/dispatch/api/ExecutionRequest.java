package com.forgemind.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.forgemind.core.model.ExecutionRecord;
import com.forgemind.core.model.Feedback;
import com.forgemind.core.model.Outcome;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Inbound JSON body for POST /api/v1/executions. Missing version and timestamp are filled in
 * by the tracker.
 */
public record ExecutionRequest(
    @JsonProperty("execution_id") String executionId,
    @JsonProperty("behavior_id") String behaviorId,
    @JsonProperty("behavior_version") String behaviorVersion,
    @JsonProperty("action_name") String actionName,
    Map<String, Object> input,
    String output,
    boolean success,
    Outcome outcome,
    Feedback feedback,
    @JsonProperty("latency_ms") long latencyMs,
    @JsonProperty("token_cost") long tokenCost,
    Instant timestamp,
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("domain_tags") List<String> domainTags
) {

    public ExecutionRecord toRecord() {
        Outcome resolved = outcome != null ? outcome : success ? Outcome.CORRECT : Outcome.INCORRECT;
        return new ExecutionRecord(executionId, behaviorId, behaviorVersion, actionName, input, output, success,
                resolved, feedback, latencyMs, tokenCost, timestamp, sessionId, domainTags);
    }
}
