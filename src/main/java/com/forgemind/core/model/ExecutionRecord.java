package com.forgemind.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One execution of a behavior action. Append-only; never mutated after it is recorded.
 *
 * @param executionId     idempotency key
 * @param behaviorId      executed behavior
 * @param behaviorVersion version that ran
 * @param actionName      executed action
 * @param input           action input
 * @param output          raw output text
 * @param success         whether the execution succeeded
 * @param outcome         outcome classification
 * @param feedback        explicit human feedback, nullable
 * @param latencyMs       wall-clock latency
 * @param tokenCost       tokens consumed
 * @param timestamp       when it ran
 * @param sessionId       caller session, nullable
 * @param domainTags      tags of the request context
 */
public record ExecutionRecord(
    String executionId,
    String behaviorId,
    String behaviorVersion,
    String actionName,
    Map<String, Object> input,
    String output,
    boolean success,
    Outcome outcome,
    Feedback feedback,
    long latencyMs,
    long tokenCost,
    Instant timestamp,
    String sessionId,
    List<String> domainTags
) implements Serializable {

    public ExecutionRecord {
        input = input == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(input));
        domainTags = domainTags == null ? List.of() : List.copyOf(domainTags);
    }

    public boolean hasNegativeFeedback() {
        return feedback != null && feedback.negative();
    }
}
