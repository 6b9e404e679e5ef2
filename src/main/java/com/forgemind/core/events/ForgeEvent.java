package com.forgemind.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * Event emitted by the registry, the tracker and evolution jobs.
 *
 * @param eventType  dotted type, e.g. {@code evolution.generation}
 * @param behaviorId behavior the event concerns
 * @param jobId      evolution job, nullable
 * @param payload    event-specific data
 * @param timestamp  when it happened
 */
public record ForgeEvent(
    String eventType,
    String behaviorId,
    String jobId,
    Map<String, Object> payload,
    Instant timestamp
) {

    public static final String EVOLUTION_STARTED = "evolution.started";
    public static final String EVOLUTION_GENERATION = "evolution.generation";
    public static final String EVOLUTION_COMPLETED = "evolution.completed";
    public static final String EVOLUTION_FAILED = "evolution.failed";
    public static final String BEHAVIOR_REGISTERED = "behavior.registered";
    public static final String BEHAVIOR_PROMOTED = "behavior.promoted";
    public static final String EXECUTION_RECORDED = "execution.recorded";

    public static ForgeEvent of(String eventType, String behaviorId, String jobId, Map<String, Object> payload) {
        return new ForgeEvent(eventType, behaviorId, jobId, payload == null ? Map.of() : payload, Instant.now());
    }
}
