package com.forgemind.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Forgemind-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String BEHAVIOR_ID = "behaviorId";
    public static final String JOB_ID = "jobId";
    public static final String GENERATION = "generation";

    private MdcContext() {}

    public static void setBehavior(String behaviorId) {
        MDC.put(BEHAVIOR_ID, behaviorId);
    }

    public static void setJob(String behaviorId, String jobId) {
        MDC.put(BEHAVIOR_ID, behaviorId);
        MDC.put(JOB_ID, jobId);
    }

    public static void setGeneration(int generation) {
        MDC.put(GENERATION, String.valueOf(generation));
    }

    public static void clearGeneration() {
        MDC.remove(GENERATION);
    }

    public static void clear() {
        MDC.remove(BEHAVIOR_ID);
        MDC.remove(JOB_ID);
        MDC.remove(GENERATION);
    }
}
