package com.forgemind.core.model;

import java.util.Set;

/**
 * Lifecycle of a behavior. Transitions follow a fixed graph:
 * DRAFT → TESTING → STAGING → ACTIVE → DEPRECATED → RETIRED, plus TESTING → DRAFT
 * when a behavior regresses after repeated test failures.
 */
public enum LifecycleState {
    DRAFT,
    TESTING,
    STAGING,
    ACTIVE,
    DEPRECATED,
    RETIRED;

    public Set<LifecycleState> allowedTargets() {
        return switch (this) {
            case DRAFT -> Set.of(TESTING);
            case TESTING -> Set.of(STAGING, DRAFT);
            case STAGING -> Set.of(ACTIVE);
            case ACTIVE -> Set.of(DEPRECATED);
            case DEPRECATED -> Set.of(RETIRED);
            case RETIRED -> Set.of();
        };
    }

    public boolean canTransitionTo(LifecycleState target) {
        return allowedTargets().contains(target);
    }
}
