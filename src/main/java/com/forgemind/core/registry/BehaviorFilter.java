package com.forgemind.core.registry;

import com.forgemind.core.model.Behavior;
import com.forgemind.core.model.BehaviorTier;
import com.forgemind.core.model.LifecycleState;

/**
 * Optional criteria for listing behaviors; null fields match everything.
 */
public record BehaviorFilter(BehaviorTier tier, LifecycleState lifecycle, String domain) {

    public static BehaviorFilter all() {
        return new BehaviorFilter(null, null, null);
    }

    public boolean matches(Behavior behavior) {
        return (tier == null || behavior.tier() == tier)
                && (lifecycle == null || behavior.lifecycle() == lifecycle)
                && (domain == null || domain.isBlank() || behavior.domainTags().stream().anyMatch(domain::equalsIgnoreCase));
    }
}
