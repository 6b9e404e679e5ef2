package com.forgemind.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.forgemind.core.model.Action;
import com.forgemind.core.model.Behavior;
import com.forgemind.core.model.BehaviorStats;
import com.forgemind.core.model.BehaviorTier;
import com.forgemind.core.model.LifecycleState;
import com.forgemind.core.model.TestCase;
import com.forgemind.core.model.Trigger;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/behaviors.
 *
 * @param evolvable defaults to true when omitted
 */
public record BehaviorRequest(
    String id,
    String name,
    String description,
    BehaviorTier tier,
    List<Action> actions,
    List<Trigger> triggers,
    @JsonProperty("domain_tags") List<String> domainTags,
    Boolean evolvable,
    @JsonProperty("test_cases") List<TestCase> testCases,
    @JsonProperty("style_constraints") List<String> styleConstraints
) {

    public Behavior toDefinition() {
        return new Behavior(id, name, description, tier, LifecycleState.DRAFT, actions, triggers, domainTags,
                Behavior.INITIAL_VERSION, 0, null, BehaviorStats.empty(), evolvable == null || evolvable,
                testCases, styleConstraints, null, null, 0, null, null, null);
    }
}
