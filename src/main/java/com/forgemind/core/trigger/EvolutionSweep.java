package com.forgemind.core.trigger;

import com.forgemind.core.error.ForgemindException;
import com.forgemind.core.evolution.EvolutionJob;
import com.forgemind.core.evolution.EvolutionRequest;
import com.forgemind.core.evolution.EvolutionService;
import com.forgemind.core.model.Behavior;
import com.forgemind.core.model.EvolutionDecision;
import com.forgemind.core.model.LifecycleState;
import com.forgemind.core.registry.BehaviorFilter;
import com.forgemind.core.registry.BehaviorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Periodic trigger check over every active, evolvable behavior.
 */
@Component
public class EvolutionSweep {

    private static final Logger log = LoggerFactory.getLogger(EvolutionSweep.class);

    private final BehaviorRegistry registry;
    private final EvolutionTrigger trigger;
    private final EvolutionService evolutionService;
    private final TriggerProperties properties;

    public EvolutionSweep(BehaviorRegistry registry, EvolutionTrigger trigger, EvolutionService evolutionService,
                          TriggerProperties properties) {
        this.registry = registry;
        this.trigger = trigger;
        this.evolutionService = evolutionService;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${forgemind.trigger.sweep-interval:PT1H}")
    public void scheduledSweep() {
        if (properties.isSweepEnabled()) {
            runOnce();
        }
    }

    /** Submits a job for each triggered behavior and returns the submitted jobs. */
    public List<EvolutionJob> runOnce() {
        List<EvolutionJob> submitted = new ArrayList<>();
        List<Behavior> candidates = registry.list(new BehaviorFilter(null, LifecycleState.ACTIVE, null)).stream()
                .filter(Behavior::evolvable)
                .toList();
        for (Behavior behavior : candidates) {
            try {
                EvolutionDecision decision = trigger.shouldEvolve(behavior.id());
                if (decision.shouldEvolve()) {
                    submitted.add(evolutionService.evolveAsync(
                            new EvolutionRequest(behavior.id(), null, null, null, decision.reason(), null)));
                }
            } catch (ForgemindException e) {
                log.warn("Sweep skipped {}: {}", behavior.id(), e.getMessage());
            }
        }
        log.info("Evolution sweep checked {} behaviors, submitted {} jobs", candidates.size(), submitted.size());
        return submitted;
    }
}
