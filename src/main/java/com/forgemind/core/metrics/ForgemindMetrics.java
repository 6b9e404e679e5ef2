package com.forgemind.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for behavior execution and evolution.
 */
@Service
public class ForgemindMetrics {

    private final MeterRegistry registry;

    public ForgemindMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordExecution(String behaviorId, boolean success, long latencyMs) {
        Counter.builder("forgemind.executions.total")
                .tag("behavior", behaviorId)
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
        Timer.builder("forgemind.execution.latency")
                .tag("behavior", behaviorId)
                .register(registry)
                .record(Duration.ofMillis(latencyMs));
    }

    public void recordEvolutionRun(String status, long ms) {
        Counter.builder("forgemind.evolution.runs")
                .tag("status", status)
                .register(registry)
                .increment();
        Timer.builder("forgemind.evolution.duration")
                .tag("status", status)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordGenerations(int generations) {
        DistributionSummary.builder("forgemind.evolution.generations")
                .description("Generations completed per evolution run")
                .register(registry)
                .record(generations);
    }

    public void recordCandidateFitness(double fitness) {
        DistributionSummary.builder("forgemind.evolution.candidate_fitness")
                .description("Train fitness of evaluated candidates")
                .register(registry)
                .record(fitness);
    }

    public void incrementOverfitRejections() {
        Counter.builder("forgemind.evolution.overfit_rejections")
                .description("Elites discarded because the train/holdout gap was too large")
                .register(registry)
                .increment();
    }

    public void incrementMutationRejections(String operation) {
        Counter.builder("forgemind.mutation.rejections")
                .description("Mutator outputs rejected for dropping output fields or copying a parent")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    public void recordPromotion(String target, boolean allowed) {
        Counter.builder("forgemind.promotions.total")
                .tag("target", target)
                .tag("allowed", String.valueOf(allowed))
                .register(registry)
                .increment();
    }

    public void incrementTriggers(String reason) {
        Counter.builder("forgemind.trigger.fired")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
