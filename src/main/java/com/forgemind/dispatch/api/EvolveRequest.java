package com.forgemind.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/evolution/{behaviorId}. All fields are optional.
 *
 * @param actionName     action to evolve; chosen automatically when null
 * @param maxGenerations generation cap; defaults to configuration
 * @param targetFitness  early-stop fitness; defaults to configuration
 * @param seed           random seed for a reproducible run
 */
public record EvolveRequest(
    @JsonProperty("action_name") String actionName,
    @JsonProperty("max_generations") Integer maxGenerations,
    @JsonProperty("target_fitness") Double targetFitness,
    Long seed
) {}
