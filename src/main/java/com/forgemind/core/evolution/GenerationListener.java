package com.forgemind.core.evolution;

import com.forgemind.core.model.GenerationSummary;

/**
 * Receives a checkpoint after every completed generation.
 */
@FunctionalInterface
public interface GenerationListener {

    GenerationListener NONE = summary -> { };

    void onGeneration(GenerationSummary summary);
}
