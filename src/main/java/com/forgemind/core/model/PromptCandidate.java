package com.forgemind.core.model;

import java.util.List;

/**
 * A prompt variant inside an evolution run. Ephemeral; lives only in the candidate arena.
 *
 * @param id                unique within the run
 * @param prompt            instruction text
 * @param generation        generation that produced it
 * @param parentIds         zero, one (mutation) or two (crossover) parents
 * @param mutations         operations applied to produce it
 * @param changeDescription short summary of the change
 * @param trainFitness      fitness on the train partition, null until evaluated
 * @param holdoutFitness    fitness on the holdout partition, null until validated
 * @param verdict           overfit verdict, null until validated
 */
public record PromptCandidate(
    String id,
    String prompt,
    int generation,
    List<String> parentIds,
    List<String> mutations,
    String changeDescription,
    Double trainFitness,
    Double holdoutFitness,
    OverfitVerdict verdict
) {

    public PromptCandidate {
        parentIds = parentIds == null ? List.of() : List.copyOf(parentIds);
        mutations = mutations == null ? List.of() : List.copyOf(mutations);
    }

    public static PromptCandidate seed(String id, String prompt) {
        return new PromptCandidate(id, prompt, 0, List.of(), List.of(), "production prompt", null, null, null);
    }

    public boolean evaluated() {
        return trainFitness != null;
    }

    public boolean validated() {
        return verdict != null;
    }

    public boolean rejected() {
        return verdict != null && verdict.decision() == OverfitVerdict.Decision.REJECT;
    }

    public double fitnessOrZero() {
        return trainFitness != null ? trainFitness : 0.0;
    }

    public PromptCandidate withTrainFitness(double fitness) {
        return new PromptCandidate(id, prompt, generation, parentIds, mutations, changeDescription,
                fitness, holdoutFitness, verdict);
    }

    public PromptCandidate withValidation(double holdout, OverfitVerdict overfitVerdict) {
        return new PromptCandidate(id, prompt, generation, parentIds, mutations, changeDescription,
                trainFitness, holdout, overfitVerdict);
    }
}
