package com.forgemind.core.model;

/**
 * Single-parent rewrite operations applied by the prompt mutator.
 */
public enum MutationStrategy {
    REPHRASE("Reword the instruction with different phrasing while keeping its meaning."),
    ELABORATE("Add clarifying detail, edge-case guidance or examples where the instruction is vague."),
    SIMPLIFY("Remove redundancy and shorten the instruction without losing any requirement."),
    RESTRUCTURE("Reorganize the instruction into clearer sections or ordered steps."),
    SPECIALIZE("Make the instruction more specific to the scenarios where it currently fails."),
    GENERALIZE("Make the instruction handle a broader range of inputs without special-casing.");

    private final String directive;

    MutationStrategy(String directive) {
        this.directive = directive;
    }

    public String directive() {
        return directive;
    }
}
