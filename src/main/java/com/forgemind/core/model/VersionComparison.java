package com.forgemind.core.model;

/**
 * Side-by-side comparison of two versions of a behavior.
 */
public record VersionComparison(
    String behaviorId,
    VersionFitness versionA,
    VersionFitness versionB,
    String diff,
    Recommendation recommendation,
    String rationale
) {

    public enum Recommendation {
        PREFER_A,
        PREFER_B,
        EQUIVALENT,
        INSUFFICIENT_DATA
    }
}
