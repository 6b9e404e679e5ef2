package com.forgemind.core.model;

/**
 * Provenance tier of a behavior definition.
 */
public enum BehaviorTier {
    BUILT_IN,
    EXTENSION,
    APPLICATION,
    GENERATED,
    EXPERIMENTAL
}
