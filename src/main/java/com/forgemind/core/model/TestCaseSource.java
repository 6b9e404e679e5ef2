package com.forgemind.core.model;

public enum TestCaseSource {
    EXAMPLE,
    FAILURE_PATTERN,
    GENERATED,
    MANUAL
}
