package com.forgemind.core.model;

public enum JobState {
    PENDING,
    RUNNING,
    COMPLETED,
    CANCELLED,
    FAILED;

    public boolean active() {
        return this == PENDING || this == RUNNING;
    }
}
