package com.forgemind.core.model;

public enum TriggerKind {
    FILE_PATTERN,
    COMMAND,
    EVENT,
    QUERY
}
