package com.forgemind.core.fitness;

/**
 * Raw result of running an action once.
 */
public record ActionExecution(String output, long latencyMs, long tokens) {
}
