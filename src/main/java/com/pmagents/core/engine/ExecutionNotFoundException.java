package com.pmagents.core.engine;

/**
 * No execution with the given id is known (never submitted, or evicted from the registry).
 */
public class ExecutionNotFoundException extends RuntimeException {

    public ExecutionNotFoundException(String executionId) {
        super("Unknown execution: " + executionId);
    }
}
