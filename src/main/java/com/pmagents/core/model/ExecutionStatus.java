package com.pmagents.core.model;

/**
 * Overall outcome of a graph execution.
 */
public enum ExecutionStatus {
    RUNNING,
    COMPLETED,
    PARTIAL,
    FAILED
}
