package com.pmagents.core.model;

/**
 * Failure category of an {@link Issue}.
 */
public enum IssueCategory {
    TIMEOUT,
    INVALID_RESULT,
    WORKER_FAILURE,
    CIRCUIT_OPEN,
    DEPENDENCY,
    RESOURCE_EXHAUSTED,
    MERGE_CONFLICT,
    GRAPH_INVALID,
    VALIDATION_GATE,
    CONFIGURATION
}
