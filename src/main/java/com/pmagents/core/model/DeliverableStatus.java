package com.pmagents.core.model;

/**
 * Validation status of an aggregated deliverable. {@link #SKIPPED} until validated.
 */
public enum DeliverableStatus {
    PASSED,
    FAILED,
    SKIPPED
}
