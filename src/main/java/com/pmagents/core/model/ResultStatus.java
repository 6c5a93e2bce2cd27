package com.pmagents.core.model;

/**
 * Status reported by a worker for one task attempt.
 */
public enum ResultStatus {
    SUCCESS,
    FAILURE
}
