package com.pmagents.core.model;

/**
 * Recovery applied when a task fails.
 */
public enum RecoveryAction {
    /** Attempt the task again (proxy-internal). */
    RETRY,
    /** Give up on the task; dependents are skipped, unrelated branches continue. */
    SKIP,
    /** Stop dispatching and hand the decision to the caller. */
    ESCALATE
}
