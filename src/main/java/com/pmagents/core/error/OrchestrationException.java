package com.pmagents.core.error;

import com.pmagents.core.model.IssueCategory;

/**
 * Base of the orchestration error taxonomy. Every error knows its {@link IssueCategory}
 * and whether the worker proxy may retry the attempt that raised it.
 */
public abstract class OrchestrationException extends RuntimeException {

    private final String taskId;

    protected OrchestrationException(String taskId, String message) {
        super(message);
        this.taskId = taskId;
    }

    protected OrchestrationException(String taskId, String message, Throwable cause) {
        super(message, cause);
        this.taskId = taskId;
    }

    /**
     * The task the error relates to, or {@code null} for run-level errors.
     */
    public String taskId() {
        return taskId;
    }

    public abstract IssueCategory category();

    public boolean isRetryable() {
        return false;
    }
}
