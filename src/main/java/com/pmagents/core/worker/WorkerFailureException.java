package com.pmagents.core.worker;

import com.pmagents.core.error.OrchestrationException;
import com.pmagents.core.model.IssueCategory;

/**
 * A worker reported failure or threw while executing a task.
 */
public class WorkerFailureException extends OrchestrationException {

    public WorkerFailureException(String taskId, String message) {
        super(taskId, message);
    }

    public WorkerFailureException(String taskId, String message, Throwable cause) {
        super(taskId, message, cause);
    }

    @Override
    public IssueCategory category() {
        return IssueCategory.WORKER_FAILURE;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
