package com.pmagents.core.worker;

import com.pmagents.core.error.OrchestrationException;
import com.pmagents.core.model.IssueCategory;

import java.time.Duration;

/**
 * A worker call did not return within its timeout. Retryable with an escalated timeout.
 */
public class TaskTimeoutException extends OrchestrationException {

    private final Duration timeout;

    public TaskTimeoutException(String taskId, Duration timeout) {
        super(taskId, "Task " + taskId + " timed out after " + timeout.toMillis() + "ms");
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }

    @Override
    public IssueCategory category() {
        return IssueCategory.TIMEOUT;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
