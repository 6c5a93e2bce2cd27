package com.pmagents.core.scheduler;

import com.pmagents.core.error.OrchestrationException;
import com.pmagents.core.model.IssueCategory;

/**
 * The run budget expired or the run was cancelled. Aborts the run.
 */
public class ResourceExhaustedException extends OrchestrationException {

    public ResourceExhaustedException(String taskId, String message) {
        super(taskId, message);
    }

    @Override
    public IssueCategory category() {
        return IssueCategory.RESOURCE_EXHAUSTED;
    }
}
