package com.pmagents.core.worker;

import com.pmagents.core.error.OrchestrationException;
import com.pmagents.core.model.IssueCategory;

import java.util.List;

/**
 * A worker returned output that fails local structural validation.
 */
public class InvalidResultException extends OrchestrationException {

    private final List<String> violations;

    public InvalidResultException(String taskId, List<String> violations) {
        super(taskId, "Task " + taskId + " returned an invalid result: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> violations() {
        return violations;
    }

    @Override
    public IssueCategory category() {
        return IssueCategory.INVALID_RESULT;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
