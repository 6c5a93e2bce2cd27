package com.pmagents.core.scheduler;

import com.pmagents.core.error.OrchestrationException;
import com.pmagents.core.model.IssueCategory;

import java.util.List;

/**
 * A task was not attempted because one of its dependencies did not complete.
 */
public class DependencyFailedException extends OrchestrationException {

    private final List<String> failedDependencies;

    public DependencyFailedException(String taskId, List<String> failedDependencies) {
        super(taskId, "dependency failed: " + String.join(", ", failedDependencies));
        this.failedDependencies = List.copyOf(failedDependencies);
    }

    public List<String> failedDependencies() {
        return failedDependencies;
    }

    @Override
    public IssueCategory category() {
        return IssueCategory.DEPENDENCY;
    }
}
