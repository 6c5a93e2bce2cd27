package com.pmagents.core.scheduler;

import com.pmagents.core.model.Issue;
import com.pmagents.core.model.TaskResult;
import com.pmagents.core.model.TaskStatus;

import java.util.List;
import java.util.Map;

/**
 * Outcome of scheduling one graph: final task statuses, the results of completed tasks
 * and every issue raised along the way.
 *
 * @param taskStatuses         final status per task id
 * @param taskResults          worker results of completed tasks, by task id
 * @param issues               issues in the order they were recorded
 * @param aborted              whether the run budget expired or the run was cancelled
 * @param escalated            whether a failure required the caller's decision
 * @param attemptsByCapability worker calls per capability
 */
public record ExecutionResult(
    Map<String, TaskStatus> taskStatuses,
    Map<String, TaskResult> taskResults,
    List<Issue> issues,
    boolean aborted,
    boolean escalated,
    Map<String, Integer> attemptsByCapability
) {

    public ExecutionResult {
        taskStatuses = Map.copyOf(taskStatuses);
        taskResults = Map.copyOf(taskResults);
        issues = List.copyOf(issues);
        attemptsByCapability = Map.copyOf(attemptsByCapability);
    }

    public List<String> idsWithStatus(TaskStatus status) {
        return taskStatuses.entrySet().stream()
                .filter(e -> e.getValue() == status)
                .map(Map.Entry::getKey)
                .sorted()
                .toList();
    }

    public int completedCount() {
        return idsWithStatus(TaskStatus.COMPLETED).size();
    }

    public int failedCount() {
        return idsWithStatus(TaskStatus.FAILED).size();
    }

    public int skippedCount() {
        return idsWithStatus(TaskStatus.SKIPPED).size();
    }

    public int totalAttempts() {
        return attemptsByCapability.values().stream().mapToInt(Integer::intValue).sum();
    }
}
