package com.pmagents.core.scheduler;

import com.pmagents.core.graph.TaskGraph;
import com.pmagents.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Owns the status of every task in a run and enforces the task state machine:
 * <pre>
 *   PENDING -> RUNNING -> COMPLETED | FAILED
 *   PENDING -> SKIPPED
 * </pre>
 * {@code FAILED -> RUNNING} and {@code SKIPPED -> PENDING} are only legal after an explicit
 * {@link #reopen(String)} from the retry-failed-tasks path.
 */
public class TaskStateTracker {

    private static final Logger log = LoggerFactory.getLogger(TaskStateTracker.class);

    private final Map<String, TaskStatus> statuses = new TreeMap<>();
    private final Set<String> reopened = new HashSet<>();

    public TaskStateTracker(TaskGraph graph) {
        for (var id : graph.taskIds()) {
            statuses.put(id, TaskStatus.PENDING);
        }
    }

    public synchronized TaskStatus statusOf(String taskId) {
        var status = statuses.get(taskId);
        if (status == null) {
            throw new IllegalArgumentException("Unknown task: " + taskId);
        }
        return status;
    }

    public synchronized void markRunning(String taskId) {
        var current = statusOf(taskId);
        if (current == TaskStatus.PENDING || (current == TaskStatus.FAILED && reopened.remove(taskId))) {
            set(taskId, TaskStatus.RUNNING);
            return;
        }
        throw illegal(taskId, current, TaskStatus.RUNNING);
    }

    public synchronized void markCompleted(String taskId) {
        requireCurrent(taskId, TaskStatus.RUNNING, TaskStatus.COMPLETED);
        set(taskId, TaskStatus.COMPLETED);
    }

    public synchronized void markFailed(String taskId) {
        requireCurrent(taskId, TaskStatus.RUNNING, TaskStatus.FAILED);
        set(taskId, TaskStatus.FAILED);
    }

    public synchronized void markSkipped(String taskId) {
        requireCurrent(taskId, TaskStatus.PENDING, TaskStatus.SKIPPED);
        set(taskId, TaskStatus.SKIPPED);
    }

    /**
     * Re-open a failed or skipped task for an externally triggered retry. A failed task may
     * then move to RUNNING once; a skipped task returns to PENDING.
     */
    public synchronized void reopen(String taskId) {
        var current = statusOf(taskId);
        switch (current) {
            case FAILED -> reopened.add(taskId);
            case SKIPPED -> set(taskId, TaskStatus.PENDING);
            default -> throw new IllegalStateException(
                    "Task " + taskId + " is " + current + " and cannot be reopened");
        }
        log.info("Task {} reopened for retry (was {})", taskId, current);
    }

    /**
     * Abort-path transition: a running task fails, a pending one is skipped, a terminal one
     * keeps its status.
     *
     * @return the status after the call
     */
    public synchronized TaskStatus abandon(String taskId) {
        var current = statusOf(taskId);
        if (current == TaskStatus.RUNNING) {
            set(taskId, TaskStatus.FAILED);
        } else if (current == TaskStatus.PENDING) {
            set(taskId, TaskStatus.SKIPPED);
        } else if (current == TaskStatus.FAILED && reopened.remove(taskId)) {
            log.debug("Task {} reopened but abandoned before dispatch", taskId);
        }
        return statusOf(taskId);
    }

    /**
     * True if the task may be dispatched: pending, or failed and reopened.
     */
    public synchronized boolean isDispatchable(String taskId) {
        var current = statusOf(taskId);
        return current == TaskStatus.PENDING || (current == TaskStatus.FAILED && reopened.contains(taskId));
    }

    public synchronized Map<String, TaskStatus> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(statuses));
    }

    public synchronized List<String> idsWithStatus(TaskStatus status) {
        return statuses.entrySet().stream()
                .filter(e -> e.getValue() == status)
                .map(Map.Entry::getKey)
                .toList();
    }

    public synchronized int count(TaskStatus status) {
        return (int) statuses.values().stream().filter(s -> s == status).count();
    }

    private void requireCurrent(String taskId, TaskStatus expected, TaskStatus next) {
        var current = statusOf(taskId);
        if (current != expected) {
            throw illegal(taskId, current, next);
        }
    }

    private void set(String taskId, TaskStatus next) {
        var previous = statuses.put(taskId, next);
        log.debug("Task {} {} -> {}", taskId, previous, next);
    }

    private IllegalStateException illegal(String taskId, TaskStatus from, TaskStatus to) {
        return new IllegalStateException("Illegal transition for task " + taskId + ": " + from + " -> " + to);
    }
}
