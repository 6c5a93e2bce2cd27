package com.pmagents.core.progress;

import com.pmagents.core.graph.TaskGraph;
import com.pmagents.core.model.ProgressUpdate;
import com.pmagents.core.model.TaskResult;
import com.pmagents.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Tracks task timing for one run: completion percentage, remaining-time estimate and
 * tasks that overran their estimate.
 *
 * <p>Estimated cost units are converted to wall-clock time with {@code costUnit}. The
 * estimate of remaining time scales the remaining estimated cost by the mean
 * actual/estimated ratio of completed tasks; until a task completes the ratio is 1.
 */
public class ProgressMonitor {

    private static final Logger log = LoggerFactory.getLogger(ProgressMonitor.class);
    private static final double ANOMALY_FACTOR = 2.0;

    private final TaskGraph graph;
    private final Clock clock;
    private final Duration costUnit;

    private final Map<String, TaskStatus> statuses = new HashMap<>();
    private final Map<String, Instant> startedAt = new HashMap<>();
    private final List<Double> ratios = new ArrayList<>();
    private final List<ProgressAnomaly> anomalies = new ArrayList<>();

    public ProgressMonitor(TaskGraph graph, Clock clock, Duration costUnit) {
        this(graph, clock, costUnit, Map.of());
    }

    /**
     * Monitor resuming from earlier task statuses, as on the retry-failed-tasks path.
     */
    public ProgressMonitor(TaskGraph graph, Clock clock, Duration costUnit, Map<String, TaskStatus> initial) {
        this.graph = graph;
        this.clock = clock;
        this.costUnit = costUnit;
        for (var id : graph.taskIds()) {
            statuses.put(id, initial.getOrDefault(id, TaskStatus.PENDING));
        }
    }

    public synchronized void onStart(String taskId) {
        statuses.put(taskId, TaskStatus.RUNNING);
        startedAt.put(taskId, clock.instant());
    }

    public synchronized void onComplete(String taskId, TaskResult result) {
        statuses.put(taskId, TaskStatus.COMPLETED);
        var start = startedAt.get(taskId);
        if (start == null) {
            return;
        }
        var actual = Duration.between(start, clock.instant());
        var expected = expectedDuration(taskId);
        if (expected.isZero()) {
            return;
        }
        ratios.add((double) actual.toMillis() / expected.toMillis());
        if (actual.toMillis() > expected.toMillis() * ANOMALY_FACTOR) {
            var anomaly = new ProgressAnomaly(taskId, expected, actual);
            anomalies.add(anomaly);
            log.info("Progress anomaly: {}", anomaly.describe());
        }
    }

    public synchronized void onFail(String taskId, Throwable error) {
        statuses.put(taskId, TaskStatus.FAILED);
        log.debug("Task {} failed: {}", taskId, error != null ? error.getMessage() : "unknown");
    }

    public synchronized void onSkip(String taskId) {
        statuses.put(taskId, TaskStatus.SKIPPED);
    }

    /**
     * Share of tasks in a terminal state, 0-100. An empty graph is complete.
     */
    public synchronized int progressPercentage() {
        if (statuses.isEmpty()) {
            return 100;
        }
        long terminal = statuses.values().stream().filter(TaskStatus::isTerminal).count();
        return (int) (terminal * 100 / statuses.size());
    }

    public synchronized Duration estimatedCompletion() {
        return estimatedCompletion(graph);
    }

    /**
     * Remaining time: remaining estimated cost of the graph's non-terminal tasks, scaled by
     * the mean actual/estimated ratio observed so far.
     */
    public synchronized Duration estimatedCompletion(TaskGraph graph) {
        double remainingCost = 0;
        for (var task : graph.tasks()) {
            var status = statuses.getOrDefault(task.id(), TaskStatus.PENDING);
            if (!status.isTerminal()) {
                remainingCost += task.estimatedCost();
            }
        }
        double ratio = ratios.isEmpty()
                ? 1.0
                : ratios.stream().mapToDouble(Double::doubleValue).average().orElse(1.0);
        return Duration.ofMillis(Math.round(remainingCost * ratio * costUnit.toMillis()));
    }

    public synchronized List<ProgressAnomaly> anomalies() {
        return List.copyOf(anomalies);
    }

    /**
     * Current progress. A pending task counts as blocked while any of its dependencies
     * has not completed.
     */
    public synchronized ProgressUpdate snapshot() {
        int running = 0;
        int pending = 0;
        int blocked = 0;
        for (var entry : statuses.entrySet()) {
            if (entry.getValue() == TaskStatus.RUNNING) {
                running++;
            } else if (entry.getValue() == TaskStatus.PENDING) {
                pending++;
                boolean waiting = graph.task(entry.getKey()).dependencies().stream()
                        .anyMatch(dep -> statuses.get(dep) != TaskStatus.COMPLETED);
                if (waiting) {
                    blocked++;
                }
            }
        }
        return new ProgressUpdate(progressPercentage(), running, pending, blocked, estimatedCompletion());
    }

    private Duration expectedDuration(String taskId) {
        double cost = graph.task(taskId).estimatedCost();
        return Duration.ofMillis(Math.round(cost * costUnit.toMillis()));
    }
}
