package com.pmagents.core.engine;

import com.pmagents.core.config.ExecutionSettings;
import com.pmagents.core.graph.TaskGraph;
import com.pmagents.core.model.ExecuteRequest;
import com.pmagents.core.model.ExecuteResponse;
import com.pmagents.core.model.ProgressUpdate;
import com.pmagents.core.model.TaskResult;
import com.pmagents.core.progress.ProgressMonitor;
import com.pmagents.core.scheduler.RunDeadline;
import com.pmagents.core.scheduler.TaskStateTracker;

import java.time.Instant;
import java.util.Map;

/**
 * Registry entry for one execution: the validated graph, the state of its latest run and,
 * once finished, its response.
 */
class Execution {

    private final String id;
    private final ExecuteRequest request;
    private final TaskGraph graph;
    private final ExecutionSettings settings;
    private final TaskStateTracker states;
    private final Instant createdAt;

    private volatile ProgressMonitor monitor;
    private volatile RunDeadline deadline;
    private volatile ExecuteResponse response;
    private volatile Map<String, TaskResult> completedResults = Map.of();
    private volatile boolean running;

    Execution(String id, ExecuteRequest request, TaskGraph graph, ExecutionSettings settings, Instant createdAt) {
        this.id = id;
        this.request = request;
        this.graph = graph;
        this.settings = settings;
        this.states = new TaskStateTracker(graph);
        this.createdAt = createdAt;
    }

    String id() { return id; }
    ExecuteRequest request() { return request; }
    TaskGraph graph() { return graph; }
    ExecutionSettings settings() { return settings; }
    TaskStateTracker states() { return states; }
    Instant createdAt() { return createdAt; }

    ProgressMonitor monitor() { return monitor; }
    RunDeadline deadline() { return deadline; }
    ExecuteResponse response() { return response; }
    Map<String, TaskResult> completedResults() { return completedResults; }
    boolean isRunning() { return running; }

    /**
     * Starts a run. Clears the previous response until the run finishes.
     */
    synchronized void begin(ProgressMonitor monitor, RunDeadline deadline) {
        if (running) {
            throw new IllegalStateException("Execution " + id + " is already running");
        }
        this.monitor = monitor;
        this.deadline = deadline;
        this.response = null;
        this.running = true;
    }

    synchronized void finish(ExecuteResponse response, Map<String, TaskResult> completedResults) {
        this.response = response;
        this.completedResults = Map.copyOf(completedResults);
        this.running = false;
    }

    /**
     * Latest progress, or {@code null} if no run has started yet.
     */
    ProgressUpdate progress() {
        var current = monitor;
        return current != null ? current.snapshot() : null;
    }

    boolean cancel(String reason) {
        var current = deadline;
        if (current == null || !running) {
            return false;
        }
        current.cancel(reason);
        return true;
    }
}
