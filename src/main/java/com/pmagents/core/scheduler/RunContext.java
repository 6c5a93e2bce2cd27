package com.pmagents.core.scheduler;

import com.pmagents.core.config.ExecutionSettings;
import com.pmagents.core.graph.TaskGraph;
import com.pmagents.core.model.TaskResult;
import com.pmagents.core.progress.ProgressMonitor;
import com.pmagents.core.worker.WorkerPool;

import java.util.Map;

/**
 * Everything {@link LevelScheduler} needs for one run. The pool, monitor, deadline and
 * state tracker are owned by the run and discarded with it.
 *
 * @param priorResults results of tasks completed by an earlier run of the same graph, reused
 *                     on the retry-failed-tasks path
 */
public record RunContext(
    String executionId,
    TaskGraph graph,
    Map<String, Object> context,
    ExecutionSettings settings,
    WorkerPool pool,
    ProgressMonitor monitor,
    RunDeadline deadline,
    TaskStateTracker states,
    Map<String, TaskResult> priorResults
) {

    public RunContext {
        context = context != null ? context : Map.of();
        priorResults = priorResults != null ? priorResults : Map.of();
    }
}
