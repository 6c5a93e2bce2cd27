package com.pmagents.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Inbound request from the caller (the planning tier) to execute a task graph.
 *
 * @param tasks          tasks forming the graph
 * @param contextData    context forwarded to every worker call
 * @param qualityGates   gates evaluated over the aggregated deliverables
 * @param resourceBudget overall run budget (nullable for the configured default)
 * @param options        per-run configuration overrides (nullable)
 */
public record ExecuteRequest(
    List<Task> tasks,
    Map<String, Object> contextData,
    List<QualityGate> qualityGates,
    Duration resourceBudget,
    ExecutionOptions options
) implements Serializable {

    public ExecuteRequest {
        tasks = tasks != null ? List.copyOf(tasks) : List.of();
        contextData = contextData != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(contextData))
                : Map.of();
        qualityGates = qualityGates != null ? List.copyOf(qualityGates) : List.of();
        options = options != null ? options : ExecutionOptions.defaults();
    }

    public static ExecuteRequest of(List<Task> tasks, List<QualityGate> gates) {
        return new ExecuteRequest(tasks, Map.of(), gates, null, null);
    }
}
