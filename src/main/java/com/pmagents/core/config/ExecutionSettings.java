package com.pmagents.core.config;

import com.pmagents.core.model.ExecutionOptions;
import com.pmagents.core.model.TaskPriority;
import com.pmagents.core.worker.RetryPolicy;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable configuration of one run: service defaults merged with request overrides.
 */
public record ExecutionSettings(
    int maxWorkersPerCapability,
    Map<String, Integer> capabilityLimits,
    RetryPolicy retryPolicy,
    Duration taskTimeout,
    int failureThreshold,
    Duration resetTimeout,
    TaskPriority skipPriorityFloor,
    Duration progressInterval,
    Duration costUnit,
    Duration budget
) {

    public ExecutionSettings {
        if (maxWorkersPerCapability < 1) {
            throw new IllegalArgumentException("maxWorkersPerCapability must be at least 1");
        }
        capabilityLimits = capabilityLimits != null ? Map.copyOf(capabilityLimits) : Map.of();
    }

    /**
     * Merge request options over the configured defaults.
     *
     * @param budget run budget from the request, or {@code null} for the configured default
     */
    public static ExecutionSettings resolve(OrchestratorProperties props, ExecutionOptions options, Duration budget) {
        var o = options != null ? options : ExecutionOptions.defaults();
        var retry = props.getRetry();

        var limits = new LinkedHashMap<>(props.getPool().getCapabilityLimits());
        if (o.capabilityLimits() != null) {
            limits.putAll(o.capabilityLimits());
        }

        var retryPolicy = new RetryPolicy(
                pick(o.maxRetries(), retry.getMaxRetries()),
                pick(o.initialBackoff(), retry.getInitialBackoff()),
                pick(o.maxBackoff(), retry.getMaxBackoff()),
                pick(o.timeoutMultiplier(), retry.getTimeoutMultiplier()),
                pick(o.maxTimeout(), retry.getMaxTimeout()));

        return new ExecutionSettings(
                pick(o.maxWorkersPerCapability(), props.getMaxPerCapability()),
                limits,
                retryPolicy,
                pick(o.taskTimeout(), retry.getTaskTimeout()),
                pick(o.failureThreshold(), props.getFailureThreshold()),
                pick(o.resetTimeout(), props.getResetTimeout()),
                pick(o.skipPriorityFloor(), props.getRun().getSkipPriorityFloor()),
                pick(o.progressInterval(), props.getProgressInterval()),
                props.getRun().getCostUnit(),
                pick(budget, props.getDefaultBudget()));
    }

    public static ExecutionSettings defaults() {
        return resolve(new OrchestratorProperties(), null, null);
    }

    /**
     * Maximum concurrent calls for a capability.
     */
    public int limitFor(String capability) {
        var limit = capabilityLimits.get(capability);
        return limit != null && limit > 0 ? limit : maxWorkersPerCapability;
    }

    private static <T> T pick(T override, T fallback) {
        return override != null ? override : fallback;
    }
}
