package com.pmagents.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.util.Map;

/**
 * Per-request overrides of the service defaults. Every field is optional.
 */
public record ExecutionOptions(
    Integer maxWorkersPerCapability,
    Map<String, Integer> capabilityLimits,
    Integer maxRetries,
    Duration initialBackoff,
    Duration maxBackoff,
    Duration taskTimeout,
    Double timeoutMultiplier,
    Duration maxTimeout,
    Integer failureThreshold,
    Duration resetTimeout,
    TaskPriority skipPriorityFloor,
    Duration progressInterval
) implements Serializable {

    public static ExecutionOptions defaults() {
        return new ExecutionOptions(null, null, null, null, null, null, null, null, null, null, null, null);
    }
}
