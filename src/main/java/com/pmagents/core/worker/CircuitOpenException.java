package com.pmagents.core.worker;

import com.pmagents.core.error.OrchestrationException;
import com.pmagents.core.model.IssueCategory;

/**
 * The circuit breaker for a capability is open; the worker was not contacted.
 */
public class CircuitOpenException extends OrchestrationException {

    private final String capability;

    public CircuitOpenException(String taskId, String capability) {
        super(taskId, "Circuit open for capability '" + capability + "', task " + taskId + " not dispatched");
        this.capability = capability;
    }

    public String capability() {
        return capability;
    }

    @Override
    public IssueCategory category() {
        return IssueCategory.CIRCUIT_OPEN;
    }
}
