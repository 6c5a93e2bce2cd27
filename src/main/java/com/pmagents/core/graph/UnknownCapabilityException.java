package com.pmagents.core.graph;

/**
 * A task requires a capability no worker is registered for.
 */
public class UnknownCapabilityException extends GraphValidationException {

    private final String capability;

    public UnknownCapabilityException(String taskId, String capability) {
        super(taskId, "Task " + taskId + " requires unregistered capability '" + capability + "'");
        this.capability = capability;
    }

    public String capability() {
        return capability;
    }
}
