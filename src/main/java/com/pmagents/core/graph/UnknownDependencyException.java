package com.pmagents.core.graph;

/**
 * A task depends on an id that is not part of the graph.
 */
public class UnknownDependencyException extends GraphValidationException {

    private final String missingId;

    public UnknownDependencyException(String taskId, String missingId) {
        super(taskId, "Task " + taskId + " depends on unknown task " + missingId);
        this.missingId = missingId;
    }

    public String missingId() {
        return missingId;
    }
}
