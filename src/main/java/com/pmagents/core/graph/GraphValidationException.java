package com.pmagents.core.graph;

import com.pmagents.core.error.OrchestrationException;
import com.pmagents.core.model.IssueCategory;

/**
 * The submitted task set does not form a valid graph. Fatal, never retried.
 */
public class GraphValidationException extends OrchestrationException {

    public GraphValidationException(String taskId, String message) {
        super(taskId, message);
    }

    @Override
    public IssueCategory category() {
        return IssueCategory.GRAPH_INVALID;
    }
}
