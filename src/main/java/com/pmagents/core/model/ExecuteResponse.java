package com.pmagents.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Final response of a graph execution. A failed run still carries everything that was produced.
 */
public record ExecuteResponse(
    String executionId,
    ExecutionStatus status,
    List<String> completedTaskIds,
    List<String> failedTaskIds,
    List<String> skippedTaskIds,
    List<Deliverable> deliverables,
    List<GateOutcome> validationResults,
    List<Issue> issues,
    ResourceUsage resourceUsage,
    List<List<String>> levels
) implements Serializable {

    public List<Issue> escalations() {
        return issues.stream().filter(Issue::isEscalation).toList();
    }
}
