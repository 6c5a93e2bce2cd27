package com.pmagents.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Response returned by a capability worker.
 *
 * @param status           whether the worker considers the attempt successful
 * @param deliverables     artifacts produced
 * @param validationPassed whether the worker's own checks of the validation criteria passed
 * @param errorDetail      failure description (nullable)
 * @param metrics          numeric quality metrics (e.g. "errors", "coverage", "securitySeverity")
 */
public record TaskResult(
    ResultStatus status,
    List<Artifact> deliverables,
    boolean validationPassed,
    String errorDetail,
    Map<String, Double> metrics
) implements Serializable {

    public TaskResult {
        deliverables = deliverables != null ? List.copyOf(deliverables) : List.of();
        metrics = metrics != null ? Map.copyOf(metrics) : Map.of();
    }

    public static TaskResult success(List<Artifact> deliverables) {
        return new TaskResult(ResultStatus.SUCCESS, deliverables, true, null, Map.of());
    }

    public static TaskResult success(List<Artifact> deliverables, Map<String, Double> metrics) {
        return new TaskResult(ResultStatus.SUCCESS, deliverables, true, null, metrics);
    }

    public static TaskResult failure(String errorDetail) {
        return new TaskResult(ResultStatus.FAILURE, List.of(), false, errorDetail, Map.of());
    }

    public boolean isSuccess() {
        return status == ResultStatus.SUCCESS;
    }
}
