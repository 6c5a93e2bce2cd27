package com.pmagents.core.aggregation;

import com.pmagents.core.model.Deliverable;
import com.pmagents.core.model.DeliverableStatus;

import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Merged deliverables of a run: one deliverable per normalized path, sorted by path.
 *
 * @param deliverables     accepted deliverables
 * @param taskMetrics      worker-reported metrics per task id
 * @param deduplicatedPaths paths produced identically by more than one task
 */
public record AggregatedResult(
    List<Deliverable> deliverables,
    Map<String, Map<String, Double>> taskMetrics,
    List<String> deduplicatedPaths
) {

    public AggregatedResult {
        deliverables = List.copyOf(deliverables);
        taskMetrics = Map.copyOf(taskMetrics);
        deduplicatedPaths = List.copyOf(deduplicatedPaths);
    }

    public static AggregatedResult empty() {
        return new AggregatedResult(List.of(), Map.of(), List.of());
    }

    public long failedDeliverables() {
        return deliverables.stream()
                .filter(d -> d.validationStatus() == DeliverableStatus.FAILED)
                .count();
    }

    /**
     * Values of one metric across all tasks that reported it.
     */
    public List<Double> metricValues(String metric) {
        return taskMetrics.values().stream()
                .map(m -> m.get(metric))
                .filter(v -> v != null)
                .toList();
    }

    public OptionalDouble minMetric(String metric) {
        return metricValues(metric).stream().mapToDouble(Double::doubleValue).min();
    }

    public OptionalDouble maxMetric(String metric) {
        return metricValues(metric).stream().mapToDouble(Double::doubleValue).max();
    }

    public double sumMetric(String metric) {
        return metricValues(metric).stream().mapToDouble(Double::doubleValue).sum();
    }
}
