package com.pmagents.core.model;

import java.io.Serializable;

/**
 * A quality gate evaluated over the aggregated deliverables of a run.
 *
 * @param name      gate name used in reports
 * @param type      gate type
 * @param threshold pass threshold, interpreted per type
 * @param blocking  whether failure forces the run to fail
 * @param metric    metric key; defaults to the type's metric, or the predicate name for custom gates
 */
public record QualityGate(
    String name,
    GateType type,
    double threshold,
    boolean blocking,
    String metric
) implements Serializable {

    public QualityGate {
        if (type == null) {
            throw new IllegalArgumentException("Quality gate type is required");
        }
        if (metric == null || metric.isBlank()) {
            metric = type.defaultMetric() != null ? type.defaultMetric() : name;
        }
        if (name == null || name.isBlank()) {
            name = type.name().toLowerCase().replace('_', '-') + ":" + metric;
        }
    }

    public static QualityGate blocking(GateType type, double threshold) {
        return new QualityGate(null, type, threshold, true, null);
    }

    public static QualityGate advisory(GateType type, double threshold) {
        return new QualityGate(null, type, threshold, false, null);
    }
}
