package com.pmagents.core.model;

/**
 * Kind of quality gate. Each type has a default metric it reads from worker results.
 */
public enum GateType {
    ZERO_ERRORS("errors"),
    COVERAGE_THRESHOLD("coverage"),
    SECURITY_SEVERITY("securitySeverity"),
    CUSTOM_PREDICATE(null);

    private final String defaultMetric;

    GateType(String defaultMetric) {
        this.defaultMetric = defaultMetric;
    }

    public String defaultMetric() {
        return defaultMetric;
    }

    /**
     * True when a higher threshold is harder to satisfy.
     */
    public boolean higherIsStricter() {
        return this == COVERAGE_THRESHOLD;
    }
}
