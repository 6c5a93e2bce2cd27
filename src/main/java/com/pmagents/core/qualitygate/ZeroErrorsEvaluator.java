package com.pmagents.core.qualitygate;

import com.pmagents.core.aggregation.AggregatedResult;
import com.pmagents.core.model.GateOutcome;
import com.pmagents.core.model.GateType;
import com.pmagents.core.model.QualityGate;

/**
 * Reported errors across all tasks, plus deliverables that failed validation, must not
 * exceed the threshold.
 */
class ZeroErrorsEvaluator implements GateEvaluator {

    @Override
    public GateType type() {
        return GateType.ZERO_ERRORS;
    }

    @Override
    public GateOutcome evaluate(QualityGate gate, AggregatedResult result) {
        double reported = result.sumMetric(gate.metric());
        long failedDeliverables = result.failedDeliverables();
        double observed = reported + failedDeliverables;
        boolean passed = observed <= gate.threshold();
        return GateEvaluator.outcome(gate, passed, observed,
                "%s=%s, failed deliverables=%d (max %s)".formatted(
                        gate.metric(), fmt(reported), failedDeliverables, fmt(gate.threshold())));
    }

    static String fmt(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }
}
