package com.pmagents.core.qualitygate;

import com.pmagents.core.aggregation.AggregatedResult;
import com.pmagents.core.model.GateOutcome;
import com.pmagents.core.model.GateType;
import com.pmagents.core.model.QualityGate;

import static com.pmagents.core.qualitygate.ZeroErrorsEvaluator.fmt;

/**
 * The highest security severity reported by any task must not exceed the threshold.
 * No report counts as severity 0.
 */
class SecuritySeverityEvaluator implements GateEvaluator {

    @Override
    public GateType type() {
        return GateType.SECURITY_SEVERITY;
    }

    @Override
    public GateOutcome evaluate(QualityGate gate, AggregatedResult result) {
        double observed = result.maxMetric(gate.metric()).orElse(0.0);
        return GateEvaluator.outcome(gate, observed <= gate.threshold(), observed,
                "max %s=%s (allowed %s)".formatted(gate.metric(), fmt(observed), fmt(gate.threshold())));
    }
}
