package com.pmagents.core.qualitygate;

import com.pmagents.core.aggregation.AggregatedResult;
import com.pmagents.core.model.GateOutcome;
import com.pmagents.core.model.GateType;
import com.pmagents.core.model.QualityGate;

import static com.pmagents.core.qualitygate.ZeroErrorsEvaluator.fmt;

/**
 * The lowest coverage reported by any task must reach the threshold. No report fails.
 */
class CoverageEvaluator implements GateEvaluator {

    @Override
    public GateType type() {
        return GateType.COVERAGE_THRESHOLD;
    }

    @Override
    public GateOutcome evaluate(QualityGate gate, AggregatedResult result) {
        var min = result.minMetric(gate.metric());
        if (min.isEmpty()) {
            return GateEvaluator.outcome(gate, false, Double.NaN, "no " + gate.metric() + " reported");
        }
        double observed = min.getAsDouble();
        return GateEvaluator.outcome(gate, observed >= gate.threshold(), observed,
                "min %s=%s (required %s)".formatted(gate.metric(), fmt(observed), fmt(gate.threshold())));
    }
}
