package com.pmagents.core.qualitygate;

import com.pmagents.core.aggregation.AggregatedResult;
import com.pmagents.core.model.GateOutcome;
import com.pmagents.core.model.GateType;
import com.pmagents.core.model.QualityGate;

/**
 * Evaluates gates of one {@link GateType}.
 */
interface GateEvaluator {

    GateType type();

    GateOutcome evaluate(QualityGate gate, AggregatedResult result);

    static GateOutcome outcome(QualityGate gate, boolean passed, double observed, String detail) {
        return new GateOutcome(gate.name(), gate.type(), passed, gate.blocking(), observed, gate.threshold(), detail);
    }
}
