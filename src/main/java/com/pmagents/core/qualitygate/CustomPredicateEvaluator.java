package com.pmagents.core.qualitygate;

import com.pmagents.core.aggregation.AggregatedResult;
import com.pmagents.core.model.GateOutcome;
import com.pmagents.core.model.GateType;
import com.pmagents.core.model.QualityGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Delegates to the {@link GatePredicate} named by the gate's metric. An unknown predicate fails.
 */
class CustomPredicateEvaluator implements GateEvaluator {

    private static final Logger log = LoggerFactory.getLogger(CustomPredicateEvaluator.class);

    private final Map<String, GatePredicate> predicates;

    CustomPredicateEvaluator(Map<String, GatePredicate> predicates) {
        this.predicates = predicates;
    }

    @Override
    public GateType type() {
        return GateType.CUSTOM_PREDICATE;
    }

    @Override
    public GateOutcome evaluate(QualityGate gate, AggregatedResult result) {
        var predicate = predicates.get(gate.metric());
        if (predicate == null) {
            return GateEvaluator.outcome(gate, false, Double.NaN, "unknown predicate '" + gate.metric() + "'");
        }
        try {
            boolean passed = predicate.test(result, gate.threshold());
            return GateEvaluator.outcome(gate, passed, passed ? 1.0 : 0.0,
                    "predicate '" + gate.metric() + "' " + (passed ? "held" : "did not hold"));
        } catch (RuntimeException e) {
            log.warn("Predicate '{}' threw: {}", gate.metric(), e.getMessage(), e);
            return GateEvaluator.outcome(gate, false, Double.NaN,
                    "predicate '" + gate.metric() + "' threw " + e.getClass().getSimpleName());
        }
    }
}
