package com.pmagents.core.qualitygate;

import com.pmagents.core.aggregation.AggregatedResult;
import com.pmagents.core.metrics.OrchestrationMetrics;
import com.pmagents.core.model.GateOutcome;
import com.pmagents.core.model.GateType;
import com.pmagents.core.model.Issue;
import com.pmagents.core.model.IssueCategory;
import com.pmagents.core.model.QualityGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates quality gates over the aggregated deliverables of a run.
 * <p>
 * Gates are independent of each other. Overall success requires every blocking gate to
 * pass; a failing non-blocking gate is reported as a warning. Several gates on the same
 * type and metric are merged: the most restrictive threshold applies, the merged gate is
 * blocking if any of them is, and a {@code CONFIGURATION} warning is recorded.
 */
@Service
public class ValidationPipeline {

    private static final Logger log = LoggerFactory.getLogger(ValidationPipeline.class);

    private final Map<GateType, GateEvaluator> evaluators = new EnumMap<>(GateType.class);
    private final OrchestrationMetrics metrics;

    @Autowired
    public ValidationPipeline(@Autowired(required = false) List<GatePredicate> predicates,
                              @Autowired(required = false) OrchestrationMetrics metrics) {
        this.metrics = metrics;
        var byName = new LinkedHashMap<String, GatePredicate>();
        if (predicates != null) {
            predicates.forEach(p -> byName.put(p.name(), p));
        }
        register(new ZeroErrorsEvaluator());
        register(new CoverageEvaluator());
        register(new SecuritySeverityEvaluator());
        register(new CustomPredicateEvaluator(byName));
    }

    public ValidationPipeline() {
        this(List.of(), null);
    }

    public ValidationReport evaluate(AggregatedResult result, List<QualityGate> gates) {
        if (gates == null || gates.isEmpty()) {
            return ValidationReport.empty();
        }
        var warnings = new ArrayList<Issue>();
        var effective = mergeDuplicates(gates, warnings);

        var outcomes = new ArrayList<GateOutcome>();
        for (var gate : effective) {
            var outcome = evaluators.get(gate.type()).evaluate(gate, result);
            outcomes.add(outcome);
            if (metrics != null) {
                metrics.recordGateResult(gate.type().name(), outcome.passed());
            }
            if (outcome.passed()) {
                log.info("Gate '{}' passed: {}", gate.name(), outcome.detail());
            } else if (outcome.blocking()) {
                log.warn("Blocking gate '{}' failed: {}", gate.name(), outcome.detail());
            } else {
                log.warn("Advisory gate '{}' failed: {}", gate.name(), outcome.detail());
            }
        }
        return new ValidationReport(outcomes, warnings);
    }

    private void register(GateEvaluator evaluator) {
        evaluators.put(evaluator.type(), evaluator);
    }

    private List<QualityGate> mergeDuplicates(List<QualityGate> gates, List<Issue> warnings) {
        var grouped = new LinkedHashMap<String, List<QualityGate>>();
        for (var gate : gates) {
            grouped.computeIfAbsent(gate.type() + "/" + gate.metric(), k -> new ArrayList<>()).add(gate);
        }

        var merged = new ArrayList<QualityGate>();
        for (var group : grouped.values()) {
            var first = group.get(0);
            if (group.size() == 1) {
                merged.add(first);
                continue;
            }
            double threshold = first.threshold();
            boolean blocking = false;
            for (var gate : group) {
                threshold = first.type().higherIsStricter()
                        ? Math.max(threshold, gate.threshold())
                        : Math.min(threshold, gate.threshold());
                blocking |= gate.blocking();
            }
            var gate = new QualityGate(first.name(), first.type(), threshold, blocking, first.metric());
            warnings.add(Issue.warning(IssueCategory.CONFIGURATION,
                    "%d gates on %s/%s; using threshold %s%s".formatted(group.size(), first.type(), first.metric(),
                            ZeroErrorsEvaluator.fmt(threshold), blocking ? " (blocking)" : "")));
            log.warn("Merged {} duplicate gates on {}/{} into threshold {}", group.size(), first.type(),
                    first.metric(), threshold);
            merged.add(gate);
        }
        return merged;
    }
}
