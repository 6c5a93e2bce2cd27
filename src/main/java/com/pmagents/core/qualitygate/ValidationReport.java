package com.pmagents.core.qualitygate;

import com.pmagents.core.model.GateOutcome;
import com.pmagents.core.model.Issue;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of every evaluated gate plus configuration warnings.
 */
public record ValidationReport(List<GateOutcome> outcomes, List<Issue> configurationWarnings) {

    public ValidationReport {
        outcomes = List.copyOf(outcomes);
        configurationWarnings = List.copyOf(configurationWarnings);
    }

    public static ValidationReport empty() {
        return new ValidationReport(List.of(), List.of());
    }

    /**
     * True when every blocking gate passed.
     */
    public boolean passed() {
        return outcomes.stream().allMatch(o -> o.passed() || !o.blocking());
    }

    public List<GateOutcome> warnings() {
        return outcomes.stream().filter(GateOutcome::isWarning).toList();
    }

    /**
     * Configuration warnings followed by one issue per failed gate.
     */
    public List<Issue> issues() {
        var issues = new ArrayList<Issue>(configurationWarnings);
        outcomes.stream()
                .filter(o -> !o.passed())
                .map(o -> new ValidationGateFailure(o).toIssue())
                .forEach(issues::add);
        return issues;
    }
}
