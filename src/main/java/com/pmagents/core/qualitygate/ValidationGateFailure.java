package com.pmagents.core.qualitygate;

import com.pmagents.core.error.OrchestrationException;
import com.pmagents.core.model.GateOutcome;
import com.pmagents.core.model.Issue;
import com.pmagents.core.model.IssueCategory;
import com.pmagents.core.model.IssueSeverity;
import com.pmagents.core.model.RecoveryAction;

/**
 * A quality gate did not pass. Recorded as an issue; fails the run only when the gate is blocking.
 */
public class ValidationGateFailure extends OrchestrationException {

    private final GateOutcome outcome;

    public ValidationGateFailure(GateOutcome outcome) {
        super(null, "Quality gate '" + outcome.gateName() + "' failed: " + outcome.detail());
        this.outcome = outcome;
    }

    public GateOutcome outcome() {
        return outcome;
    }

    public Issue toIssue() {
        return outcome.blocking()
                ? new Issue(null, category(), IssueSeverity.ERROR, getMessage(), RecoveryAction.ESCALATE)
                : new Issue(null, category(), IssueSeverity.WARNING, getMessage(), null);
    }

    @Override
    public IssueCategory category() {
        return IssueCategory.VALIDATION_GATE;
    }
}
