package com.pmagents.core.escalation;

import com.pmagents.core.model.Issue;
import com.pmagents.core.model.IssueCategory;
import com.pmagents.core.model.IssueSeverity;
import com.pmagents.core.model.RecoveryAction;

/**
 * Typed outcome of {@link EscalationPolicy#classify}.
 *
 * @param action   recovery action to apply
 * @param category failure category
 * @param severity issue severity
 * @param reason   human-readable reason
 */
public record EscalationDecision(
    RecoveryAction action,
    IssueCategory category,
    IssueSeverity severity,
    String reason
) {

    public Issue toIssue(String taskId) {
        return new Issue(taskId, category, severity, reason, action);
    }

    public boolean isRetry() {
        return action == RecoveryAction.RETRY;
    }

    public boolean isEscalation() {
        return action == RecoveryAction.ESCALATE;
    }
}
