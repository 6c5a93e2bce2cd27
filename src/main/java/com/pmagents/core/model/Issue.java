package com.pmagents.core.model;

import java.io.Serializable;

/**
 * An itemized problem recorded during a run.
 *
 * @param taskId      originating task (nullable for run-level issues)
 * @param category    failure category
 * @param severity    severity
 * @param description human-readable detail
 * @param resolution  recovery action chosen (nullable for informational issues)
 */
public record Issue(
    String taskId,
    IssueCategory category,
    IssueSeverity severity,
    String description,
    RecoveryAction resolution
) implements Serializable {

    public static Issue warning(IssueCategory category, String description) {
        return new Issue(null, category, IssueSeverity.WARNING, description, null);
    }

    public boolean isEscalation() {
        return resolution == RecoveryAction.ESCALATE;
    }
}
