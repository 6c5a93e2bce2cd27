package com.pmagents.core.escalation;

import com.pmagents.core.error.OrchestrationException;
import com.pmagents.core.model.IssueCategory;
import com.pmagents.core.model.IssueSeverity;
import com.pmagents.core.model.RecoveryAction;
import com.pmagents.core.model.Task;
import com.pmagents.core.model.TaskPriority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;

/**
 * Maps failures to recovery actions.
 * <p>
 * Transient worker errors are retried while attempts remain. Once exhausted the task
 * is skipped (its dependents are skipped, unrelated branches continue) unless it is
 * {@link TaskPriority#CRITICAL}, in which case the run is escalated to the caller.
 * Structural errors (merge conflicts, graph errors, budget exhaustion) always escalate.
 */
@Service
public class EscalationPolicy {

    private static final Logger log = LoggerFactory.getLogger(EscalationPolicy.class);

    private final Map<IssueCategory, RecoveryAction> baseActions = new EnumMap<>(IssueCategory.class);

    public EscalationPolicy() {
        baseActions.put(IssueCategory.TIMEOUT, RecoveryAction.RETRY);
        baseActions.put(IssueCategory.INVALID_RESULT, RecoveryAction.RETRY);
        baseActions.put(IssueCategory.WORKER_FAILURE, RecoveryAction.RETRY);
        baseActions.put(IssueCategory.CIRCUIT_OPEN, RecoveryAction.SKIP);
        baseActions.put(IssueCategory.DEPENDENCY, RecoveryAction.SKIP);
        baseActions.put(IssueCategory.VALIDATION_GATE, RecoveryAction.SKIP);
        baseActions.put(IssueCategory.MERGE_CONFLICT, RecoveryAction.ESCALATE);
        baseActions.put(IssueCategory.RESOURCE_EXHAUSTED, RecoveryAction.ESCALATE);
        baseActions.put(IssueCategory.GRAPH_INVALID, RecoveryAction.ESCALATE);
        baseActions.put(IssueCategory.CONFIGURATION, RecoveryAction.ESCALATE);
    }

    /**
     * Classify a failure of {@code task} on its {@code attempt}-th attempt.
     *
     * @param error       the failure
     * @param task        the failing task (nullable for run-level failures)
     * @param attempt     1-based attempt that failed
     * @param maxAttempts attempt budget for the task
     */
    public EscalationDecision classify(Throwable error, Task task, int attempt, int maxAttempts) {
        IssueCategory category = categoryOf(error);
        RecoveryAction action = baseActions.getOrDefault(category, RecoveryAction.ESCALATE);
        if (!(error instanceof OrchestrationException)) {
            action = RecoveryAction.ESCALATE;
        }

        boolean critical = task != null && task.priority() == TaskPriority.CRITICAL;
        if (action == RecoveryAction.RETRY && attempt >= maxAttempts) {
            action = critical ? RecoveryAction.ESCALATE : RecoveryAction.SKIP;
            log.debug("Retries exhausted ({}/{}) for task {} -> {}", attempt, maxAttempts,
                    task != null ? task.id() : null, action);
        } else if (action == RecoveryAction.SKIP && critical) {
            action = RecoveryAction.ESCALATE;
        }

        String reason = describe(error, attempt, action);
        return new EscalationDecision(action, category, severityOf(action, category), reason);
    }

    /**
     * Classify a terminal failure with no retry budget left.
     */
    public EscalationDecision classify(Throwable error, Task task) {
        return classify(error, task, 1, 1);
    }

    private IssueCategory categoryOf(Throwable error) {
        if (error instanceof OrchestrationException oe) {
            return oe.category();
        }
        return IssueCategory.WORKER_FAILURE;
    }

    private IssueSeverity severityOf(RecoveryAction action, IssueCategory category) {
        return switch (action) {
            case ESCALATE -> IssueSeverity.CRITICAL;
            case SKIP -> category == IssueCategory.DEPENDENCY ? IssueSeverity.WARNING : IssueSeverity.ERROR;
            case RETRY -> IssueSeverity.INFO;
        };
    }

    private String describe(Throwable error, int attempt, RecoveryAction action) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        if (action == RecoveryAction.RETRY) {
            return message + " (attempt " + attempt + ")";
        }
        return attempt > 1 ? message + " (after " + attempt + " attempts)" : message;
    }
}
