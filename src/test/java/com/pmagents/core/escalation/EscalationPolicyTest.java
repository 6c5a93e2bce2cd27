package com.pmagents.core.escalation;

import com.pmagents.core.aggregation.AggregatedResult;
import com.pmagents.core.aggregation.MergeConflictException;
import com.pmagents.core.graph.CycleException;
import com.pmagents.core.model.IssueCategory;
import com.pmagents.core.model.IssueSeverity;
import com.pmagents.core.model.RecoveryAction;
import com.pmagents.core.model.Task;
import com.pmagents.core.model.TaskPriority;
import com.pmagents.core.scheduler.DependencyFailedException;
import com.pmagents.core.scheduler.ResourceExhaustedException;
import com.pmagents.core.worker.CircuitOpenException;
import com.pmagents.core.worker.TaskTimeoutException;
import com.pmagents.core.worker.WorkerFailureException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class EscalationPolicyTest {

    private final EscalationPolicy policy = new EscalationPolicy();
    private final Task normal = Task.of("T-1", "code-generator", Set.of());
    private final Task critical = new Task("T-2", "", "code-generator", Set.of(), TaskPriority.CRITICAL,
            1.0, List.of(), List.of());

    @Test
    @DisplayName("transient failures retry while attempts remain")
    void retryWhileBudgetLeft() {
        var decision = policy.classify(new TaskTimeoutException("T-1", Duration.ofSeconds(5)), normal, 1, 3);

        assertTrue(decision.isRetry());
        assertEquals(IssueCategory.TIMEOUT, decision.category());
        assertEquals(IssueSeverity.INFO, decision.severity());
        assertTrue(decision.reason().endsWith("(attempt 1)"));
    }

    @Test
    @DisplayName("exhausted retries skip a normal task and escalate a critical one")
    void exhausted() {
        var failure = new WorkerFailureException("T-1", "boom");

        var skip = policy.classify(failure, normal, 3, 3);
        assertEquals(RecoveryAction.SKIP, skip.action());
        assertEquals(IssueSeverity.ERROR, skip.severity());
        assertTrue(skip.reason().contains("after 3 attempts"));

        var escalate = policy.classify(failure, critical, 3, 3);
        assertEquals(RecoveryAction.ESCALATE, escalate.action());
        assertEquals(IssueSeverity.CRITICAL, escalate.severity());
    }

    @Test
    @DisplayName("open circuit and failed dependencies skip, escalating for critical tasks")
    void skipCategories() {
        assertEquals(RecoveryAction.SKIP,
                policy.classify(new CircuitOpenException("T-1", "code-generator"), normal).action());

        var dependency = policy.classify(new DependencyFailedException("T-1", List.of("A")), normal);
        assertEquals(RecoveryAction.SKIP, dependency.action());
        assertEquals(IssueSeverity.WARNING, dependency.severity());

        assertEquals(RecoveryAction.ESCALATE,
                policy.classify(new DependencyFailedException("T-2", List.of("A")), critical).action());
    }

    @Test
    @DisplayName("structural failures always escalate")
    void structural() {
        assertEquals(RecoveryAction.ESCALATE,
                policy.classify(new MergeConflictException(List.of(), AggregatedResult.empty()), null).action());
        assertEquals(RecoveryAction.ESCALATE,
                policy.classify(new ResourceExhaustedException(null, "budget"), normal, 1, 3).action());
        assertEquals(RecoveryAction.ESCALATE,
                policy.classify(new CycleException(List.of("A", "B", "A")), null).action());
    }

    @Test
    @DisplayName("unexpected exceptions escalate")
    void unexpected() {
        var decision = policy.classify(new NullPointerException(), normal, 1, 3);

        assertEquals(RecoveryAction.ESCALATE, decision.action());
        assertEquals("NullPointerException", decision.reason());
    }

    @Test
    @DisplayName("decision converts to an issue for the task")
    void toIssue() {
        var issue = policy.classify(new WorkerFailureException("T-1", "boom"), normal).toIssue("T-1");

        assertEquals("T-1", issue.taskId());
        assertEquals(IssueCategory.WORKER_FAILURE, issue.category());
        assertEquals("boom", issue.description());
        assertEquals(RecoveryAction.SKIP, issue.resolution());
    }
}
