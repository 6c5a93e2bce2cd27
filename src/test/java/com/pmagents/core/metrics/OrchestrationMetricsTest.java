package com.pmagents.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class OrchestrationMetricsTest {

    private SimpleMeterRegistry registry;
    private OrchestrationMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new OrchestrationMetrics(registry);
    }

    @Test
    @DisplayName("worker attempts are counted by capability and outcome")
    void workerAttempts() {
        metrics.recordWorkerAttempt("code-generator", "timeout");
        metrics.recordWorkerAttempt("code-generator", "timeout");
        metrics.recordWorkerAttempt("code-generator", "success");

        assertEquals(2.0, registry.find("pmagents.worker.attempts")
                .tag("capability", "code-generator").tag("outcome", "timeout").counter().count());
        assertEquals(1.0, registry.find("pmagents.worker.attempts")
                .tag("outcome", "success").counter().count());
    }

    @Test
    @DisplayName("task duration is timed per capability")
    void taskDuration() {
        metrics.recordTaskExecution("doc-generator", 1500);

        var timer = registry.find("pmagents.task.duration").tag("capability", "doc-generator").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
        assertEquals(1500.0, timer.totalTime(TimeUnit.MILLISECONDS));
    }

    @Test
    @DisplayName("level executions record the level size")
    void levels() {
        metrics.recordLevelExecution(3);
        metrics.recordLevelExecution(1);

        assertEquals(2.0, registry.find("pmagents.level.executions").counter().count());
        assertEquals(4.0, registry.find("pmagents.level.task_count").summary().totalAmount());
    }

    @Test
    @DisplayName("merge conflicts add the number of conflicting paths")
    void mergeConflicts() {
        metrics.recordMergeConflicts(2);

        assertEquals(2.0, registry.find("pmagents.aggregation.merge_conflicts").counter().count());
    }

    @Test
    @DisplayName("circuit transitions, escalations and outcomes are tagged")
    void tagged() {
        metrics.recordCircuitTransition("lint", "OPEN");
        metrics.incrementEscalations("RESOURCE_EXHAUSTED");
        metrics.recordTaskOutcome("lint", "skipped");
        metrics.recordExecutionResult("PARTIAL", 2000);

        assertEquals(1.0, registry.find("pmagents.circuit.transitions").tag("state", "OPEN").counter().count());
        assertEquals(1.0, registry.find("pmagents.escalations.total")
                .tag("category", "RESOURCE_EXHAUSTED").counter().count());
        assertEquals(1.0, registry.find("pmagents.task.outcomes").tag("status", "skipped").counter().count());
        assertEquals(1.0, registry.find("pmagents.executions.total").tag("status", "PARTIAL").counter().count());
        assertEquals(1, registry.find("pmagents.execution.duration").timer().count());
    }
}
