package com.pmagents.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for graph execution.
 */
@Service
public class OrchestrationMetrics {

    private final MeterRegistry registry;

    public OrchestrationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTaskExecution(String capability, long ms) {
        Timer.builder("pmagents.task.duration")
                .tag("capability", capability)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordTaskOutcome(String capability, String status) {
        Counter.builder("pmagents.task.outcomes")
                .tag("capability", capability)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    /**
     * Records one worker call attempt and how it ended.
     *
     * @param outcome "success", "timeout", "invalid", "failure" or "circuit_open"
     */
    public void recordWorkerAttempt(String capability, String outcome) {
        Counter.builder("pmagents.worker.attempts")
                .description("Worker call attempts by capability and outcome")
                .tag("capability", capability)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordCircuitTransition(String capability, String state) {
        Counter.builder("pmagents.circuit.transitions")
                .tag("capability", capability)
                .tag("state", state)
                .register(registry)
                .increment();
    }

    public void recordLevelExecution(int taskCount) {
        Counter.builder("pmagents.level.executions")
                .register(registry)
                .increment();

        DistributionSummary.builder("pmagents.level.task_count")
                .description("Number of tasks per level")
                .register(registry)
                .record(taskCount);
    }

    public void incrementEscalations(String category) {
        Counter.builder("pmagents.escalations.total")
                .tag("category", category)
                .register(registry)
                .increment();
    }

    public void recordMergeConflicts(int conflictingPaths) {
        Counter.builder("pmagents.aggregation.merge_conflicts")
                .description("Artifact paths produced with different content by several tasks")
                .register(registry)
                .increment(conflictingPaths);
    }

    public void recordGateResult(String gateType, boolean passed) {
        Counter.builder("pmagents.gate.evaluations")
                .tag("type", gateType)
                .tag("result", passed ? "passed" : "failed")
                .register(registry)
                .increment();
    }

    public void recordExecutionResult(String status, long ms) {
        Counter.builder("pmagents.executions.total")
                .tag("status", status)
                .register(registry)
                .increment();
        Timer.builder("pmagents.execution.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }
}
