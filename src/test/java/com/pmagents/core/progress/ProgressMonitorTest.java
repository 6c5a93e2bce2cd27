package com.pmagents.core.progress;

import com.pmagents.core.graph.TaskGraph;
import com.pmagents.core.model.Task;
import com.pmagents.core.model.TaskPriority;
import com.pmagents.core.model.TaskResult;
import com.pmagents.core.model.TaskStatus;
import com.pmagents.core.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ProgressMonitorTest {

    private MutableClock clock;
    private TaskGraph graph;
    private ProgressMonitor monitor;

    private static Task task(String id, double cost, String... deps) {
        return new Task(id, "", "code-generator", Set.of(deps), TaskPriority.MEDIUM, cost, List.of(), List.of());
    }

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        graph = TaskGraph.of(List.of(task("A", 10), task("B", 10), task("C", 20, "A", "B"), task("D", 5, "C")));
        monitor = new ProgressMonitor(graph, clock, Duration.ofSeconds(1));
    }

    @Test
    @DisplayName("fresh run reports zero percent and the full estimate")
    void initialSnapshot() {
        var update = monitor.snapshot();

        assertEquals(0, update.percentage());
        assertEquals(4, update.tasksPending());
        assertEquals(2, update.tasksBlocked());
        assertEquals(0, update.tasksInProgress());
        assertEquals(Duration.ofSeconds(45), update.estimatedCompletion());
    }

    @Test
    @DisplayName("remaining estimate scales with the observed actual/estimated ratio")
    void ratioScalesEstimate() {
        monitor.onStart("A");
        clock.advance(Duration.ofSeconds(15));
        monitor.onComplete("A", TaskResult.success(List.of()));

        // ratio 1.5 over the remaining 35 units
        assertEquals(Duration.ofMillis(52_500), monitor.estimatedCompletion());
        assertEquals(25, monitor.progressPercentage());
        assertTrue(monitor.anomalies().isEmpty());
    }

    @Test
    @DisplayName("task taking more than twice its estimate is an anomaly")
    void anomaly() {
        monitor.onStart("B");
        clock.advance(Duration.ofSeconds(21));
        monitor.onComplete("B", TaskResult.success(List.of()));

        var anomalies = monitor.anomalies();
        assertEquals(1, anomalies.size());
        assertEquals("B", anomalies.get(0).taskId());
        assertEquals(Duration.ofSeconds(10), anomalies.get(0).expected());
        assertEquals(Duration.ofSeconds(21), anomalies.get(0).actual());
        assertTrue(anomalies.get(0).describe().contains("more than twice"));
    }

    @Test
    @DisplayName("failed and skipped tasks count as terminal")
    void terminalStates() {
        monitor.onStart("A");
        monitor.onFail("A", new RuntimeException("boom"));
        monitor.onSkip("C");
        monitor.onSkip("D");
        monitor.onStart("B");

        var update = monitor.snapshot();
        assertEquals(75, update.percentage());
        assertEquals(1, update.tasksInProgress());
        assertEquals(0, update.tasksPending());
        assertEquals(Duration.ofSeconds(10), update.estimatedCompletion());
    }

    @Test
    @DisplayName("resumed monitor starts from earlier statuses")
    void resumed() {
        var resumed = new ProgressMonitor(graph, clock, Duration.ofSeconds(1),
                Map.of("A", TaskStatus.COMPLETED, "B", TaskStatus.COMPLETED));

        var update = resumed.snapshot();
        assertEquals(50, update.percentage());
        assertEquals(1, update.tasksBlocked());
        assertEquals(Duration.ofSeconds(25), update.estimatedCompletion());
    }

    @Test
    @DisplayName("empty graph is complete")
    void emptyGraph() {
        var empty = new ProgressMonitor(TaskGraph.of(List.of()), clock, Duration.ofSeconds(1));

        assertEquals(100, empty.progressPercentage());
        assertEquals(Duration.ZERO, empty.estimatedCompletion());
    }
}
