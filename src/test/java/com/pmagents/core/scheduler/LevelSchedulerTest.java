package com.pmagents.core.scheduler;

import com.pmagents.core.config.ExecutionSettings;
import com.pmagents.core.escalation.EscalationPolicy;
import com.pmagents.core.events.EventBus;
import com.pmagents.core.events.OrchestrationEvent;
import com.pmagents.core.graph.TaskGraph;
import com.pmagents.core.model.IssueCategory;
import com.pmagents.core.model.IssueSeverity;
import com.pmagents.core.model.RecoveryAction;
import com.pmagents.core.model.Task;
import com.pmagents.core.model.TaskPriority;
import com.pmagents.core.model.TaskResult;
import com.pmagents.core.model.TaskStatus;
import com.pmagents.core.progress.ProgressMonitor;
import com.pmagents.core.testing.RecordingSleeper;
import com.pmagents.core.testing.ScriptedWorker;
import com.pmagents.core.worker.RetryPolicy;
import com.pmagents.core.worker.WorkerPool;
import com.pmagents.core.worker.WorkerRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class LevelSchedulerTest {

    private ScriptedWorker worker;
    private WorkerRegistry registry;
    private List<OrchestrationEvent> events;
    private LevelScheduler scheduler;
    private final List<WorkerPool> pools = new ArrayList<>();

    @BeforeEach
    void setUp() {
        worker = new ScriptedWorker("code-generator");
        registry = new WorkerRegistry();
        registry.register(worker);
        events = new CopyOnWriteArrayList<>();
        var eventBus = new EventBus();
        eventBus.subscribeAll(events::add);
        scheduler = new LevelScheduler(new EscalationPolicy(), eventBus, null);
    }

    @AfterEach
    void tearDown() {
        pools.forEach(WorkerPool::close);
    }

    private static ExecutionSettings settings(Duration taskTimeout, Duration budget) {
        return new ExecutionSettings(3, Map.of(),
                new RetryPolicy(1, Duration.ofMillis(1), Duration.ofMillis(1), 1.5, Duration.ofSeconds(30)),
                taskTimeout, 5, Duration.ofSeconds(30), TaskPriority.MEDIUM, Duration.ofSeconds(10),
                Duration.ofMillis(100), budget);
    }

    private RunContext run(TaskGraph graph, ExecutionSettings settings) {
        return run(graph, settings, new TaskStateTracker(graph), Map.of());
    }

    private RunContext run(TaskGraph graph, ExecutionSettings settings, TaskStateTracker states,
                           Map<String, TaskResult> prior) {
        var pool = new WorkerPool(registry, settings, new EscalationPolicy(), Clock.systemUTC(),
                new RecordingSleeper(), null, null);
        pools.add(pool);
        return new RunContext("EXEC-TEST", graph, Map.of(), settings, pool,
                new ProgressMonitor(graph, Clock.systemUTC(), settings.costUnit()),
                new RunDeadline(settings.budget(), Clock.systemUTC()), states, prior);
    }

    private static Task task(String id, String... deps) {
        return Task.of(id, "code-generator", Set.of(deps));
    }

    private static Task task(String id, TaskPriority priority, String... deps) {
        return new Task(id, "", "code-generator", Set.of(deps), priority, 1.0, List.of(), List.of());
    }

    private List<String> eventTypes(String taskId) {
        return events.stream().filter(e -> taskId.equals(e.taskId())).map(OrchestrationEvent::eventType).toList();
    }

    @Nested
    @DisplayName("level ordering")
    class Ordering {

        @Test
        @DisplayName("independent tasks run concurrently and their dependent runs after both")
        void joinAfterConcurrentRoots() {
            var bothStarted = new CountDownLatch(2);
            ScriptedWorker.Behaviour root = request -> {
                bothStarted.countDown();
                assertTrue(bothStarted.await(2, TimeUnit.SECONDS), "roots did not overlap");
                return ScriptedWorker.artifactFor(request);
            };
            worker.on("A", root).on("B", root);
            var graph = TaskGraph.of(List.of(task("A"), task("B"), task("C", "A", "B")));
            var ctx = run(graph, settings(Duration.ofSeconds(5), Duration.ofMinutes(1)));
            worker.on("C", request -> {
                assertEquals(TaskStatus.COMPLETED, ctx.states().statusOf("A"));
                assertEquals(TaskStatus.COMPLETED, ctx.states().statusOf("B"));
                return ScriptedWorker.artifactFor(request);
            });

            var result = scheduler.execute(ctx);

            assertEquals(3, result.completedCount());
            assertEquals(2, worker.maxInFlight());
            assertEquals("C", worker.calls().get(2));
            assertEquals(Set.of("A", "B", "C"), result.taskResults().keySet());
            assertTrue(result.issues().isEmpty());
            assertFalse(result.aborted());
            assertEquals(Map.of("code-generator", 3), result.attemptsByCapability());
        }

        @Test
        @DisplayName("lifecycle events are published per level and task")
        void events() {
            var graph = TaskGraph.of(List.of(task("A"), task("B", "A")));

            scheduler.execute(run(graph, settings(Duration.ofSeconds(5), Duration.ofMinutes(1))));

            assertEquals(List.of("task.started", "task.completed"), eventTypes("A"));
            assertEquals(2, events.stream().filter(e -> e.eventType().equals("level.started")).count());
            var levelOne = events.stream().filter(e -> e.eventType().equals("level.started")).toList().get(1);
            assertEquals(1, levelOne.payload().get("level"));
            assertEquals(List.of("B"), levelOne.payload().get("taskIds"));
        }

        @Test
        @DisplayName("capability limit bounds concurrency within a level")
        void capabilityLimit() {
            worker.byDefault(request -> {
                Thread.sleep(50);
                return ScriptedWorker.artifactFor(request);
            });
            var graph = TaskGraph.of(List.of(task("A"), task("B"), task("C"), task("D"), task("E")));
            var limited = new ExecutionSettings(2, Map.of(), settings(Duration.ofSeconds(5), Duration.ofMinutes(1)).retryPolicy(),
                    Duration.ofSeconds(5), 5, Duration.ofSeconds(30), TaskPriority.MEDIUM, Duration.ofSeconds(10),
                    Duration.ofMillis(100), Duration.ofMinutes(1));

            var result = scheduler.execute(run(graph, limited));

            assertEquals(5, result.completedCount());
            assertTrue(worker.maxInFlight() <= 2, "in flight: " + worker.maxInFlight());
        }

        @Test
        @DisplayName("with one slot a level runs its most important tasks first")
        void priorityOrderUnderContention() {
            var graph = TaskGraph.of(List.of(
                    task("a", TaskPriority.LOW), task("b", TaskPriority.LOW), task("c", TaskPriority.LOW),
                    task("m", TaskPriority.HIGH), task("z", TaskPriority.CRITICAL)));
            var single = new ExecutionSettings(1, Map.of(), settings(Duration.ofSeconds(5), Duration.ofMinutes(1)).retryPolicy(),
                    Duration.ofSeconds(5), 5, Duration.ofSeconds(30), TaskPriority.MEDIUM, Duration.ofSeconds(10),
                    Duration.ofMillis(100), Duration.ofMinutes(1));

            var result = scheduler.execute(run(graph, single));

            assertEquals(5, result.completedCount());
            assertEquals(List.of("z", "m", "a", "b", "c"), worker.calls());
            assertEquals(1, worker.maxInFlight());
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("dependents of a failed task are skipped while unrelated branches complete")
        void dependencySkip() {
            worker.on("A", request -> TaskResult.failure("compile error"));
            var graph = TaskGraph.of(List.of(
                    task("A"), task("B", "A"), task("C"), task("D", TaskPriority.LOW, "A")));

            var result = scheduler.execute(run(graph, settings(Duration.ofSeconds(5), Duration.ofMinutes(1))));

            assertEquals(List.of("A"), result.idsWithStatus(TaskStatus.FAILED));
            assertEquals(List.of("B", "D"), result.idsWithStatus(TaskStatus.SKIPPED));
            assertEquals(List.of("C"), result.idsWithStatus(TaskStatus.COMPLETED));
            assertFalse(result.escalated());

            assertEquals(2, result.issues().size());
            var failure = result.issues().get(0);
            assertEquals("A", failure.taskId());
            assertEquals(IssueCategory.WORKER_FAILURE, failure.category());
            assertEquals(RecoveryAction.SKIP, failure.resolution());
            var skipped = result.issues().get(1);
            assertEquals("B", skipped.taskId());
            assertEquals(IssueCategory.DEPENDENCY, skipped.category());
            assertEquals(IssueSeverity.WARNING, skipped.severity());
            assertEquals(0, worker.callCount("B"));
        }

        @Test
        @DisplayName("critical failure escalates and later levels are not dispatched")
        void criticalEscalates() {
            worker.on("A", request -> TaskResult.failure("database unreachable"));
            var graph = TaskGraph.of(List.of(task("A", TaskPriority.CRITICAL), task("B"), task("C", "B")));

            var result = scheduler.execute(run(graph, settings(Duration.ofSeconds(5), Duration.ofMinutes(1))));

            assertTrue(result.escalated());
            assertFalse(result.aborted());
            assertEquals(TaskStatus.FAILED, result.taskStatuses().get("A"));
            assertEquals(TaskStatus.COMPLETED, result.taskStatuses().get("B"));
            assertEquals(TaskStatus.SKIPPED, result.taskStatuses().get("C"));
            assertEquals(0, worker.callCount("C"));
            assertEquals(1, result.issues().size());
            assertTrue(result.issues().get(0).isEscalation());
            assertEquals(IssueSeverity.CRITICAL, result.issues().get(0).severity());
        }

        @Test
        @DisplayName("budget expiry fails in-flight tasks and keeps finished siblings")
        void budgetAbort() {
            worker.on("A", request -> {
                Thread.sleep(5_000);
                return ScriptedWorker.artifactFor(request);
            });
            var graph = TaskGraph.of(List.of(task("A"), task("B"), task("C", "A", "B")));

            var result = scheduler.execute(run(graph, settings(Duration.ofSeconds(10), Duration.ofMillis(200))));

            assertTrue(result.aborted());
            assertEquals(TaskStatus.FAILED, result.taskStatuses().get("A"));
            assertEquals(TaskStatus.COMPLETED, result.taskStatuses().get("B"));
            assertEquals(TaskStatus.SKIPPED, result.taskStatuses().get("C"));
            assertTrue(result.taskResults().containsKey("B"));
            assertTrue(result.issues().stream().anyMatch(i -> "A".equals(i.taskId())
                    && i.category() == IssueCategory.RESOURCE_EXHAUSTED));
            assertTrue(result.issues().stream().anyMatch(i -> i.taskId() == null
                    && i.category() == IssueCategory.RESOURCE_EXHAUSTED && i.isEscalation()));
        }

        @Test
        @DisplayName("cancelled run dispatches nothing")
        void cancelledBeforeStart() {
            var graph = TaskGraph.of(List.of(task("A"), task("B", "A")));
            var ctx = run(graph, settings(Duration.ofSeconds(5), Duration.ofMinutes(1)));
            ctx.deadline().cancel("user request");

            var result = scheduler.execute(ctx);

            assertTrue(result.aborted());
            assertEquals(List.of("A", "B"), result.idsWithStatus(TaskStatus.SKIPPED));
            assertTrue(worker.calls().isEmpty());
            assertTrue(result.issues().get(0).description().contains("user request"));
        }
    }

    @Test
    @DisplayName("reopened tasks rerun while earlier results are reused")
    void retryReusesCompletedResults() {
        var graph = TaskGraph.of(List.of(task("A"), task("B", "A"), task("C", "B")));
        var states = new TaskStateTracker(graph);
        states.markRunning("A");
        states.markCompleted("A");
        states.markRunning("B");
        states.markFailed("B");
        states.markSkipped("C");
        states.reopen("B");
        states.reopen("C");
        var prior = Map.of("A", TaskResult.success(List.of()));

        var result = scheduler.execute(run(graph, settings(Duration.ofSeconds(5), Duration.ofMinutes(1)), states, prior));

        assertEquals(3, result.completedCount());
        assertEquals(List.of("B", "C"), worker.calls());
        assertSame(prior.get("A"), result.taskResults().get("A"));
    }
}
