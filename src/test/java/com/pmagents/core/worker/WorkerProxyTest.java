package com.pmagents.core.worker;

import com.pmagents.core.escalation.EscalationPolicy;
import com.pmagents.core.metrics.OrchestrationMetrics;
import com.pmagents.core.model.Artifact;
import com.pmagents.core.model.Task;
import com.pmagents.core.model.TaskPriority;
import com.pmagents.core.model.TaskResult;
import com.pmagents.core.scheduler.ResourceExhaustedException;
import com.pmagents.core.scheduler.RunDeadline;
import com.pmagents.core.testing.RecordingSleeper;
import com.pmagents.core.testing.ScriptedWorker;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreaker.State;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class WorkerProxyTest {

    private static final Duration TIMEOUT = Duration.ofMillis(50);

    private ExecutorService callExecutor;
    private RecordingSleeper sleeper;
    private SimpleMeterRegistry registry;
    private ScriptedWorker worker;
    private CircuitBreaker breaker;
    private RunDeadline deadline;

    @BeforeEach
    void setUp() {
        callExecutor = Executors.newCachedThreadPool();
        sleeper = new RecordingSleeper();
        registry = new SimpleMeterRegistry();
        worker = new ScriptedWorker("lint");
        breaker = CapabilityCircuitBreakers.create("lint", 5, Duration.ofSeconds(30), Duration.ofMinutes(2),
                Clock.systemUTC(), null);
        deadline = new RunDeadline(Duration.ofMinutes(1), Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        callExecutor.shutdownNow();
    }

    private WorkerProxy proxy(int maxRetries) {
        var retry = new RetryPolicy(maxRetries, Duration.ofSeconds(1), Duration.ofSeconds(30), 1.5, Duration.ofMinutes(1));
        return new WorkerProxy("lint", worker, breaker, retry, new EscalationPolicy(), new ResultValidator(),
                callExecutor, sleeper, new OrchestrationMetrics(registry));
    }

    private static Task task(String id) {
        return Task.of(id, "lint", Set.of());
    }

    private double attempts(String outcome) {
        var counter = registry.find("pmagents.worker.attempts").tag("outcome", outcome).counter();
        return counter != null ? counter.count() : 0;
    }

    @Nested
    @DisplayName("retries")
    class Retries {

        @Test
        @DisplayName("succeeds after a transient failure")
        void recoversOnSecondAttempt() throws Exception {
            worker.sequence("L-1", attempt -> attempt == 1
                    ? TaskResult.failure("flaky")
                    : TaskResult.success(List.of(new Artifact("lint.txt", "text", "ok"))));
            var proxy = proxy(3);

            var result = proxy.execute(task("L-1"), Map.of(), TIMEOUT, deadline);

            assertTrue(result.isSuccess());
            assertEquals(2, worker.callCount("L-1"));
            assertEquals(List.of(Duration.ofSeconds(1)), sleeper.pauses());
            assertEquals(State.CLOSED, breaker.getState());
            assertEquals(0, breaker.getMetrics().getNumberOfFailedCalls());
            assertEquals(1.0, attempts("failure"));
            assertEquals(1.0, attempts("success"));
        }

        @Test
        @DisplayName("three timeouts exhaust the attempts and escalate the timeout each time")
        void timeoutsExhaustRetries() {
            worker.on("L-1", request -> {
                Thread.sleep(5_000);
                return ScriptedWorker.artifactFor(request);
            });
            var proxy = proxy(3);

            var ex = assertThrows(TaskTimeoutException.class,
                    () -> proxy.execute(task("L-1"), Map.of(), TIMEOUT, deadline));

            assertEquals(3, proxy.attempts());
            assertEquals(Duration.ofMillis(113), ex.timeout());
            assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), sleeper.pauses());
            assertEquals(3, breaker.getMetrics().getNumberOfFailedCalls());
            assertEquals(State.CLOSED, breaker.getState());
            assertEquals(3.0, attempts("timeout"));
        }

        @Test
        @DisplayName("invalid results are retried and reported when exhausted")
        void invalidResult() {
            worker.on("L-1", request -> TaskResult.success(List.of(new Artifact("", "text", "x"))));
            var proxy = proxy(2);

            var ex = assertThrows(InvalidResultException.class,
                    () -> proxy.execute(task("L-1"), Map.of(), TIMEOUT, deadline));

            assertEquals(List.of("deliverable with blank path"), ex.violations());
            assertEquals(2, worker.callCount("L-1"));
            assertEquals(2.0, attempts("invalid"));
        }

        @Test
        @DisplayName("thrown exceptions become worker failures carrying the cause")
        void thrownException() {
            worker.on("L-1", request -> {
                throw new IOException("connection reset");
            });
            var proxy = proxy(1);

            var ex = assertThrows(WorkerFailureException.class,
                    () -> proxy.execute(task("L-1"), Map.of(), TIMEOUT, deadline));

            assertInstanceOf(IOException.class, ex.getCause());
            assertTrue(ex.getMessage().contains("connection reset"));
            assertTrue(sleeper.pauses().isEmpty());
        }

        @Test
        @DisplayName("attempt number and context reach the worker")
        void requestCarriesAttempt() throws Exception {
            worker.on("L-1", request -> {
                assertEquals("repo-1", request.context().get("repo"));
                return request.attempt() < 3 ? TaskResult.failure("again") : ScriptedWorker.artifactFor(request);
            });
            var proxy = proxy(3);

            assertTrue(proxy.execute(task("L-1"), Map.of("repo", "repo-1"), TIMEOUT, deadline).isSuccess());
            assertEquals(3, worker.callCount("L-1"));
        }
    }

    @Nested
    @DisplayName("circuit and budget")
    class CircuitAndBudget {

        @Test
        @DisplayName("open circuit fails fast without calling the worker")
        void circuitOpen() {
            var proxy = proxy(3);
            breaker.transitionToOpenState();

            var ex = assertThrows(CircuitOpenException.class,
                    () -> proxy.execute(task("L-1"), Map.of(), TIMEOUT, deadline));

            assertEquals("lint", ex.capability());
            assertEquals(0, worker.callCount("L-1"));
            assertEquals(1.0, attempts("circuit_open"));
        }

        @Test
        @DisplayName("a call outliving the run budget exhausts the run")
        void deadlineBoundsCall() {
            worker.on("L-1", request -> {
                Thread.sleep(5_000);
                return ScriptedWorker.artifactFor(request);
            });
            var shortDeadline = new RunDeadline(Duration.ofMillis(100), Clock.systemUTC());
            var proxy = proxy(3);

            assertThrows(ResourceExhaustedException.class,
                    () -> proxy.execute(task("L-1"), Map.of(), Duration.ofSeconds(10), shortDeadline));

            assertEquals(1, proxy.attempts());
            assertEquals(0, breaker.getMetrics().getNumberOfFailedCalls());
        }

        @Test
        @DisplayName("backoff longer than the remaining budget exhausts the run")
        void backoffExceedsBudget() {
            worker.on("L-1", request -> TaskResult.failure("nope"));
            var shortDeadline = new RunDeadline(Duration.ofMillis(500), Clock.systemUTC());
            var proxy = proxy(3);

            assertThrows(ResourceExhaustedException.class,
                    () -> proxy.execute(task("L-1"), Map.of(), TIMEOUT, shortDeadline));

            assertEquals(1, worker.callCount("L-1"));
            assertTrue(sleeper.pauses().isEmpty());
        }

        @Test
        @DisplayName("cancelled run is not dispatched")
        void cancelledRun() {
            deadline.cancel("user request");
            var proxy = proxy(3);

            var ex = assertThrows(ResourceExhaustedException.class,
                    () -> proxy.execute(task("L-1"), Map.of(), TIMEOUT, deadline));

            assertTrue(ex.getMessage().contains("user request"));
            assertEquals(0, worker.callCount("L-1"));
        }

        @Test
        @DisplayName("half-open trial permission is handed back when the call cannot be submitted")
        void rejectedSubmitReleasesTrial() {
            breaker.transitionToHalfOpenState();
            callExecutor.shutdownNow();
            var proxy = proxy(3);

            assertThrows(RejectedExecutionException.class,
                    () -> proxy.execute(task("L-1"), Map.of(), TIMEOUT, deadline));

            assertEquals(State.HALF_OPEN, breaker.getState());
            assertTrue(breaker.tryAcquirePermission());
            assertEquals(0, breaker.getMetrics().getNumberOfFailedCalls());
        }

        @Test
        @DisplayName("critical task is not retried past its budget")
        void criticalTaskStops() {
            worker.on("C-1", request -> TaskResult.failure("down"));
            var critical = new Task("C-1", "", "lint", Set.of(), TaskPriority.CRITICAL, 1.0, List.of(), List.of());
            var proxy = proxy(2);

            assertThrows(WorkerFailureException.class,
                    () -> proxy.execute(critical, Map.of(), TIMEOUT, deadline));

            assertEquals(2, worker.callCount("C-1"));
        }
    }
}
