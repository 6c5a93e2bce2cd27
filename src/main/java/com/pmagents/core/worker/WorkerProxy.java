package com.pmagents.core.worker;

import com.pmagents.core.escalation.EscalationPolicy;
import com.pmagents.core.metrics.OrchestrationMetrics;
import com.pmagents.core.model.Task;
import com.pmagents.core.model.TaskRequest;
import com.pmagents.core.model.TaskResult;
import com.pmagents.core.scheduler.ResourceExhaustedException;
import com.pmagents.core.scheduler.RunDeadline;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fault-tolerant front of one capability worker, shared by every task of that capability
 * within a run.
 *
 * <p>Each attempt passes through the circuit breaker, runs on the call executor bounded by
 * the attempt timeout (or the run deadline, whichever is closer) and has its result
 * structurally validated. After a failed attempt the {@link EscalationPolicy} decides
 * whether to retry; retries pause with exponential backoff, and a timed-out attempt makes
 * the next one wait longer.
 */
public class WorkerProxy {

    private static final Logger log = LoggerFactory.getLogger(WorkerProxy.class);

    private final String capability;
    private final CapabilityWorker worker;
    private final CircuitBreaker breaker;
    private final RetryPolicy retryPolicy;
    private final EscalationPolicy escalationPolicy;
    private final ResultValidator validator;
    private final ExecutorService callExecutor;
    private final Sleeper sleeper;
    private final OrchestrationMetrics metrics;
    private final AtomicInteger attempts = new AtomicInteger();

    public WorkerProxy(String capability, CapabilityWorker worker, CircuitBreaker breaker,
                       RetryPolicy retryPolicy, EscalationPolicy escalationPolicy, ResultValidator validator,
                       ExecutorService callExecutor, Sleeper sleeper, OrchestrationMetrics metrics) {
        this.capability = capability;
        this.worker = worker;
        this.breaker = breaker;
        this.retryPolicy = retryPolicy;
        this.escalationPolicy = escalationPolicy;
        this.validator = validator;
        this.callExecutor = callExecutor;
        this.sleeper = sleeper;
        this.metrics = metrics;
    }

    /**
     * Execute a task, retrying transient failures.
     *
     * @param timeout  timeout of the first attempt
     * @param deadline run budget bounding every attempt and backoff
     * @return the first structurally valid successful result
     * @throws TaskTimeoutException       the last attempt timed out and no retry remains
     * @throws InvalidResultException     the last result was structurally invalid
     * @throws WorkerFailureException     the worker failed or reported failure
     * @throws CircuitOpenException       the breaker refused the call
     * @throws ResourceExhaustedException the run budget ran out or the run was cancelled
     * @throws InterruptedException       the calling thread was interrupted
     */
    public TaskResult execute(Task task, Map<String, Object> context, Duration timeout, RunDeadline deadline)
            throws InterruptedException {
        int maxAttempts = retryPolicy.maxRetries();
        Duration attemptTimeout = timeout;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (attempt > 1) {
                pauseBeforeRetry(task, attempt, deadline);
            }
            if (deadline.isExpired()) {
                throw deadline.exhausted(task.id());
            }
            if (!breaker.tryAcquirePermission()) {
                record("circuit_open");
                log.warn("Circuit open for '{}', task {} fails fast", capability, task.id());
                throw new CircuitOpenException(task.id(), capability);
            }

            long started = System.nanoTime();
            boolean outcomeRecorded = false;
            try {
                TaskResult result = callOnce(task, context, attempt, attemptTimeout, deadline);
                breaker.onSuccess(System.nanoTime() - started, TimeUnit.NANOSECONDS);
                outcomeRecorded = true;
                record("success");
                return result;
            } catch (TaskTimeoutException | InvalidResultException | WorkerFailureException e) {
                breaker.onError(System.nanoTime() - started, TimeUnit.NANOSECONDS, e);
                outcomeRecorded = true;
                record(outcomeOf(e));
                if (e instanceof TaskTimeoutException) {
                    attemptTimeout = retryPolicy.escalateTimeout(attemptTimeout);
                }
                var decision = escalationPolicy.classify(e, task, attempt, maxAttempts);
                if (!decision.isRetry()) {
                    log.warn("Task {} failed on attempt {}/{}: {} -> {}", task.id(), attempt, maxAttempts,
                            e.getMessage(), decision.action());
                    throw e;
                }
                log.warn("Task {} attempt {}/{} failed, retrying: {}", task.id(), attempt, maxAttempts,
                        e.getMessage());
            } finally {
                // only worker outcomes count; any other exit hands the permission back
                if (!outcomeRecorded) {
                    breaker.releasePermission();
                }
            }
        }
        // the loop always returns or throws on its last attempt
        throw new IllegalStateException("Retry loop exited without outcome for task " + task.id());
    }

    public String capability() {
        return capability;
    }

    public CircuitBreaker breaker() {
        return breaker;
    }

    /**
     * Worker calls made through this proxy, including failed attempts.
     */
    public int attempts() {
        return attempts.get();
    }

    private TaskResult callOnce(Task task, Map<String, Object> context, int attempt,
                                Duration attemptTimeout, RunDeadline deadline) throws InterruptedException {
        var request = TaskRequest.forAttempt(task, context, attempt);
        Duration remaining = deadline.remaining();
        boolean boundedByDeadline = remaining.compareTo(attemptTimeout) < 0;
        Duration bound = boundedByDeadline ? remaining : attemptTimeout;

        attempts.incrementAndGet();
        log.debug("Calling '{}' for task {} (attempt {}, bound {}ms)", capability, task.id(), attempt, bound.toMillis());
        Future<TaskResult> future = callExecutor.submit(() -> worker.execute(request));
        TaskResult result;
        try {
            result = future.get(bound.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            if (boundedByDeadline) {
                throw deadline.exhausted(task.id());
            }
            throw new TaskTimeoutException(task.id(), attemptTimeout);
        } catch (ExecutionException e) {
            throw asWorkerFailure(task, e.getCause());
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }

        var violations = validator.validate(task, result);
        if (!violations.isEmpty()) {
            throw new InvalidResultException(task.id(), violations);
        }
        if (!result.isSuccess()) {
            throw new WorkerFailureException(task.id(), "Worker '" + capability + "' reported failure for task "
                    + task.id() + ": " + (result.errorDetail() != null ? result.errorDetail() : "no detail"));
        }
        return result;
    }

    private RuntimeException asWorkerFailure(Task task, Throwable cause) {
        if (cause instanceof TaskTimeoutException
                || cause instanceof InvalidResultException
                || cause instanceof WorkerFailureException) {
            return (RuntimeException) cause;
        }
        return new WorkerFailureException(task.id(), "Worker '" + capability + "' threw "
                + cause.getClass().getSimpleName() + ": " + cause.getMessage(), cause);
    }

    private void pauseBeforeRetry(Task task, int attempt, RunDeadline deadline) throws InterruptedException {
        Duration backoff = retryPolicy.backoffBefore(attempt);
        if (backoff.isZero()) {
            return;
        }
        if (backoff.compareTo(deadline.remaining()) > 0) {
            throw deadline.isCancelled()
                    ? deadline.exhausted(task.id())
                    : new ResourceExhaustedException(task.id(), "Backoff of " + backoff.toMillis()
                            + "ms before attempt " + attempt + " of task " + task.id() + " exceeds remaining budget");
        }
        log.debug("Backing off {}ms before attempt {} of task {}", backoff.toMillis(), attempt, task.id());
        sleeper.sleep(backoff);
    }

    private void record(String outcome) {
        if (metrics != null) {
            metrics.recordWorkerAttempt(capability, outcome);
        }
    }

    private static String outcomeOf(RuntimeException e) {
        if (e instanceof TaskTimeoutException) {
            return "timeout";
        }
        return e instanceof InvalidResultException ? "invalid" : "failure";
    }
}
