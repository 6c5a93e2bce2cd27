package com.pmagents.core.scheduler;

import com.pmagents.core.escalation.EscalationDecision;
import com.pmagents.core.escalation.EscalationPolicy;
import com.pmagents.core.events.EventBus;
import com.pmagents.core.events.OrchestrationEvent;
import com.pmagents.core.logging.MdcContext;
import com.pmagents.core.metrics.OrchestrationMetrics;
import com.pmagents.core.model.Issue;
import com.pmagents.core.model.IssueCategory;
import com.pmagents.core.model.Task;
import com.pmagents.core.model.TaskResult;
import com.pmagents.core.model.TaskStatus;
import com.pmagents.core.worker.SlotReservation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes a validated task graph level by level.
 *
 * <p>For each level: tasks whose dependencies did not all complete are skipped, the
 * remaining tasks are dispatched concurrently (each dispatch thread waits for a capability
 * slot in the {@link com.pmagents.core.worker.WorkerPool}, more important tasks first), the
 * level is joined, and terminal transitions are applied in task-id order. Level N is fully
 * terminal before level N+1 is dispatched.
 *
 * <p>An {@code ESCALATE} decision lets the current level finish and stops dispatching. Budget
 * expiry or cancellation interrupts outstanding tasks: running tasks fail with a
 * {@code RESOURCE_EXHAUSTED} issue and pending tasks are skipped.
 */
@Service
public class LevelScheduler {

    private static final Logger log = LoggerFactory.getLogger(LevelScheduler.class);
    private static final long JOIN_SLICE_MS = 50;

    private final EscalationPolicy escalationPolicy;
    private final EventBus eventBus;
    private final OrchestrationMetrics metrics;

    @Autowired
    public LevelScheduler(EscalationPolicy escalationPolicy, EventBus eventBus,
                          @Autowired(required = false) OrchestrationMetrics metrics) {
        this.escalationPolicy = escalationPolicy;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    LevelScheduler() {
        this(new EscalationPolicy(), new EventBus(), null);
    }

    public ExecutionResult execute(RunContext run) {
        var results = new TreeMap<String, TaskResult>(run.priorResults());
        var issues = new ArrayList<Issue>();
        var flags = new RunFlags();
        var executor = dispatchExecutor(run.executionId());

        try {
            var levels = run.graph().levels();
            for (int index = 0; index < levels.size() && !flags.stopped(); index++) {
                if (run.deadline().isExpired()) {
                    flags.aborted = true;
                    break;
                }
                runLevel(run, index, levels.get(index), executor, results, issues, flags);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Scheduler interrupted for execution {}; aborting run", run.executionId());
            run.deadline().cancel("scheduler interrupted");
            flags.aborted = true;
        } finally {
            executor.shutdownNow();
        }

        if (flags.aborted) {
            var exhausted = run.deadline().exhausted(null);
            log.error("Execution {} aborted: {}", run.executionId(), exhausted.getMessage());
            issues.add(escalationPolicy.classify(exhausted, null).toIssue(null));
        }
        if (flags.stopped()) {
            skipRemaining(run);
        }

        MdcContext.clear();
        return new ExecutionResult(run.states().snapshot(), results, issues, flags.aborted, flags.escalated,
                run.pool().attemptsByCapability());
    }

    private void runLevel(RunContext run, int index, List<String> level, ExecutorService executor,
                          Map<String, TaskResult> results, List<Issue> issues, RunFlags flags)
            throws InterruptedException {
        MdcContext.setLevel(run.executionId(), index);
        var toDispatch = new ArrayList<String>();
        for (var id : level) {
            if (!run.states().isDispatchable(id)) {
                continue;
            }
            var unmet = unmetDependencies(run, run.graph().task(id));
            if (unmet.isEmpty()) {
                toDispatch.add(id);
            } else {
                skipForDependencies(run, run.graph().task(id), unmet, issues, flags);
            }
        }
        if (toDispatch.isEmpty()) {
            return;
        }

        log.info("Level {}: dispatching {} task(s) {}", index, toDispatch.size(), toDispatch);
        eventBus.publish(OrchestrationEvent.of("level.started", run.executionId(), null,
                Map.of("level", index, "taskIds", List.copyOf(toDispatch))));
        if (metrics != null) {
            metrics.recordLevelExecution(toDispatch.size());
        }

        // every slot is reserved before any dispatch thread starts, so slots go out by priority
        var dispatchOrder = new ArrayList<>(toDispatch);
        dispatchOrder.sort(Comparator.comparing((String id) -> run.graph().task(id).priority())
                .thenComparing(Comparator.naturalOrder()));
        var reservations = new LinkedHashMap<String, SlotReservation>();
        for (var id : dispatchOrder) {
            var task = run.graph().task(id);
            reservations.put(id, run.pool().reserve(task.capability(), task.priority()));
        }

        var completion = new ExecutorCompletionService<TaskResult>(executor);
        var futures = new HashMap<String, Future<TaskResult>>();
        for (var entry : reservations.entrySet()) {
            var task = run.graph().task(entry.getKey());
            var reservation = entry.getValue();
            futures.put(task.id(), completion.submit(() -> runTask(run, task, reservation)));
        }

        boolean joined = join(completion, futures.size(), run.deadline());
        if (!joined) {
            futures.values().forEach(f -> f.cancel(true));
            reservations.values().forEach(SlotReservation::withdraw);
            flags.aborted = true;
        }

        for (var id : toDispatch) {
            var future = futures.get(id);
            var task = run.graph().task(id);
            if (future.isDone() && !future.isCancelled()) {
                apply(run, task, future, results, issues, flags);
            } else {
                abandon(run, task, issues);
            }
        }
    }

    /**
     * Runs on a dispatch thread: wait for a slot, mark the task running, call the worker.
     */
    private TaskResult runTask(RunContext run, Task task, SlotReservation reservation) throws InterruptedException {
        MdcContext.setTask(run.executionId(), task.id(), task.capability());
        try (var lease = run.pool().acquire(reservation, run.deadline())) {
            try {
                run.states().markRunning(task.id());
            } catch (IllegalStateException e) {
                log.warn("Task {} no longer dispatchable: {}", task.id(), e.getMessage());
                throw e;
            }
            run.monitor().onStart(task.id());
            log.info("Dispatching task {} [{}]: {}", task.id(), task.capability(), task.description());
            eventBus.publish(OrchestrationEvent.of("task.started", run.executionId(), task.id(),
                    Map.of("capability", task.capability(), "description", task.description())));

            long startMs = System.currentTimeMillis();
            var result = lease.proxy().execute(task, run.context(), run.settings().taskTimeout(), run.deadline());
            if (metrics != null) {
                metrics.recordTaskExecution(task.capability(), System.currentTimeMillis() - startMs);
            }
            return result;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Waits until every dispatched task finished, or the deadline passed.
     *
     * @return {@code false} if the deadline expired (or the run was cancelled) first
     */
    private boolean join(ExecutorCompletionService<TaskResult> completion, int dispatched, RunDeadline deadline)
            throws InterruptedException {
        int outstanding = dispatched;
        while (outstanding > 0) {
            if (deadline.isExpired()) {
                return false;
            }
            long slice = Math.max(1, Math.min(JOIN_SLICE_MS, deadline.remaining().toMillis()));
            if (completion.poll(slice, TimeUnit.MILLISECONDS) != null) {
                outstanding--;
            }
        }
        return true;
    }

    private void apply(RunContext run, Task task, Future<TaskResult> future, Map<String, TaskResult> results,
                       List<Issue> issues, RunFlags flags) throws InterruptedException {
        Throwable error;
        try {
            var result = future.get();
            run.states().markCompleted(task.id());
            results.put(task.id(), result);
            run.monitor().onComplete(task.id(), result);
            recordOutcome(task, "completed");
            log.info("Task {} completed", task.id());
            eventBus.publish(OrchestrationEvent.of("task.completed", run.executionId(), task.id(),
                    Map.of("capability", task.capability(), "deliverables", result.deliverables().size())));
            return;
        } catch (ExecutionException e) {
            error = e.getCause();
        } catch (CancellationException e) {
            error = e;
        }

        if (error instanceof ResourceExhaustedException) {
            flags.aborted = true;
        }
        var status = run.states().abandon(task.id());
        if (status == TaskStatus.SKIPPED) {
            run.monitor().onSkip(task.id());
            publishSkipped(run, task, error.getMessage());
            return;
        }
        if (status != TaskStatus.FAILED) {
            return;
        }
        fail(run, task, error, escalationPolicy.classify(error, task), issues, flags);
    }

    private void abandon(RunContext run, Task task, List<Issue> issues) {
        var status = run.states().abandon(task.id());
        if (status == TaskStatus.FAILED) {
            var error = run.deadline().exhausted(task.id());
            run.monitor().onFail(task.id(), error);
            issues.add(escalationPolicy.classify(error, task).toIssue(task.id()));
            recordOutcome(task, "failed");
            log.error("Task {} abandoned: {}", task.id(), error.getMessage());
            eventBus.publish(OrchestrationEvent.of("task.failed", run.executionId(), task.id(),
                    Map.of("capability", task.capability(), "category", error.category().name())));
        } else if (status == TaskStatus.SKIPPED) {
            run.monitor().onSkip(task.id());
            publishSkipped(run, task, "run aborted");
        }
    }

    private void fail(RunContext run, Task task, Throwable error, EscalationDecision decision,
                      List<Issue> issues, RunFlags flags) {
        run.monitor().onFail(task.id(), error);
        issues.add(decision.toIssue(task.id()));
        recordOutcome(task, "failed");
        if (decision.isEscalation()) {
            flags.escalated = true;
            if (metrics != null) {
                metrics.incrementEscalations(decision.category().name());
            }
            log.error("Task {} failed and escalated: {}", task.id(), decision.reason());
        } else {
            log.warn("Task {} failed ({}): {}", task.id(), decision.action(), decision.reason());
        }
        eventBus.publish(OrchestrationEvent.of("task.failed", run.executionId(), task.id(),
                Map.of("capability", task.capability(),
                       "category", decision.category().name(),
                       "action", decision.action().name())));
    }

    private void skipForDependencies(RunContext run, Task task, List<String> unmet,
                                     List<Issue> issues, RunFlags flags) {
        run.states().markSkipped(task.id());
        run.monitor().onSkip(task.id());
        recordOutcome(task, "skipped");
        if (task.priority().isBelow(run.settings().skipPriorityFloor())) {
            log.debug("Task {} skipped silently, dependencies not completed: {}", task.id(), unmet);
        } else {
            var decision = escalationPolicy.classify(new DependencyFailedException(task.id(), unmet), task);
            issues.add(decision.toIssue(task.id()));
            if (decision.isEscalation()) {
                flags.escalated = true;
                if (metrics != null) {
                    metrics.incrementEscalations(decision.category().name());
                }
            }
            log.warn("Task {} skipped, dependencies not completed: {}", task.id(), unmet);
        }
        publishSkipped(run, task, "dependency failed");
    }

    private void skipRemaining(RunContext run) {
        for (var id : run.states().idsWithStatus(TaskStatus.PENDING)) {
            run.states().markSkipped(id);
            run.monitor().onSkip(id);
            publishSkipped(run, run.graph().task(id), "run stopped");
        }
    }

    private List<String> unmetDependencies(RunContext run, Task task) {
        return task.dependencies().stream()
                .filter(dep -> run.states().statusOf(dep) != TaskStatus.COMPLETED)
                .sorted()
                .toList();
    }

    private void publishSkipped(RunContext run, Task task, String reason) {
        eventBus.publish(OrchestrationEvent.of("task.skipped", run.executionId(), task.id(),
                Map.of("capability", task.capability(), "reason", reason != null ? reason : "")));
    }

    private void recordOutcome(Task task, String status) {
        if (metrics != null) {
            metrics.recordTaskOutcome(task.capability(), status);
        }
    }

    private static ExecutorService dispatchExecutor(String executionId) {
        var seq = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "dispatch-" + executionId + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    private static final class RunFlags {
        boolean aborted;
        boolean escalated;

        boolean stopped() {
            return aborted || escalated;
        }
    }
}
