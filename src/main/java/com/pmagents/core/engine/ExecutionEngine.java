package com.pmagents.core.engine;

import com.pmagents.core.aggregation.AggregatedResult;
import com.pmagents.core.aggregation.MergeConflictException;
import com.pmagents.core.aggregation.ResultAggregator;
import com.pmagents.core.config.ExecutionSettings;
import com.pmagents.core.config.OrchestratorProperties;
import com.pmagents.core.escalation.EscalationPolicy;
import com.pmagents.core.events.EventBus;
import com.pmagents.core.events.OrchestrationEvent;
import com.pmagents.core.graph.TaskGraph;
import com.pmagents.core.graph.UnknownCapabilityException;
import com.pmagents.core.logging.MdcContext;
import com.pmagents.core.metrics.OrchestrationMetrics;
import com.pmagents.core.model.ExecuteRequest;
import com.pmagents.core.model.ExecuteResponse;
import com.pmagents.core.model.ExecutionStatus;
import com.pmagents.core.model.Issue;
import com.pmagents.core.model.IssueCategory;
import com.pmagents.core.model.IssueSeverity;
import com.pmagents.core.model.ProgressUpdate;
import com.pmagents.core.model.ResourceUsage;
import com.pmagents.core.model.Task;
import com.pmagents.core.model.TaskStatus;
import com.pmagents.core.progress.ProgressMonitor;
import com.pmagents.core.progress.ProgressReporter;
import com.pmagents.core.qualitygate.ValidationPipeline;
import com.pmagents.core.qualitygate.ValidationReport;
import com.pmagents.core.scheduler.ExecutionResult;
import com.pmagents.core.scheduler.LevelScheduler;
import com.pmagents.core.scheduler.RunContext;
import com.pmagents.core.scheduler.RunDeadline;
import com.pmagents.core.worker.Sleeper;
import com.pmagents.core.worker.WorkerPool;
import com.pmagents.core.worker.WorkerRegistry;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for callers: validates a task set, runs it through the scheduler,
 * aggregates deliverables, evaluates quality gates and builds the {@link ExecuteResponse}.
 * <p>
 * Executions are kept in a bounded in-memory registry so that their status and progress
 * can be queried, a running execution can be cancelled, and a finished one can have its
 * failed tasks retried.
 */
@Service
public class ExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);
    private static final AtomicInteger EXECUTION_COUNTER = new AtomicInteger(0);

    private final OrchestratorProperties properties;
    private final WorkerRegistry registry;
    private final LevelScheduler scheduler;
    private final ResultAggregator aggregator;
    private final ValidationPipeline validationPipeline;
    private final EscalationPolicy escalationPolicy;
    private final EventBus eventBus;
    private final OrchestrationMetrics metrics;
    private final Clock clock;
    private final Sleeper sleeper;

    private final ConcurrentHashMap<String, Execution> executions = new ConcurrentHashMap<>();
    private final ConcurrentLinkedDeque<String> executionOrder = new ConcurrentLinkedDeque<>();
    private final ExecutorService runExecutor;

    @Autowired
    public ExecutionEngine(OrchestratorProperties properties, WorkerRegistry registry, LevelScheduler scheduler,
                           ResultAggregator aggregator, ValidationPipeline validationPipeline,
                           EscalationPolicy escalationPolicy, EventBus eventBus,
                           @Autowired(required = false) OrchestrationMetrics metrics) {
        this(properties, registry, scheduler, aggregator, validationPipeline, escalationPolicy, eventBus, metrics,
                Clock.systemUTC(), Sleeper.SYSTEM);
    }

    ExecutionEngine(OrchestratorProperties properties, WorkerRegistry registry, LevelScheduler scheduler,
                    ResultAggregator aggregator, ValidationPipeline validationPipeline,
                    EscalationPolicy escalationPolicy, EventBus eventBus, OrchestrationMetrics metrics,
                    Clock clock, Sleeper sleeper) {
        this.properties = properties;
        this.registry = registry;
        this.scheduler = scheduler;
        this.aggregator = aggregator;
        this.validationPipeline = validationPipeline;
        this.escalationPolicy = escalationPolicy;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
        this.sleeper = sleeper;
        var seq = new AtomicInteger();
        this.runExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "execution-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Executes a task graph and waits for the response.
     *
     * @throws com.pmagents.core.graph.GraphValidationException if the graph is invalid; nothing is executed
     */
    public ExecuteResponse execute(ExecuteRequest request) {
        var execution = prepare(request);
        return run(execution);
    }

    /**
     * Validates the graph, then executes it in the background.
     *
     * @return the execution id
     * @throws com.pmagents.core.graph.GraphValidationException if the graph is invalid; nothing is executed
     */
    public String submitAsync(ExecuteRequest request) {
        var execution = prepare(request);
        launch(execution);
        return execution.id();
    }

    public boolean exists(String executionId) {
        return executions.containsKey(executionId);
    }

    /**
     * The response of the latest finished run, empty while a run is in progress.
     *
     * @throws ExecutionNotFoundException if the id is unknown
     */
    public Optional<ExecuteResponse> response(String executionId) {
        return Optional.ofNullable(require(executionId).response());
    }

    /**
     * @throws ExecutionNotFoundException if the id is unknown
     */
    public ProgressUpdate progress(String executionId) {
        var execution = require(executionId);
        var update = execution.progress();
        if (update != null) {
            return update;
        }
        return new ProgressMonitor(execution.graph(), clock, execution.settings().costUnit()).snapshot();
    }

    public boolean isRunning(String executionId) {
        return require(executionId).isRunning();
    }

    /**
     * Requests cooperative cancellation of a running execution.
     *
     * @return {@code false} if the execution is not running
     * @throws ExecutionNotFoundException if the id is unknown
     */
    public boolean cancel(String executionId) {
        boolean cancelled = require(executionId).cancel("cancelled by caller");
        if (cancelled) {
            log.warn("Execution {} cancellation requested", executionId);
        }
        return cancelled;
    }

    /**
     * Re-runs the failed tasks of a finished execution together with the tasks skipped
     * because of them, reusing the results of completed tasks. Waits for the response.
     *
     * @throws IllegalStateException      if the execution is still running
     * @throws ExecutionNotFoundException if the id is unknown
     */
    public ExecuteResponse retryFailedTasks(String executionId) {
        var execution = require(executionId);
        if (!reopenForRetry(execution)) {
            return execution.response();
        }
        return run(execution);
    }

    /**
     * Asynchronous variant of {@link #retryFailedTasks(String)}.
     *
     * @return {@code false} if there was nothing to retry
     */
    public boolean submitRetry(String executionId) {
        var execution = require(executionId);
        if (!reopenForRetry(execution)) {
            return false;
        }
        launch(execution);
        return true;
    }

    /**
     * Validates a task set and returns its concurrency levels without executing it.
     */
    public List<List<String>> previewLevels(Collection<Task> tasks) {
        var graph = TaskGraph.of(tasks);
        requireCapabilities(graph);
        return graph.levels();
    }

    /**
     * Generates a unique execution ID in the format EXEC-YYYY-NNNN.
     */
    public String generateExecutionId() {
        int count = EXECUTION_COUNTER.incrementAndGet();
        int year = Instant.now(clock).atZone(ZoneOffset.UTC).getYear();
        return String.format("EXEC-%d-%04d", year, count);
    }

    @PreDestroy
    public void shutdown() {
        executions.values().forEach(e -> e.cancel("service shutting down"));
        runExecutor.shutdownNow();
    }

    // -- internals --

    private Execution prepare(ExecuteRequest request) {
        var graph = TaskGraph.of(request.tasks());
        requireCapabilities(graph);
        var settings = ExecutionSettings.resolve(properties, request.options(), request.resourceBudget());

        var execution = new Execution(generateExecutionId(), request, graph, settings, clock.instant());
        begin(execution);
        register(execution);

        log.info("Execution {} accepted: {} task(s) in {} level(s), budget {}ms", execution.id(), graph.size(),
                graph.levels().size(), settings.budget().toMillis());
        eventBus.publish(OrchestrationEvent.of("execution.created", execution.id(), null,
                Map.of("tasks", graph.size(), "levels", graph.levels().size())));
        return execution;
    }

    private void begin(Execution execution) {
        var initial = new LinkedHashMap<String, TaskStatus>();
        for (var id : execution.graph().taskIds()) {
            initial.put(id, execution.states().isDispatchable(id) ? TaskStatus.PENDING : execution.states().statusOf(id));
        }
        var monitor = new ProgressMonitor(execution.graph(), clock, execution.settings().costUnit(), initial);
        execution.begin(monitor, new RunDeadline(execution.settings().budget(), clock));
    }

    private void launch(Execution execution) {
        CompletableFuture.runAsync(() -> run(execution), runExecutor)
                .exceptionally(e -> {
                    log.error("Background execution {} ended with error: {}", execution.id(), e.getMessage());
                    return null;
                });
    }

    private boolean reopenForRetry(Execution execution) {
        synchronized (execution) {
            if (execution.isRunning()) {
                throw new IllegalStateException("Execution " + execution.id() + " is still running");
            }
            var states = execution.states();
            var toReopen = new ArrayList<String>();
            toReopen.addAll(states.idsWithStatus(TaskStatus.FAILED));
            toReopen.addAll(states.idsWithStatus(TaskStatus.SKIPPED));
            if (toReopen.isEmpty()) {
                log.info("Execution {} has no failed or skipped tasks to retry", execution.id());
                return false;
            }
            toReopen.forEach(states::reopen);
            log.info("Execution {} retrying {} task(s): {}", execution.id(), toReopen.size(), toReopen);
            begin(execution);
            return true;
        }
    }

    private ExecuteResponse run(Execution execution) {
        var id = execution.id();
        var settings = execution.settings();
        var started = clock.instant();
        MdcContext.setExecution(id);
        try (var pool = new WorkerPool(registry, settings, escalationPolicy, clock, sleeper, metrics,
                     (capability, state) -> onCircuitTransition(id, capability, state));
             var reporter = new ProgressReporter(id, execution.monitor(), eventBus)) {
            reporter.start(settings.progressInterval());

            var context = new RunContext(id, execution.graph(), execution.request().contextData(), settings, pool,
                    execution.monitor(), execution.deadline(), execution.states(), execution.completedResults());
            var result = scheduler.execute(context);
            reporter.publish();

            var response = buildResponse(execution, result, Duration.between(started, clock.instant()));
            execution.finish(response, result.taskResults());

            log.info("Execution {} finished {}: {} completed, {} failed, {} skipped, {} issue(s)", id,
                    response.status(), response.completedTaskIds().size(), response.failedTaskIds().size(),
                    response.skippedTaskIds().size(), response.issues().size());
            eventBus.publish(OrchestrationEvent.executionCompleted(response));
            if (metrics != null) {
                metrics.recordExecutionResult(response.status().name(), response.resourceUsage().elapsed().toMillis());
            }
            return response;
        } catch (RuntimeException e) {
            log.error("Execution {} failed unexpectedly", id, e);
            execution.finish(crashResponse(execution, e), execution.completedResults());
            throw e;
        } finally {
            MdcContext.clear();
        }
    }

    private ExecuteResponse buildResponse(Execution execution, ExecutionResult result, Duration elapsed) {
        var issues = new ArrayList<>(result.issues());
        for (var anomaly : execution.monitor().anomalies()) {
            issues.add(new Issue(anomaly.taskId(), IssueCategory.TIMEOUT, IssueSeverity.INFO, anomaly.describe(), null));
        }

        AggregatedResult aggregated;
        boolean conflict = false;
        try {
            aggregated = aggregator.aggregate(result.taskResults());
        } catch (MergeConflictException e) {
            conflict = true;
            aggregated = e.partial();
            issues.add(escalationPolicy.classify(e, null).toIssue(null));
            if (metrics != null) {
                metrics.recordMergeConflicts(e.conflicts().size());
                metrics.incrementEscalations(e.category().name());
            }
        }

        ValidationReport report = ValidationReport.empty();
        if (!result.aborted() && !conflict) {
            report = validationPipeline.evaluate(aggregated, execution.request().qualityGates());
            issues.addAll(report.issues());
        }

        var graph = execution.graph();
        int completed = result.completedCount();
        ExecutionStatus status;
        if (result.aborted() || conflict || !report.passed() || (!graph.isEmpty() && completed == 0)) {
            status = ExecutionStatus.FAILED;
        } else if (result.failedCount() > 0 || result.skippedCount() > 0) {
            status = ExecutionStatus.PARTIAL;
        } else {
            status = ExecutionStatus.COMPLETED;
        }

        var completedIds = result.idsWithStatus(TaskStatus.COMPLETED);
        double costConsumed = completedIds.stream().mapToDouble(id -> graph.task(id).estimatedCost()).sum();
        var usage = new ResourceUsage(elapsed, execution.settings().budget(), costConsumed,
                result.totalAttempts(), result.attemptsByCapability());

        return new ExecuteResponse(execution.id(), status, completedIds,
                result.idsWithStatus(TaskStatus.FAILED), result.idsWithStatus(TaskStatus.SKIPPED),
                aggregated.deliverables(), report.outcomes(), issues, usage, graph.levels());
    }

    private ExecuteResponse crashResponse(Execution execution, RuntimeException error) {
        var states = execution.states();
        var issue = escalationPolicy.classify(error, null).toIssue(null);
        var usage = new ResourceUsage(Duration.between(execution.createdAt(), clock.instant()),
                execution.settings().budget(), 0, 0, Map.of());
        return new ExecuteResponse(execution.id(), ExecutionStatus.FAILED,
                states.idsWithStatus(TaskStatus.COMPLETED), states.idsWithStatus(TaskStatus.FAILED),
                states.idsWithStatus(TaskStatus.SKIPPED), List.of(), List.of(), List.of(issue), usage,
                execution.graph().levels());
    }

    private void onCircuitTransition(String executionId, String capability, CircuitBreaker.State state) {
        if (state == CircuitBreaker.State.OPEN) {
            eventBus.publish(OrchestrationEvent.of("circuit.opened", executionId, null,
                    Map.of("capability", capability)));
        }
    }

    private void requireCapabilities(TaskGraph graph) {
        for (var task : graph.tasks()) {
            if (!registry.supports(task.capability())) {
                throw new UnknownCapabilityException(task.id(), task.capability());
            }
        }
    }

    private Execution require(String executionId) {
        var execution = executions.get(executionId);
        if (execution == null) {
            throw new ExecutionNotFoundException(executionId);
        }
        return execution;
    }

    private void register(Execution execution) {
        executions.put(execution.id(), execution);
        executionOrder.addLast(execution.id());
        int retained = Math.max(1, properties.getRun().getRetainedExecutions());
        int excess = executionOrder.size() - retained;
        for (var it = executionOrder.iterator(); excess > 0 && it.hasNext(); ) {
            var candidate = executions.get(it.next());
            if (candidate == null || !candidate.isRunning()) {
                it.remove();
                if (candidate != null) {
                    executions.remove(candidate.id());
                    eventBus.release(candidate.id());
                    log.debug("Evicted execution {} from registry", candidate.id());
                }
                excess--;
            }
        }
    }
}
