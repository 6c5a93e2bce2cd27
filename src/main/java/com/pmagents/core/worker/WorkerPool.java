package com.pmagents.core.worker;

import com.pmagents.core.config.ExecutionSettings;
import com.pmagents.core.escalation.EscalationPolicy;
import com.pmagents.core.metrics.OrchestrationMetrics;
import com.pmagents.core.model.TaskPriority;
import com.pmagents.core.scheduler.RunDeadline;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiConsumer;

/**
 * Bounded pool of worker slots for one run.
 *
 * <p>Each capability gets a priority-ordered slot queue sized by {@link ExecutionSettings#limitFor(String)}
 * and a single {@link WorkerProxy} (with its circuit breaker) shared by all tasks of that
 * capability. Worker calls execute on the pool's call executor, which {@link #close()}
 * shuts down, interrupting any straggling call.
 */
public class WorkerPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);
    private static final AtomicInteger POOL_SEQ = new AtomicInteger();

    private final WorkerRegistry registry;
    private final ExecutionSettings settings;
    private final EscalationPolicy escalationPolicy;
    private final ResultValidator validator = new ResultValidator();
    private final Clock clock;
    private final Sleeper sleeper;
    private final OrchestrationMetrics metrics;
    private final BiConsumer<String, CircuitBreaker.State> circuitListener;
    private final ExecutorService callExecutor;

    private final ConcurrentHashMap<String, WorkerProxy> proxies = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CapabilitySlots> slots = new ConcurrentHashMap<>();

    public WorkerPool(WorkerRegistry registry, ExecutionSettings settings, EscalationPolicy escalationPolicy,
                      Clock clock, Sleeper sleeper, OrchestrationMetrics metrics,
                      BiConsumer<String, CircuitBreaker.State> circuitListener) {
        this.registry = registry;
        this.settings = settings;
        this.escalationPolicy = escalationPolicy;
        this.clock = clock;
        this.sleeper = sleeper;
        this.metrics = metrics;
        this.circuitListener = circuitListener != null ? circuitListener : (c, s) -> {};
        int poolId = POOL_SEQ.incrementAndGet();
        AtomicInteger threadSeq = new AtomicInteger();
        this.callExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "worker-call-" + poolId + "-" + threadSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    WorkerPool(WorkerRegistry registry, ExecutionSettings settings) {
        this(registry, settings, new EscalationPolicy(), Clock.systemUTC(), Sleeper.SYSTEM, null, null);
    }

    /**
     * Acquire a slot for the capability, blocking while it is at capacity.
     *
     * @throws InterruptedException     if interrupted while waiting
     * @throws IllegalArgumentException if no worker serves the capability
     */
    public WorkerLease acquire(String capability) throws InterruptedException {
        var reservation = reserve(capability, TaskPriority.MEDIUM);
        reservation.slots().await(reservation, -1);
        return new WorkerLease(proxyFor(capability), reservation.slots());
    }

    /**
     * Acquire a slot, waiting no longer than the run deadline allows.
     *
     * @throws com.pmagents.core.scheduler.ResourceExhaustedException if the deadline passes while waiting
     */
    public WorkerLease acquire(String capability, RunDeadline deadline) throws InterruptedException {
        return acquire(reserve(capability, TaskPriority.MEDIUM), deadline);
    }

    /**
     * Queue for a slot of the capability. Reservations are served by priority, then in the
     * order they were taken.
     *
     * @throws IllegalArgumentException if no worker serves the capability
     */
    public SlotReservation reserve(String capability, TaskPriority priority) {
        proxyFor(capability);
        return slotsFor(capability).reserve(priority);
    }

    /**
     * Wait for a reserved slot, no longer than the run deadline allows.
     *
     * @throws com.pmagents.core.scheduler.ResourceExhaustedException if the deadline passes while waiting
     */
    public WorkerLease acquire(SlotReservation reservation, RunDeadline deadline) throws InterruptedException {
        var slots = reservation.slots();
        if (!slots.await(reservation, Math.max(0, deadline.remaining().toMillis()))) {
            throw deadline.exhausted(null);
        }
        return new WorkerLease(proxyFor(reservation.capability()), slots);
    }

    public WorkerProxy proxyFor(String capability) {
        return proxies.computeIfAbsent(capability, this::createProxy);
    }

    /**
     * Slots currently free for the capability.
     */
    public int availableSlots(String capability) {
        return slotsFor(capability).available();
    }

    /**
     * Worker calls made so far, per capability.
     */
    public Map<String, Integer> attemptsByCapability() {
        var result = new TreeMap<String, Integer>();
        proxies.forEach((cap, proxy) -> result.put(cap, proxy.attempts()));
        return result;
    }

    public int totalAttempts() {
        return proxies.values().stream().mapToInt(WorkerProxy::attempts).sum();
    }

    @Override
    public void close() {
        var stragglers = callExecutor.shutdownNow();
        if (!stragglers.isEmpty()) {
            log.info("Worker pool closed with {} queued calls discarded", stragglers.size());
        }
    }

    private CapabilitySlots slotsFor(String capability) {
        return slots.computeIfAbsent(capability, cap -> new CapabilitySlots(cap, settings.limitFor(cap)));
    }

    private WorkerProxy createProxy(String capability) {
        var worker = registry.require(capability);
        var breaker = CapabilityCircuitBreakers.create(capability, settings.failureThreshold(),
                settings.resetTimeout(), settings.retryPolicy().maxTimeout().plusMinutes(1), clock,
                (cap, state) -> {
                    if (metrics != null) {
                        metrics.recordCircuitTransition(cap, state.name());
                    }
                    circuitListener.accept(cap, state);
                });
        log.debug("Created proxy for capability '{}' (slots={})", capability, settings.limitFor(capability));
        return new WorkerProxy(capability, worker, breaker, settings.retryPolicy(), escalationPolicy,
                validator, callExecutor, sleeper, metrics);
    }
}
