package com.pmagents.dispatch.api;

import com.pmagents.core.events.EventBus;
import com.pmagents.core.events.OrchestrationEvent;
import com.pmagents.core.model.ExecuteResponse;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Bridges {@link EventBus} subscriptions to {@link SseEmitter} instances for SSE streaming.
 * <p>
 * Each connected client gets an emitter subscribed to the events of one execution. The
 * emitter is completed when the execution publishes {@code execution.completed}, or at once
 * when the execution had already finished. Its subscription is removed on completion, timeout
 * or error. Idle connections are kept open by periodic heartbeat comments.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    /** Default emitter timeout: 30 minutes (for long-running executions). */
    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private final EventBus eventBus;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventBus eventBus, long timeoutMs) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS, HEARTBEAT_INTERVAL_SECONDS, TimeUnit.SECONDS);
        log.info("SSE heartbeat scheduler started (interval={}s)", HEARTBEAT_INTERVAL_SECONDS);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("SSE heartbeat scheduler stopped");
    }

    private void sendHeartbeats() {
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException | IllegalStateException e) {
                // onError/onCompletion callbacks remove the registration
                log.debug("Heartbeat failed for execution {}: {}", registration.executionId, e.getMessage());
            }
        }
    }

    /**
     * Creates an SSE emitter that streams events for the given execution.
     * <p>
     * The subscription is registered before {@code finalResponse} is consulted, so an execution
     * that finished before or while the client connected still ends the stream with its
     * {@code execution.completed} event.
     */
    public SseEmitter createEmitter(String executionId, Supplier<Optional<ExecuteResponse>> finalResponse) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        var completed = new AtomicBoolean();

        EventBus.Subscription subscription = eventBus.subscribe(executionId,
                event -> sendEvent(emitter, completed, event));
        var registration = new EmitterRegistration(executionId, emitter, subscription);
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> cleanup(registration));
        emitter.onTimeout(() -> {
            log.debug("SSE emitter timed out for execution {}", executionId);
            cleanup(registration);
        });
        emitter.onError(ex -> {
            log.debug("SSE emitter error for execution {}: {}", executionId, ex.getMessage());
            cleanup(registration);
        });

        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Failed to send initial comment for execution {}: {}", executionId, e.getMessage());
        }

        var response = finalResponse.get();
        if (response.isPresent()) {
            log.info("Execution {} already finished, replaying its completion", executionId);
            sendEvent(emitter, completed, OrchestrationEvent.executionCompleted(response.get()));
            // completion callbacks only fire once the async request ends
            cleanup(registration);
        } else {
            log.info("SSE emitter created for execution {} (timeout={}ms)", executionId, timeoutMs);
        }
        return emitter;
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    private void sendEvent(SseEmitter emitter, AtomicBoolean completed, OrchestrationEvent event) {
        boolean terminal = OrchestrationEvent.COMPLETED.equals(event.eventType());
        if (terminal ? completed.getAndSet(true) : completed.get()) {
            return;
        }
        try {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("executionId", event.executionId());
            if (event.taskId() != null) {
                data.put("taskId", event.taskId());
            }
            data.putAll(event.payload());
            data.put("timestamp", event.timestamp().toString());

            emitter.send(SseEmitter.event()
                    .name(event.eventType())
                    .data(data));
            if (terminal) {
                emitter.complete();
            }
        } catch (IOException | IllegalStateException e) {
            log.debug("Failed to send SSE event {} for execution {}: {}",
                    event.eventType(), event.executionId(), e.getMessage());
        }
    }

    private void cleanup(EmitterRegistration registration) {
        registration.subscription.unsubscribe();
        if (!activeRegistrations.remove(registration)) {
            return;
        }
        log.debug("Cleaned up SSE registration for execution {}", registration.executionId);
    }

    private record EmitterRegistration(
            String executionId,
            SseEmitter emitter,
            EventBus.Subscription subscription
    ) {}
}
