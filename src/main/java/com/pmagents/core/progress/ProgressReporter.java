package com.pmagents.core.progress;

import com.pmagents.core.events.EventBus;
import com.pmagents.core.events.OrchestrationEvent;
import com.pmagents.core.model.ProgressUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Publishes a {@code progress.update} event for one run on a fixed interval until closed.
 */
public class ProgressReporter implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProgressReporter.class);

    private final String executionId;
    private final ProgressMonitor monitor;
    private final EventBus eventBus;
    private final ScheduledExecutorService scheduler;

    public ProgressReporter(String executionId, ProgressMonitor monitor, EventBus eventBus) {
        this.executionId = executionId;
        this.monitor = monitor;
        this.eventBus = eventBus;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "progress-" + executionId);
            t.setDaemon(true);
            return t;
        });
    }

    public void start(Duration interval) {
        long millis = Math.max(1, interval.toMillis());
        scheduler.scheduleAtFixedRate(this::publish, millis, millis, TimeUnit.MILLISECONDS);
        log.debug("Progress reporting every {}ms for execution {}", millis, executionId);
    }

    /**
     * Publish the current progress immediately.
     */
    public void publish() {
        try {
            eventBus.publish(OrchestrationEvent.of("progress.update", executionId, null, toPayload(monitor.snapshot())));
        } catch (RuntimeException e) {
            log.warn("Failed to publish progress for execution {}: {}", executionId, e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }

    static Map<String, Object> toPayload(ProgressUpdate update) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("percentage", update.percentage());
        payload.put("tasksInProgress", update.tasksInProgress());
        payload.put("tasksPending", update.tasksPending());
        payload.put("tasksBlocked", update.tasksBlocked());
        payload.put("estimatedCompletionMs", update.estimatedCompletion().toMillis());
        return payload;
    }
}
