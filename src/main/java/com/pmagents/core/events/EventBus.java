package com.pmagents.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Routes {@link OrchestrationEvent}s to the listeners of their execution and to listeners
 * of every execution.
 *
 * <p>Listener lists of an execution are created and removed atomically with the listeners
 * they hold, so a listener registering while the last one leaves is never lost. When the
 * engine forgets an execution it calls {@link #release(String)} to drop whatever listeners
 * are still attached to it.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, List<Consumer<OrchestrationEvent>>> listenersByExecution =
            new ConcurrentHashMap<>();
    private final List<Consumer<OrchestrationEvent>> allExecutions = new CopyOnWriteArrayList<>();

    public void publish(OrchestrationEvent event) {
        log.debug("Event {} for execution {} task {}", event.eventType(), event.executionId(), event.taskId());
        var listeners = listenersByExecution.get(event.executionId());
        if (listeners != null) {
            listeners.forEach(listener -> notify(listener, event));
        }
        allExecutions.forEach(listener -> notify(listener, event));
    }

    /**
     * Listen to one execution's events until the returned subscription is cancelled or the
     * execution is released.
     */
    public Subscription subscribe(String executionId, Consumer<OrchestrationEvent> listener) {
        listenersByExecution.compute(executionId, (id, listeners) -> {
            var target = listeners != null ? listeners : new CopyOnWriteArrayList<Consumer<OrchestrationEvent>>();
            target.add(listener);
            return target;
        });
        return () -> listenersByExecution.computeIfPresent(executionId, (id, listeners) -> {
            listeners.remove(listener);
            return listeners.isEmpty() ? null : listeners;
        });
    }

    public Subscription subscribeAll(Consumer<OrchestrationEvent> listener) {
        allExecutions.add(listener);
        return () -> allExecutions.remove(listener);
    }

    /**
     * Drop every listener still attached to the execution.
     *
     * @return how many listeners were dropped
     */
    public int release(String executionId) {
        var dropped = listenersByExecution.remove(executionId);
        int count = dropped != null ? dropped.size() : 0;
        if (count > 0) {
            log.debug("Released {} listener(s) of execution {}", count, executionId);
        }
        return count;
    }

    public int listenerCount(String executionId) {
        var listeners = listenersByExecution.get(executionId);
        return listeners != null ? listeners.size() : 0;
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private static void notify(Consumer<OrchestrationEvent> listener, OrchestrationEvent event) {
        try {
            listener.accept(event);
        } catch (RuntimeException e) {
            log.warn("Listener failed on {} for execution {}: {}", event.eventType(), event.executionId(),
                    e.getMessage(), e);
        }
    }
}
