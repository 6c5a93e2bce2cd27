package com.pmagents.core.events;

import com.pmagents.core.model.ExecuteResponse;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during graph execution, used for SSE streaming and progress listeners.
 *
 * @param eventType   event type (e.g. "execution.created", "task.started", "progress.update")
 * @param executionId the execution this event belongs to
 * @param taskId      the task this event relates to (nullable for execution-level events)
 * @param payload     arbitrary key-value data associated with the event
 * @param timestamp   when the event occurred
 */
public record OrchestrationEvent(
    String eventType,
    String executionId,
    String taskId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String COMPLETED = "execution.completed";

    public static OrchestrationEvent of(String eventType, String executionId, String taskId,
                                        Map<String, Object> payload) {
        return new OrchestrationEvent(eventType, executionId, taskId, payload, Instant.now());
    }

    /** The terminal event of an execution, summarizing its final response. */
    public static OrchestrationEvent executionCompleted(ExecuteResponse response) {
        return of(COMPLETED, response.executionId(), null,
                Map.of("status", response.status().name(),
                       "completed", response.completedTaskIds().size(),
                       "failed", response.failedTaskIds().size(),
                       "skipped", response.skippedTaskIds().size()));
    }
}
