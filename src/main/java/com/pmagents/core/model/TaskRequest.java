package com.pmagents.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Outbound request sent to a capability worker, one per task attempt.
 *
 * @param taskId             the task being executed
 * @param description        what the task should accomplish
 * @param capability         the capability being invoked
 * @param context            caller-supplied context data
 * @param deliverableSpecs   artifacts the worker is expected to produce
 * @param validationCriteria acceptance predicates the worker should satisfy
 * @param attempt            1-based attempt number
 */
public record TaskRequest(
    String taskId,
    String description,
    String capability,
    Map<String, Object> context,
    List<DeliverableSpec> deliverableSpecs,
    List<String> validationCriteria,
    int attempt
) implements Serializable {

    public static TaskRequest forAttempt(Task task, Map<String, Object> context, int attempt) {
        return new TaskRequest(task.id(), task.description(), task.capability(),
                context != null ? context : Map.of(),
                task.deliverableSpecs(), task.validationCriteria(), attempt);
    }
}
