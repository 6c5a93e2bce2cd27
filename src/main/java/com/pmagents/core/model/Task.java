package com.pmagents.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Set;

/**
 * A single unit of work in a task graph, executed by a worker of the given capability.
 * <p>
 * Tasks are immutable; their execution status is tracked separately by the scheduler.
 *
 * @param id                 unique identifier (e.g. "TASK-001")
 * @param description        what this task should accomplish
 * @param capability         worker type required (e.g. "code-generator", "doc-generator")
 * @param dependencies       IDs of tasks in the same graph that must complete first
 * @param priority           scheduling priority; defaults to {@link TaskPriority#MEDIUM}
 * @param estimatedCost      opaque budget units, used for progress estimation
 * @param deliverableSpecs   artifacts the worker is expected to produce
 * @param validationCriteria acceptance predicates forwarded to the worker
 */
public record Task(
    String id,
    String description,
    String capability,
    Set<String> dependencies,
    TaskPriority priority,
    double estimatedCost,
    List<DeliverableSpec> deliverableSpecs,
    List<String> validationCriteria
) implements Serializable {

    public Task {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Task id must not be blank");
        }
        if (capability == null || capability.isBlank()) {
            throw new IllegalArgumentException("Task " + id + " has no capability");
        }
        if (estimatedCost < 0) {
            throw new IllegalArgumentException("Task " + id + " has negative estimated cost");
        }
        description = description != null ? description : "";
        dependencies = dependencies != null ? Set.copyOf(dependencies) : Set.of();
        priority = priority != null ? priority : TaskPriority.MEDIUM;
        deliverableSpecs = deliverableSpecs != null ? List.copyOf(deliverableSpecs) : List.of();
        validationCriteria = validationCriteria != null ? List.copyOf(validationCriteria) : List.of();
    }

    /**
     * Convenience factory for a task with no deliverable specs or validation criteria.
     */
    public static Task of(String id, String capability, Set<String> dependencies) {
        return new Task(id, "", capability, dependencies, TaskPriority.MEDIUM, 1.0, List.of(), List.of());
    }
}
