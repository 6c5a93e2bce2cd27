package com.pmagents.core.model;

import java.io.Serializable;
import java.time.Duration;

/**
 * Periodic progress snapshot for a long-running execution.
 *
 * @param percentage          share of tasks in a terminal state
 * @param tasksInProgress     tasks currently running
 * @param tasksPending        tasks not yet started
 * @param tasksBlocked        pending tasks waiting on an incomplete dependency
 * @param estimatedCompletion estimated remaining time
 */
public record ProgressUpdate(
    int percentage,
    int tasksInProgress,
    int tasksPending,
    int tasksBlocked,
    Duration estimatedCompletion
) implements Serializable {}
