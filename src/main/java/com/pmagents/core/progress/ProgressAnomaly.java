package com.pmagents.core.progress;

import java.time.Duration;

/**
 * A task that took more than twice its estimate. Informational only.
 *
 * @param taskId   the slow task
 * @param expected estimated duration (estimated cost x cost unit)
 * @param actual   measured duration
 */
public record ProgressAnomaly(String taskId, Duration expected, Duration actual) {

    public String describe() {
        return "Task " + taskId + " took " + actual.toMillis() + "ms, more than twice its estimate of "
                + expected.toMillis() + "ms";
    }
}
