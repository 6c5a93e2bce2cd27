package com.pmagents.core.scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Overall budget of one run, shared by the scheduler and every in-flight worker call.
 * Also carries cooperative cancellation requested by the caller.
 */
public class RunDeadline {

    private final Clock clock;
    private final Duration budget;
    private final Instant expiresAt;
    private volatile String cancelReason;

    public RunDeadline(Duration budget, Clock clock) {
        this.clock = clock;
        this.budget = budget;
        this.expiresAt = clock.instant().plus(budget);
    }

    public Duration budget() {
        return budget;
    }

    public Duration remaining() {
        if (cancelReason != null) {
            return Duration.ZERO;
        }
        var left = Duration.between(clock.instant(), expiresAt);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public boolean isExpired() {
        return cancelReason != null || !clock.instant().isBefore(expiresAt);
    }

    public void cancel(String reason) {
        this.cancelReason = reason != null ? reason : "cancelled";
    }

    public boolean isCancelled() {
        return cancelReason != null;
    }

    /**
     * The error describing why the budget is gone, attributed to {@code taskId}.
     */
    public ResourceExhaustedException exhausted(String taskId) {
        if (cancelReason != null) {
            return new ResourceExhaustedException(taskId, "Run cancelled: " + cancelReason);
        }
        return new ResourceExhaustedException(taskId,
                "Run budget of " + budget.toMillis() + "ms exhausted"
                        + (taskId != null ? " while task " + taskId + " was in flight" : ""));
    }
}
