package com.pmagents.core.worker;

import java.time.Duration;

/**
 * Attempt budget, exponential backoff and timeout escalation for one task.
 *
 * @param maxRetries        maximum attempts per task (including the first)
 * @param initialBackoff    pause before the second attempt
 * @param maxBackoff        ceiling for the doubling backoff
 * @param timeoutMultiplier factor applied to the timeout after a timed-out attempt
 * @param maxTimeout        absolute ceiling for escalated timeouts
 */
public record RetryPolicy(
    int maxRetries,
    Duration initialBackoff,
    Duration maxBackoff,
    double timeoutMultiplier,
    Duration maxTimeout
) {

    public RetryPolicy {
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be at least 1");
        }
        if (timeoutMultiplier < 1.0) {
            throw new IllegalArgumentException("timeoutMultiplier must be >= 1.0");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(30), 1.5, Duration.ofMinutes(15));
    }

    /**
     * Pause before the given attempt: zero for the first, then 1x, 2x, 4x ... the initial
     * backoff, capped at {@link #maxBackoff()}.
     *
     * @param attempt 1-based attempt number
     */
    public Duration backoffBefore(int attempt) {
        if (attempt <= 1) {
            return Duration.ZERO;
        }
        long factor = 1L << Math.min(attempt - 2, 30);
        long millis = initialBackoff.toMillis() * factor;
        if (millis < 0 || millis > maxBackoff.toMillis()) {
            return maxBackoff;
        }
        return Duration.ofMillis(millis);
    }

    /**
     * Timeout for the attempt after one that timed out.
     */
    public Duration escalateTimeout(Duration current) {
        long next = (long) Math.ceil(current.toMillis() * timeoutMultiplier);
        return next > maxTimeout.toMillis() ? maxTimeout : Duration.ofMillis(next);
    }
}
