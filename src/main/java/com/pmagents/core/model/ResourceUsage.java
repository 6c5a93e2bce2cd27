package com.pmagents.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.util.Map;

/**
 * Resources consumed by a run.
 *
 * @param elapsed             wall-clock duration of the run
 * @param budget              the run budget that applied
 * @param costConsumed        estimated cost of completed tasks
 * @param workerCalls         total worker attempts
 * @param attemptsByCapability worker attempts per capability
 */
public record ResourceUsage(
    Duration elapsed,
    Duration budget,
    double costConsumed,
    int workerCalls,
    Map<String, Integer> attemptsByCapability
) implements Serializable {}
