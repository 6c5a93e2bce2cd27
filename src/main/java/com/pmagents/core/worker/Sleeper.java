package com.pmagents.core.worker;

import java.time.Duration;

/**
 * Blocking pause used between retry attempts. Replaced in tests to avoid real delays.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
