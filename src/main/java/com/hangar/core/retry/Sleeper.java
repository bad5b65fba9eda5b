package com.hangar.core.retry;

import java.time.Duration;

/**
 * Pause between retry attempts. Swapped for a recording fake in tests.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());
}
