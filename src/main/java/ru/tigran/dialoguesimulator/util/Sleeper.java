package ru.tigran.dialoguesimulator.util;

import java.time.Duration;

/**
 * Blocking pause used by the rate limiter, retry backoff and experiment pacing.
 * Swapped for a recording implementation in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> {
        if (duration != null && !duration.isNegative() && !duration.isZero()) {
            Thread.sleep(duration.toMillis());
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
