package com.wpanther.ticketbulkops.batch;

import java.time.Duration;

/**
 * Pauses the current thread; replaced in tests to observe pacing without waiting
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> {
        if (!duration.isZero() && !duration.isNegative()) {
            Thread.sleep(duration.toMillis());
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
