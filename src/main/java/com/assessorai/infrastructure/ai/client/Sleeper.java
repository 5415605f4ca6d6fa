package com.assessorai.infrastructure.ai.client;

import java.time.Duration;

/**
 * Blocks the calling thread between retries.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper threadSleep() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
