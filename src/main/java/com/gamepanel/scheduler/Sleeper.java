package com.gamepanel.scheduler;

import java.time.Duration;

/**
 * Blocking wait used between tasks. Swappable so chains can be exercised without real delays.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper system() {
        return duration -> {
            if (!duration.isNegative() && !duration.isZero()) {
                Thread.sleep(duration.toMillis());
            }
        };
    }
}
