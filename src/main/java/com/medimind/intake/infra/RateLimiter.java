package com.medimind.intake.infra;

import java.util.function.Supplier;

/**
 * Throttles calls to an external capability. Limits are tracked per key, so
 * independent callers never starve each other.
 */
public interface RateLimiter {

    /**
     * Blocks until {@code permits} are available for {@code key}.
     */
    void acquire(String key, int permits);

    /**
     * Time-window limiters refill on their own and have nothing to give back.
     */
    default void release(String key, int permits) {
    }

    default <T> T execute(String key, int permits, Supplier<T> task) {
        try {
            acquire(key, permits);
            return task.get();
        } finally {
            release(key, permits);
        }
    }
}
