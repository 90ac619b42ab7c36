package org.javai.resilience.retry;

import org.javai.resilience.ClassifiedException;
import org.javai.resilience.RetriesExhaustedException;

import java.time.Duration;

/**
 * Observes a {@link RetryEngine} as it works through attempts.
 */
public interface RetryListener {

    /**
     * Called for every failed attempt, before the retry decision.
     *
     * @param error The classified failure
     * @param attemptNumber The attempt that failed (1-based)
     */
    default void onFailure(ClassifiedException error, int attemptNumber) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Called when another attempt will follow after the given delay.
     */
    default void onRetry(ClassifiedException error, int attemptNumber, Duration delay) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Called once when every attempt failed.
     */
    default void onExhausted(RetriesExhaustedException error) {
        // Default: no-op. Implementations may override.
    }

    static RetryListener noOp() {
        return new RetryListener() {};
    }
}
