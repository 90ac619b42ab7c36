package org.javai.resilience.retry;

import java.time.Duration;

/**
 * Waits out a backoff delay. Replaceable so tests can record delays instead of sleeping.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;
}
