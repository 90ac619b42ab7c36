package org.javai.resilience.breaker;

/**
 * Receives {@link CircuitBreakerEvent}s. Registered when the breaker is built.
 *
 * <p>Listeners are invoked on the calling thread after the breaker has released its
 * lock. A listener that throws is logged and skipped.</p>
 */
@FunctionalInterface
public interface CircuitBreakerListener {

    void onEvent(CircuitBreakerEvent event);
}
