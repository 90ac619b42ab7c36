package org.javai.resilience.breaker;

/**
 * States of a {@link CircuitBreaker}.
 */
public enum CircuitState {
    /** Normal operation, calls pass through. */
    CLOSED,

    /** Calls are rejected until the recovery timeout elapses. */
    OPEN,

    /** A single trial call is probing whether the dependency recovered. */
    HALF_OPEN
}
