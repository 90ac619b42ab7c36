package org.javai.resilience.breaker;

/**
 * Coarse health of a dependency guarded by a circuit breaker.
 */
public enum HealthStatus {
    HEALTHY,
    DEGRADED,
    UNHEALTHY
}
