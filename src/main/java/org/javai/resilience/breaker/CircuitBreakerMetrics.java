package org.javai.resilience.breaker;

import java.time.Instant;

/**
 * A point-in-time snapshot of a circuit breaker.
 *
 * @param name The breaker name
 * @param state The current state
 * @param failuresInWindow Failures counted toward the threshold
 * @param successesInWindow Successful calls within the monitoring window
 * @param requestsInWindow Completed calls within the monitoring window
 * @param errorRate Failures over completed calls within the window (0 when there were none)
 * @param totalRequests Completed calls since creation or reset
 * @param totalFailures Failed calls since creation or reset
 * @param rejectedCalls Calls rejected without invoking the operation
 * @param lastFailureAt The last failure (may be null)
 * @param lastSuccessAt The last success (may be null)
 * @param nextAttemptAt When an open breaker admits its next trial (null unless OPEN)
 * @param health Health derived from state and error rate
 */
public record CircuitBreakerMetrics(
        String name,
        CircuitState state,
        int failuresInWindow,
        int successesInWindow,
        int requestsInWindow,
        double errorRate,
        long totalRequests,
        long totalFailures,
        long rejectedCalls,
        Instant lastFailureAt,
        Instant lastSuccessAt,
        Instant nextAttemptAt,
        HealthStatus health
) {
}
