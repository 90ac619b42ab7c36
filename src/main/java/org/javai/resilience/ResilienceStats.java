package org.javai.resilience;

import org.javai.resilience.breaker.CircuitBreakerMetrics;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * A snapshot of what a {@link ResilienceManager} has seen. Maps are sorted by key.
 *
 * @param errorCounts Errors per {@code component.KIND} since the last reset
 * @param recentErrorCounts Errors per {@code component.KIND} within the last hour
 * @param circuitBreakers Metrics per breaker name
 */
public record ResilienceStats(
        Map<String, Long> errorCounts,
        Map<String, Integer> recentErrorCounts,
        Map<String, CircuitBreakerMetrics> circuitBreakers
) {

    public ResilienceStats {
        errorCounts = Collections.unmodifiableMap(new TreeMap<>(errorCounts));
        recentErrorCounts = Collections.unmodifiableMap(new TreeMap<>(recentErrorCounts));
        circuitBreakers = Collections.unmodifiableMap(new TreeMap<>(circuitBreakers));
    }
}
