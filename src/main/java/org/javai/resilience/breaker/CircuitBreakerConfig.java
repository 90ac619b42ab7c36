package org.javai.resilience.breaker;

import java.time.Duration;
import java.util.Objects;

/**
 * Thresholds and timings for a {@link CircuitBreaker}.
 *
 * @param failureThreshold Failures within the monitoring window that open the circuit
 * @param recoveryTimeout How long the circuit stays open before admitting a trial call
 * @param monitoringWindow The sliding window over which failures are counted
 * @param minimumRequests Minimum failures within the window before the threshold is evaluated
 */
public record CircuitBreakerConfig(
        int failureThreshold,
        Duration recoveryTimeout,
        Duration monitoringWindow,
        int minimumRequests
) {

    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final Duration DEFAULT_RECOVERY_TIMEOUT = Duration.ofMinutes(1);
    public static final Duration DEFAULT_MONITORING_WINDOW = Duration.ofMinutes(5);
    public static final int DEFAULT_MINIMUM_REQUESTS = 3;

    public CircuitBreakerConfig {
        Objects.requireNonNull(recoveryTimeout, "recoveryTimeout must not be null");
        Objects.requireNonNull(monitoringWindow, "monitoringWindow must not be null");
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1, was: " + failureThreshold);
        }
        if (minimumRequests < 0) {
            throw new IllegalArgumentException("minimumRequests must be >= 0, was: " + minimumRequests);
        }
        if (recoveryTimeout.isNegative()) {
            throw new IllegalArgumentException("recoveryTimeout must not be negative");
        }
        if (monitoringWindow.isNegative() || monitoringWindow.isZero()) {
            throw new IllegalArgumentException("monitoringWindow must be positive");
        }
    }

    public static CircuitBreakerConfig defaults() {
        return new CircuitBreakerConfig(
                DEFAULT_FAILURE_THRESHOLD,
                DEFAULT_RECOVERY_TIMEOUT,
                DEFAULT_MONITORING_WINDOW,
                DEFAULT_MINIMUM_REQUESTS);
    }

    public static CircuitBreakerConfig ofMillis(
            int failureThreshold, long recoveryTimeoutMs, long monitoringWindowMs, int minimumRequests) {
        return new CircuitBreakerConfig(
                failureThreshold,
                Duration.ofMillis(recoveryTimeoutMs),
                Duration.ofMillis(monitoringWindowMs),
                minimumRequests);
    }

    /**
     * The number of failures within the window at which the circuit opens:
     * {@code max(minimumRequests, failureThreshold)}.
     */
    public int tripThreshold() {
        return Math.max(minimumRequests, failureThreshold);
    }

    public CircuitBreakerConfig withFailureThreshold(int threshold) {
        return new CircuitBreakerConfig(threshold, recoveryTimeout, monitoringWindow, minimumRequests);
    }

    public CircuitBreakerConfig withRecoveryTimeout(Duration timeout) {
        return new CircuitBreakerConfig(failureThreshold, timeout, monitoringWindow, minimumRequests);
    }

    public CircuitBreakerConfig withMonitoringWindow(Duration window) {
        return new CircuitBreakerConfig(failureThreshold, recoveryTimeout, window, minimumRequests);
    }

    public CircuitBreakerConfig withMinimumRequests(int minimum) {
        return new CircuitBreakerConfig(failureThreshold, recoveryTimeout, monitoringWindow, minimum);
    }
}
