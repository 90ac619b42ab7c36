package org.javai.resilience.breaker;

import org.javai.resilience.retry.RetryConfig;

import java.time.Duration;
import java.util.Locale;

/**
 * Preset breaker and retry tuning for common kinds of upstream data provider.
 * Fast-moving, cheap sources trip early and recover quickly; expensive fundamental
 * and market data sources tolerate more failures and back off harder.
 */
public enum ProviderProfile {
    NEWS(2, Duration.ofSeconds(30), Duration.ofMillis(500), Duration.ofSeconds(15), 1.5),
    SOCIAL(2, Duration.ofSeconds(45), Duration.ofSeconds(1), Duration.ofSeconds(20), 2.0),
    FUNDAMENTALS(4, Duration.ofSeconds(90), Duration.ofSeconds(2), Duration.ofSeconds(60), 2.5),
    MARKET_DATA(4, Duration.ofSeconds(90), Duration.ofSeconds(2), Duration.ofSeconds(60), 2.5);

    static final Duration MONITORING_WINDOW = Duration.ofMinutes(5);
    static final int MINIMUM_REQUESTS = 2;

    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;

    ProviderProfile(int failureThreshold, Duration recoveryTimeout,
                    Duration initialDelay, Duration maxDelay, double multiplier) {
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout = recoveryTimeout;
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
    }

    public CircuitBreakerConfig circuitBreakerConfig() {
        return new CircuitBreakerConfig(failureThreshold, recoveryTimeout, MONITORING_WINDOW, MINIMUM_REQUESTS);
    }

    public RetryConfig retryConfig() {
        return RetryConfig.builder()
                .baseDelay(initialDelay)
                .maxDelay(maxDelay)
                .backoffMultiplier(multiplier)
                .jitter(true)
                .build();
    }

    /**
     * Breaker name for an operation against a provider of this kind, e.g. {@code news-headlines}.
     */
    public String breakerName(String operation) {
        return name().toLowerCase(Locale.ROOT).replace('_', '-') + "-" + operation;
    }
}
