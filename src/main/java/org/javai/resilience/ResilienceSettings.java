package org.javai.resilience;

import org.javai.resilience.breaker.CircuitBreakerConfig;
import org.javai.resilience.retry.RetryConfig;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;

/**
 * Default breaker and retry configuration for a {@link ResilienceManager}.
 *
 * <p>Each value is resolved from a system property, then an environment variable,
 * then a built-in default:</p>
 * <ul>
 *   <li>{@code resilience.breaker.failure-threshold} / {@code RESILIENCE_BREAKER_FAILURE_THRESHOLD} (5)</li>
 *   <li>{@code resilience.breaker.recovery-timeout-ms} / {@code RESILIENCE_BREAKER_RECOVERY_TIMEOUT_MS} (60000)</li>
 *   <li>{@code resilience.breaker.monitoring-window-ms} / {@code RESILIENCE_BREAKER_MONITORING_WINDOW_MS} (300000)</li>
 *   <li>{@code resilience.breaker.minimum-requests} / {@code RESILIENCE_BREAKER_MINIMUM_REQUESTS} (3)</li>
 *   <li>{@code resilience.retry.max-attempts} / {@code RESILIENCE_RETRY_MAX_ATTEMPTS} (3)</li>
 *   <li>{@code resilience.retry.base-delay-ms} / {@code RESILIENCE_RETRY_BASE_DELAY_MS} (1000)</li>
 *   <li>{@code resilience.retry.max-delay-ms} / {@code RESILIENCE_RETRY_MAX_DELAY_MS} (30000)</li>
 *   <li>{@code resilience.retry.backoff-multiplier} / {@code RESILIENCE_RETRY_BACKOFF_MULTIPLIER} (2.0)</li>
 *   <li>{@code resilience.retry.jitter} / {@code RESILIENCE_RETRY_JITTER} (true)</li>
 * </ul>
 *
 * @param circuitBreaker Configuration for breakers created without an explicit config
 * @param retry Configuration for retries without a per-call override
 */
public record ResilienceSettings(CircuitBreakerConfig circuitBreaker, RetryConfig retry) {

    public ResilienceSettings {
        Objects.requireNonNull(circuitBreaker, "circuitBreaker must not be null");
        Objects.requireNonNull(retry, "retry must not be null");
    }

    public static ResilienceSettings defaults() {
        return new ResilienceSettings(CircuitBreakerConfig.defaults(), RetryConfig.defaults());
    }

    /**
     * Resolves settings from system properties and environment variables.
     *
     * @throws IllegalStateException if a value is present but malformed
     */
    public static ResilienceSettings fromEnvironment() {
        return resolve(System::getProperty, System::getenv);
    }

    /**
     * Resolves settings from the given lookups. Package-private for testing.
     */
    static ResilienceSettings resolve(Function<String, String> properties, Function<String, String> environment) {
        Resolver r = new Resolver(properties, environment);

        CircuitBreakerConfig breaker = new CircuitBreakerConfig(
                r.intValue("resilience.breaker.failure-threshold", CircuitBreakerConfig.DEFAULT_FAILURE_THRESHOLD),
                Duration.ofMillis(r.longValue("resilience.breaker.recovery-timeout-ms",
                        CircuitBreakerConfig.DEFAULT_RECOVERY_TIMEOUT.toMillis())),
                Duration.ofMillis(r.longValue("resilience.breaker.monitoring-window-ms",
                        CircuitBreakerConfig.DEFAULT_MONITORING_WINDOW.toMillis())),
                r.intValue("resilience.breaker.minimum-requests", CircuitBreakerConfig.DEFAULT_MINIMUM_REQUESTS));

        RetryConfig defaults = RetryConfig.defaults();
        RetryConfig retry = RetryConfig.builder()
                .maxAttempts(r.intValue("resilience.retry.max-attempts", defaults.maxAttempts()))
                .baseDelay(Duration.ofMillis(r.longValue("resilience.retry.base-delay-ms", defaults.baseDelay().toMillis())))
                .maxDelay(Duration.ofMillis(r.longValue("resilience.retry.max-delay-ms", defaults.maxDelay().toMillis())))
                .backoffMultiplier(r.doubleValue("resilience.retry.backoff-multiplier", defaults.backoffMultiplier()))
                .jitter(r.booleanValue("resilience.retry.jitter", defaults.jitter()))
                .build();

        return new ResilienceSettings(breaker, retry);
    }

    /**
     * Maps a property name to its environment variable, e.g.
     * {@code resilience.retry.max-attempts} to {@code RESILIENCE_RETRY_MAX_ATTEMPTS}.
     */
    static String envVarFor(String property) {
        return property.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
    }

    private static final class Resolver {
        private final Function<String, String> properties;
        private final Function<String, String> environment;

        private Resolver(Function<String, String> properties, Function<String, String> environment) {
            this.properties = properties;
            this.environment = environment;
        }

        private String raw(String property) {
            String value = properties.apply(property);
            if (value == null || value.isBlank()) {
                value = environment.apply(envVarFor(property));
            }
            return value == null || value.isBlank() ? null : value.trim();
        }

        int intValue(String property, int defaultValue) {
            String value = raw(property);
            if (value == null) {
                return defaultValue;
            }
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw malformed(property, value, e);
            }
        }

        long longValue(String property, long defaultValue) {
            String value = raw(property);
            if (value == null) {
                return defaultValue;
            }
            try {
                return Long.parseLong(value);
            } catch (NumberFormatException e) {
                throw malformed(property, value, e);
            }
        }

        double doubleValue(String property, double defaultValue) {
            String value = raw(property);
            if (value == null) {
                return defaultValue;
            }
            try {
                return Double.parseDouble(value);
            } catch (NumberFormatException e) {
                throw malformed(property, value, e);
            }
        }

        boolean booleanValue(String property, boolean defaultValue) {
            String value = raw(property);
            if (value == null) {
                return defaultValue;
            }
            if (value.equalsIgnoreCase("true")) {
                return true;
            }
            if (value.equalsIgnoreCase("false")) {
                return false;
            }
            throw malformed(property, value, null);
        }

        private static IllegalStateException malformed(String property, String value, Exception cause) {
            return new IllegalStateException(
                    "Invalid configuration: system property '" + property +
                    "' or environment variable '" + envVarFor(property) +
                    "' has malformed value '" + value + "'", cause);
        }
    }
}
