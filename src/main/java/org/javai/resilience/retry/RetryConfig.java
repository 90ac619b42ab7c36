package org.javai.resilience.retry;

import org.javai.resilience.ClassifiedException;
import org.javai.resilience.ErrorKind;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Bounded retry with exponential backoff.
 *
 * @param maxAttempts Total attempts including the first (at least 1)
 * @param baseDelay Delay before the second attempt
 * @param maxDelay Upper bound for any single delay
 * @param backoffMultiplier Growth factor applied per attempt
 * @param jitter Whether delays are perturbed by up to 25% either way
 * @param retryableKinds Kinds that may be retried
 */
public record RetryConfig(
        int maxAttempts,
        Duration baseDelay,
        Duration maxDelay,
        double backoffMultiplier,
        boolean jitter,
        Set<ErrorKind> retryableKinds
) {

    public static final Set<ErrorKind> DEFAULT_RETRYABLE_KINDS = Set.copyOf(EnumSet.of(
            ErrorKind.NETWORK, ErrorKind.TIMEOUT, ErrorKind.RATE_LIMIT, ErrorKind.API));

    public RetryConfig {
        Objects.requireNonNull(baseDelay, "baseDelay must not be null");
        Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        Objects.requireNonNull(retryableKinds, "retryableKinds must not be null");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, was: " + maxAttempts);
        }
        if (baseDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("delays must not be negative");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1, was: " + backoffMultiplier);
        }
        retryableKinds = Set.copyOf(retryableKinds);
    }

    public static RetryConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder initialised from this config, for per-call overrides.
     */
    public Builder toBuilder() {
        return new Builder()
                .maxAttempts(maxAttempts)
                .baseDelay(baseDelay)
                .maxDelay(maxDelay)
                .backoffMultiplier(backoffMultiplier)
                .jitter(jitter)
                .retryableKinds(retryableKinds);
    }

    /**
     * The un-jittered delay after the given attempt (0-based):
     * {@code min(maxDelay, baseDelay * backoffMultiplier^attempt)}.
     */
    public Duration delayFor(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0, was: " + attempt);
        }
        double millis = baseDelay.toMillis() * Math.pow(backoffMultiplier, attempt);
        double capped = Math.min(maxDelay.toMillis(), millis);
        return Duration.ofMillis(Math.round(capped));
    }

    /**
     * A failure is retried only if it is marked retryable and its kind is in {@link #retryableKinds()}.
     */
    public boolean isRetryable(ClassifiedException error) {
        return error.isRetryable() && retryableKinds.contains(error.kind());
    }

    public static final class Builder {
        private int maxAttempts = 3;
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(30);
        private double backoffMultiplier = 2.0;
        private boolean jitter = true;
        private Set<ErrorKind> retryableKinds = DEFAULT_RETRYABLE_KINDS;

        private Builder() {}

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = Objects.requireNonNull(baseDelay);
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = Objects.requireNonNull(maxDelay);
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder jitter(boolean jitter) {
            this.jitter = jitter;
            return this;
        }

        public Builder retryableKinds(Set<ErrorKind> retryableKinds) {
            this.retryableKinds = Objects.requireNonNull(retryableKinds);
            return this;
        }

        public RetryConfig build() {
            return new RetryConfig(maxAttempts, baseDelay, maxDelay, backoffMultiplier, jitter, retryableKinds);
        }
    }
}
