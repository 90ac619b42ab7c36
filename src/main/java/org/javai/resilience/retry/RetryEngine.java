package org.javai.resilience.retry;

import org.javai.resilience.ClassifiedException;
import org.javai.resilience.ErrorContext;
import org.javai.resilience.ResilientOperation;
import org.javai.resilience.RetriesExhaustedException;
import org.javai.resilience.classify.DefaultErrorClassifier;
import org.javai.resilience.classify.ErrorClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.DoubleSupplier;

/**
 * Runs an operation with bounded retry and exponential backoff.
 *
 * <p>Each failure is classified; failures that are not retryable under the
 * {@link RetryConfig} are raised immediately as their {@link ClassifiedException}.
 * When every attempt fails, a {@link RetriesExhaustedException} wrapping the last
 * raw failure is raised.</p>
 *
 * <p>Backoff sleeps suspend only the calling thread. {@link #shutdown()} wakes every
 * sleeping caller, which then abandons its loop with a {@link RetryCancelledException}.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * RetryEngine engine = RetryEngine.builder().listener(listener).build();
 *
 * Headlines headlines = engine.execute(
 *     () -> breaker.execute(() -> newsApi.headlines(ticker)),
 *     ErrorContext.of("NewsFetcher", "headlines"),
 *     RetryConfig.defaults());
 * }</pre>
 */
public final class RetryEngine {

    private static final Logger log = LoggerFactory.getLogger(RetryEngine.class);

    static final double JITTER_FRACTION = 0.25;

    private final ErrorClassifier classifier;
    private final RetryListener listener;
    private final Sleeper sleeper;
    private final DoubleSupplier random;
    private final CountDownLatch shutdownSignal = new CountDownLatch(1);

    private RetryEngine(ErrorClassifier classifier, RetryListener listener, Sleeper sleeper, DoubleSupplier random) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
        this.sleeper = sleeper != null ? sleeper : this::awaitShutdown;
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Executes the operation, retrying according to the given config.
     *
     * @param operation The operation to run
     * @param context Where the operation runs, attached to classified failures
     * @param config Attempt limit, backoff and retryable kinds
     * @return The first successful result
     * @throws ClassifiedException if a failure is not retryable
     * @throws RetriesExhaustedException if every attempt failed
     * @throws RetryCancelledException if the engine shut down, or the thread was interrupted
     *         during backoff or by the operation itself
     */
    public <T> T execute(ResilientOperation<T> operation, ErrorContext context, RetryConfig config) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(context, "context must not be null");
        Objects.requireNonNull(config, "config must not be null");

        Exception lastError = null;
        for (int attempt = 0; attempt < config.maxAttempts(); attempt++) {
            ensureRunning();
            try {
                return operation.call();
            } catch (RetryCancelledException e) {
                throw e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RetryCancelledException("Interrupted during attempt " + (attempt + 1), e);
            } catch (Exception e) {
                lastError = e;
                ClassifiedException classified = classifier.classify(e, context);
                int attemptNumber = attempt + 1;
                notifyFailure(classified, attemptNumber);

                if (!config.isRetryable(classified)) {
                    log.debug("Not retrying [{}.{}]: {} is not retryable",
                            context.component(), context.operation(), classified.kind());
                    throw classified;
                }
                if (attemptNumber == config.maxAttempts()) {
                    break;
                }

                Duration delay = backoff(attempt, config);
                notifyRetry(classified, attemptNumber, delay);
                log.debug("Retrying [{}.{}] after attempt {} in {} ms",
                        context.component(), context.operation(), attemptNumber, delay.toMillis());
                sleep(delay);
            }
        }

        RetriesExhaustedException exhausted = new RetriesExhaustedException(config.maxAttempts(), lastError, context);
        notifyExhausted(exhausted);
        throw exhausted;
    }

    /**
     * Computes the delay to wait after the given attempt (0-based), with jitter if enabled.
     */
    Duration backoff(int attempt, RetryConfig config) {
        Duration base = config.delayFor(attempt);
        if (!config.jitter()) {
            return base;
        }
        double millis = base.toMillis();
        double offset = millis * JITTER_FRACTION * (random.getAsDouble() * 2 - 1);
        return Duration.ofMillis(Math.max(0L, Math.round(millis + offset)));
    }

    /**
     * Cancels every in-flight backoff and refuses further attempts.
     */
    public void shutdown() {
        if (shutdownSignal.getCount() > 0) {
            log.info("Retry engine shutting down");
        }
        shutdownSignal.countDown();
    }

    public boolean isShutdown() {
        return shutdownSignal.getCount() == 0;
    }

    private void ensureRunning() {
        if (isShutdown()) {
            throw new RetryCancelledException("Retry engine has been shut down");
        }
    }

    private void sleep(Duration delay) {
        if (!delay.isZero() && !delay.isNegative()) {
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RetryCancelledException("Interrupted during retry backoff", e);
            }
        }
        ensureRunning();
    }

    private void awaitShutdown(Duration delay) throws InterruptedException {
        shutdownSignal.await(delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void notifyFailure(ClassifiedException error, int attemptNumber) {
        try {
            listener.onFailure(error, attemptNumber);
        } catch (RuntimeException e) {
            logListenerError("onFailure", e);
        }
    }

    private void notifyRetry(ClassifiedException error, int attemptNumber, Duration delay) {
        try {
            listener.onRetry(error, attemptNumber, delay);
        } catch (RuntimeException e) {
            logListenerError("onRetry", e);
        }
    }

    private void notifyExhausted(RetriesExhaustedException error) {
        try {
            listener.onExhausted(error);
        } catch (RuntimeException e) {
            logListenerError("onExhausted", e);
        }
    }

    private void logListenerError(String method, RuntimeException e) {
        log.error("RetryListener.{} failed for {}", method, listener.getClass().getName(), e);
    }

    /**
     * Builder for configuring a RetryEngine instance.
     */
    public static final class Builder {
        private ErrorClassifier classifier = new DefaultErrorClassifier();
        private RetryListener listener = RetryListener.noOp();
        private Sleeper sleeper;
        private DoubleSupplier random = () -> ThreadLocalRandom.current().nextDouble();

        private Builder() {}

        public Builder classifier(ErrorClassifier classifier) {
            this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
            return this;
        }

        public Builder listener(RetryListener listener) {
            this.listener = Objects.requireNonNull(listener, "listener must not be null");
            return this;
        }

        /**
         * Replaces the shutdown-aware default sleeper, e.g. to record delays in tests.
         * A custom sleeper is not woken by {@link RetryEngine#shutdown()}; the loop still
         * stops once it returns.
         */
        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
            return this;
        }

        /**
         * Source of uniform values in [0, 1) used for jitter.
         */
        public Builder random(DoubleSupplier random) {
            this.random = Objects.requireNonNull(random, "random must not be null");
            return this;
        }

        public RetryEngine build() {
            return new RetryEngine(classifier, listener, sleeper, random);
        }
    }
}
