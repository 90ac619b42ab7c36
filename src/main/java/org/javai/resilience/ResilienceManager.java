package org.javai.resilience;

import org.javai.resilience.breaker.CircuitBreaker;
import org.javai.resilience.breaker.CircuitBreakerConfig;
import org.javai.resilience.breaker.CircuitBreakerEvent;
import org.javai.resilience.breaker.CircuitBreakerListener;
import org.javai.resilience.breaker.CircuitBreakerMetrics;
import org.javai.resilience.breaker.HealthStatus;
import org.javai.resilience.classify.DefaultErrorClassifier;
import org.javai.resilience.classify.ErrorClassifier;
import org.javai.resilience.ops.ErrorMetricsHandler;
import org.javai.resilience.ops.HandlerRegistry;
import org.javai.resilience.ops.LogLevel;
import org.javai.resilience.ops.LogSink;
import org.javai.resilience.ops.log4j.Log4jLogSink;
import org.javai.resilience.retry.RetryConfig;
import org.javai.resilience.retry.RetryEngine;
import org.javai.resilience.retry.RetryListener;
import org.javai.resilience.retry.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.DoubleSupplier;
import java.util.function.Supplier;

/**
 * Ties classification, circuit breaking, retry, handler dispatch and logging together.
 *
 * <p>One instance is created per process (or per subsystem) and passed to the code
 * that needs it. It owns the named circuit breakers, the handler registry and the
 * retry engine; nothing is global.</p>
 *
 * <p>Breaker composition is explicit: {@link #executeWithRetry} only retries, and
 * callers that want per-dependency isolation put a named breaker inside each attempt,
 * either by hand or with {@link #executeWithBreaker}.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * ResilienceManager resilience = ResilienceManager.fromEnvironment();
 * CircuitBreaker finnhub = resilience.getCircuitBreaker("finnhub");
 *
 * Quote quote = resilience.executeWithRetry(
 *     () -> finnhub.execute(() -> client.quote(ticker)),
 *     ErrorContext.builder("MarketData", "quote").subjectId(ticker).build());
 * }</pre>
 *
 * <p>Every failed attempt is dispatched to the handlers and written to the log sink,
 * so exceptions raised by {@code executeWithRetry} have already been reported.</p>
 */
public final class ResilienceManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ResilienceManager.class);

    private static final String BREAKER_COMPONENT = "CircuitBreaker";
    private static final String RETRY_COMPONENT = "RetryEngine";

    private final ResilienceSettings settings;
    private final ErrorClassifier classifier;
    private final HandlerRegistry handlers;
    private final LogSink logSink;
    private final Clock clock;
    private final ErrorMetricsHandler errorMetrics;
    private final List<CircuitBreakerListener> breakerListeners;
    private final RetryEngine retryEngine;
    private final ConcurrentMap<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    private ResilienceManager(Builder builder) {
        this.settings = builder.settings;
        this.classifier = builder.classifier;
        this.handlers = new HandlerRegistry();
        this.logSink = builder.logSink != null ? builder.logSink : new Log4jLogSink();
        this.clock = builder.clock;
        this.errorMetrics = builder.errorMetrics != null ? builder.errorMetrics : new ErrorMetricsHandler(clock);
        this.breakerListeners = List.copyOf(builder.breakerListeners);

        RetryEngine.Builder engine = RetryEngine.builder()
                .classifier(classifier)
                .listener(new ReportingRetryListener());
        if (builder.sleeper != null) {
            engine.sleeper(builder.sleeper);
        }
        if (builder.random != null) {
            engine.random(builder.random);
        }
        this.retryEngine = engine.build();

        handlers.registerGlobal(errorMetrics);
        if (builder.defaultHandlers) {
            registerDefaultHandlers();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a manager configured from system properties and environment variables,
     * logging through Log4j2.
     */
    public static ResilienceManager fromEnvironment() {
        return builder().settings(ResilienceSettings.fromEnvironment()).build();
    }

    // === Execution ===

    /**
     * Runs the operation with the default retry configuration.
     *
     * @see #executeWithRetry(ResilientOperation, ErrorContext, RetryConfig)
     */
    public <T> T executeWithRetry(ResilientOperation<T> operation, ErrorContext context) {
        return executeWithRetry(operation, context, null);
    }

    /**
     * Runs the operation with bounded retry.
     *
     * @param operation The operation to run
     * @param context Where the operation runs
     * @param retryOverride Retry configuration for this call, or null for the default
     * @return The first successful result
     * @throws ClassifiedException if a failure is not retryable
     * @throws RetriesExhaustedException if every attempt failed
     * @throws org.javai.resilience.retry.RetryCancelledException if the manager shut down during backoff
     */
    public <T> T executeWithRetry(ResilientOperation<T> operation, ErrorContext context, RetryConfig retryOverride) {
        RetryConfig config = retryOverride != null ? retryOverride : settings.retry();
        return retryEngine.execute(operation, context, config);
    }

    /**
     * Runs the operation with retry, gating every attempt through the named breaker.
     * Once the breaker opens, the remaining attempts fail fast with {@link CircuitOpenException}.
     */
    public <T> T executeWithBreaker(
            String breakerName,
            ResilientOperation<T> operation,
            ErrorContext context,
            RetryConfig retryOverride
    ) {
        CircuitBreaker breaker = getCircuitBreaker(breakerName);
        return executeWithRetry(() -> breaker.execute(operation), context, retryOverride);
    }

    /**
     * Runs the operation once. On failure the error is handled and the fallback returned.
     */
    public <T> T executeWithFallback(ResilientOperation<T> operation, T fallback, ErrorContext context) {
        Objects.requireNonNull(operation, "operation must not be null");
        try {
            return operation.call();
        } catch (Exception e) {
            ClassifiedException classified = handleError(e, context);
            log.debug("Falling back for [{}.{}] after {}",
                    context.component(), context.operation(), classified.kind());
            return fallback;
        }
    }

    /**
     * Returns a supplier that runs the operation and, on failure, handles the error and
     * throws its classified form.
     */
    public <T> Supplier<T> wrap(ResilientOperation<T> operation, ErrorContext context) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(context, "context must not be null");
        return () -> {
            try {
                return operation.call();
            } catch (Exception e) {
                throw handleError(e, context);
            }
        };
    }

    // === Circuit breakers ===

    public CircuitBreaker getCircuitBreaker(String name) {
        return getCircuitBreaker(name, null);
    }

    /**
     * Returns the breaker with the given name, creating it on first use.
     * The first caller's config wins; later configs for the same name are ignored.
     *
     * @param name The dependency name
     * @param configOverride Config for a newly created breaker, or null for the default
     */
    public CircuitBreaker getCircuitBreaker(String name, CircuitBreakerConfig configOverride) {
        Objects.requireNonNull(name, "name must not be null");
        CircuitBreaker breaker = breakers.computeIfAbsent(name, n -> newBreaker(n, configOverride));
        if (configOverride != null && !configOverride.equals(breaker.config())) {
            log.debug("Circuit breaker [{}] already exists, ignoring differing config", name);
        }
        return breaker;
    }

    public Set<String> circuitBreakerNames() {
        return new TreeSet<>(breakers.keySet());
    }

    public Map<String, HealthStatus> healthStatuses() {
        Map<String, HealthStatus> statuses = new TreeMap<>();
        breakers.forEach((name, breaker) -> statuses.put(name, breaker.health()));
        return statuses;
    }

    public void resetAll() {
        breakers.values().forEach(CircuitBreaker::reset);
    }

    private CircuitBreaker newBreaker(String name, CircuitBreakerConfig configOverride) {
        CircuitBreakerConfig config = configOverride != null ? configOverride : settings.circuitBreaker();
        log.info("Creating circuit breaker [{}] with threshold {}, recovery {} ms, window {} ms",
                name, config.tripThreshold(), config.recoveryTimeout().toMillis(), config.monitoringWindow().toMillis());
        return CircuitBreaker.builder(name)
                .config(config)
                .clock(clock)
                .listener(this::onBreakerEvent)
                .listeners(breakerListeners)
                .build();
    }

    private void onBreakerEvent(CircuitBreakerEvent event) {
        if (event instanceof CircuitBreakerEvent.Opened opened) {
            write(LogLevel.ERROR, BREAKER_COMPONENT, "opened",
                    "Circuit breaker " + opened.breaker() + " opened after " + opened.failureCount() + " failures",
                    Map.of("breaker", opened.breaker(), "failureCount", opened.failureCount()));
        } else if (event instanceof CircuitBreakerEvent.Recovered recovered) {
            write(LogLevel.INFO, BREAKER_COMPONENT, "recovered",
                    "Circuit breaker " + recovered.breaker() + " recovered",
                    Map.of("breaker", recovered.breaker()));
        } else if (event instanceof CircuitBreakerEvent.StateChange change) {
            write(LogLevel.DEBUG, BREAKER_COMPONENT, "stateChange",
                    "Circuit breaker " + change.breaker() + " moved " + change.from() + " -> " + change.to(),
                    Map.of("breaker", change.breaker(), "from", change.from().name(), "to", change.to().name()));
        }
    }

    // === Error handling ===

    /**
     * Classifies the failure, dispatches it to the registered handlers and writes it
     * to the log sink.
     *
     * @return The classified error, for the caller to rethrow or inspect
     */
    public ClassifiedException handleError(Throwable error, ErrorContext context) {
        Objects.requireNonNull(error, "error must not be null");
        Objects.requireNonNull(context, "context must not be null");
        ClassifiedException classified = classifier.classify(error, context);
        report(classified);
        return classified;
    }

    /**
     * The registry this manager dispatches to. Each manager owns its own registry,
     * pre-populated with the error metrics handler and, unless disabled, the default handlers.
     */
    public HandlerRegistry handlers() {
        return handlers;
    }

    public ErrorMetricsHandler errorMetrics() {
        return errorMetrics;
    }

    /**
     * Creates a context stamped with this manager's clock.
     */
    public ErrorContext context(String component, String operation) {
        return ErrorContext.builder(component, operation).clock(clock).build();
    }

    public ResilienceStats stats() {
        Map<String, CircuitBreakerMetrics> metrics = new TreeMap<>();
        breakers.forEach((name, breaker) -> metrics.put(name, breaker.metrics()));
        return new ResilienceStats(errorMetrics.counts(), errorMetrics.recentCounts(), metrics);
    }

    public ResilienceSettings settings() {
        return settings;
    }

    /**
     * Cancels in-flight retry backoffs. Callers sleeping in a backoff receive a
     * {@link org.javai.resilience.retry.RetryCancelledException}.
     */
    public void shutdown() {
        retryEngine.shutdown();
    }

    @Override
    public void close() {
        shutdown();
    }

    private void report(ClassifiedException error) {
        handlers.dispatch(error);
        try {
            logSink.logError(error);
        } catch (RuntimeException e) {
            log.error("LogSink {} failed to log error from [{}.{}]", logSink.getClass().getName(),
                    error.context().component(), error.context().operation(), e);
        }
    }

    private void write(LogLevel level, String component, String operation, String message, Map<String, Object> metadata) {
        try {
            logSink.write(level, component, operation, message, metadata);
        } catch (RuntimeException e) {
            log.error("LogSink {} failed to write [{}.{}]", logSink.getClass().getName(), component, operation, e);
        }
    }

    private void registerDefaultHandlers() {
        handlers.register(ErrorKind.RATE_LIMIT, (error, context) ->
                write(LogLevel.WARN, context.component(), context.operation(),
                        "Rate limit encountered, backing off", Map.of()));

        handlers.register(ErrorKind.AUTHENTICATION, (error, context) ->
                write(LogLevel.ERROR, context.component(), context.operation(),
                        "Authentication failed, check API keys and permissions", Map.of()));

        handlers.registerCritical((error, context) ->
                write(LogLevel.CRITICAL, context.component(), context.operation(),
                        "Critical error detected, immediate attention required",
                        Map.of("kind", error.kind().name())));
    }

    private final class ReportingRetryListener implements RetryListener {

        @Override
        public void onFailure(ClassifiedException error, int attemptNumber) {
            report(error);
        }

        @Override
        public void onRetry(ClassifiedException error, int attemptNumber, Duration delay) {
            ErrorContext context = error.context();
            write(LogLevel.INFO, RETRY_COMPONENT, "retry",
                    "Retrying " + context.component() + "." + context.operation()
                            + " after attempt " + attemptNumber + " in " + delay.toMillis() + " ms",
                    Map.of("attempt", attemptNumber, "delayMs", delay.toMillis(), "kind", error.kind().name()));
        }

        @Override
        public void onExhausted(RetriesExhaustedException error) {
            report(error);
        }
    }

    /**
     * Builder for configuring a ResilienceManager instance.
     */
    public static final class Builder {
        private ResilienceSettings settings = ResilienceSettings.defaults();
        private ErrorClassifier classifier = new DefaultErrorClassifier();
        private LogSink logSink;
        private Clock clock = Clock.systemUTC();
        private ErrorMetricsHandler errorMetrics;
        private final List<CircuitBreakerListener> breakerListeners = new ArrayList<>();
        private boolean defaultHandlers = true;
        private Sleeper sleeper;
        private DoubleSupplier random;

        private Builder() {}

        public Builder settings(ResilienceSettings settings) {
            this.settings = Objects.requireNonNull(settings, "settings must not be null");
            return this;
        }

        public Builder classifier(ErrorClassifier classifier) {
            this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
            return this;
        }

        /**
         * Sets the log sink (defaults to a {@link Log4jLogSink}).
         */
        public Builder logSink(LogSink logSink) {
            this.logSink = Objects.requireNonNull(logSink, "logSink must not be null");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public Builder errorMetrics(ErrorMetricsHandler errorMetrics) {
            this.errorMetrics = Objects.requireNonNull(errorMetrics, "errorMetrics must not be null");
            return this;
        }

        /**
         * Adds a listener subscribed to every breaker this manager creates.
         */
        public Builder circuitBreakerListener(CircuitBreakerListener listener) {
            this.breakerListeners.add(Objects.requireNonNull(listener, "listener must not be null"));
            return this;
        }

        /**
         * Whether to register the built-in rate-limit, authentication and critical handlers
         * (default true).
         */
        public Builder defaultHandlers(boolean enabled) {
            this.defaultHandlers = enabled;
            return this;
        }

        /**
         * Replaces the retry backoff sleeper, e.g. to record delays in tests.
         */
        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
            return this;
        }

        /**
         * Source of uniform values in [0, 1) used for retry jitter.
         */
        public Builder random(DoubleSupplier random) {
            this.random = Objects.requireNonNull(random, "random must not be null");
            return this;
        }

        public ResilienceManager build() {
            return new ResilienceManager(this);
        }
    }
}
