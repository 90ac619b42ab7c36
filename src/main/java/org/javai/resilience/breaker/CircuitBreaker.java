package org.javai.resilience.breaker;

import org.javai.resilience.CircuitOpenException;
import org.javai.resilience.ErrorContext;
import org.javai.resilience.ResilientOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Guards calls to one named dependency and stops calling it while it is failing.
 *
 * <p>The breaker starts CLOSED. Failures are timestamped and counted over a sliding
 * monitoring window; once the count reaches {@link CircuitBreakerConfig#tripThreshold()}
 * the breaker opens and rejects calls with {@link CircuitOpenException} until the
 * recovery timeout elapses. The first call after that is admitted as a single trial
 * (HALF_OPEN): success closes the breaker, failure opens it again.</p>
 *
 * <p>All mutable state is guarded by a lock owned by this instance. The operation
 * itself runs outside the lock, so breakers never block each other and a slow call
 * does not block other callers of the same breaker.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * CircuitBreaker breaker = CircuitBreaker.builder("finnhub")
 *     .config(CircuitBreakerConfig.defaults())
 *     .listener(event -> log.info("breaker event {}", event))
 *     .build();
 *
 * Quote quote = breaker.execute(() -> client.quote("AAPL"));
 * }</pre>
 */
public final class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    static final int MAX_RECENT_CALLS = 1000;
    static final double UNHEALTHY_ERROR_RATE = 0.3;
    static final double DEGRADED_ERROR_RATE = 0.1;

    private static final long NO_TRIAL = -1L;

    private final String name;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final List<CircuitBreakerListener> listeners;

    private final ReentrantLock lock = new ReentrantLock();

    // Guarded by lock
    private CircuitState state = CircuitState.CLOSED;
    private final Deque<Instant> failureTimestamps = new ArrayDeque<>();
    private final Deque<RecordedCall> recentCalls = new ArrayDeque<>();
    private Instant nextAttemptAt;
    private boolean trialInFlight;
    // Bumped on every OPEN -> HALF_OPEN; only the current generation's trial may close
    private long trialGeneration;
    private long totalRequests;
    private long totalFailures;
    private long rejectedCalls;
    private Instant lastFailureAt;
    private Instant lastSuccessAt;

    private record RecordedCall(Instant at, boolean success) {}

    private CircuitBreaker(String name, CircuitBreakerConfig config, Clock clock, List<CircuitBreakerListener> listeners) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.listeners = List.copyOf(listeners);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public CircuitBreakerConfig config() {
        return config;
    }

    /**
     * Runs the operation if the breaker admits it.
     *
     * @param operation The call to guard
     * @return The operation's result
     * @throws CircuitOpenException if the breaker is open, or a trial call is already in flight
     * @throws Exception whatever the operation threw, unchanged
     */
    public <T> T execute(ResilientOperation<T> operation) throws Exception {
        Objects.requireNonNull(operation, "operation must not be null");

        long trial = admit();
        T result;
        try {
            result = operation.call();
        } catch (Throwable t) {
            onFailure(trial);
            throw t;
        }
        onSuccess(trial);
        return result;
    }

    public CircuitState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Failures currently counted toward the threshold.
     */
    public int failureCount() {
        lock.lock();
        try {
            pruneFailures(clock.instant());
            return failureTimestamps.size();
        } finally {
            lock.unlock();
        }
    }

    public CircuitBreakerMetrics metrics() {
        lock.lock();
        try {
            Instant now = clock.instant();
            pruneFailures(now);
            pruneRecentCalls(now);

            int successes = 0;
            for (RecordedCall call : recentCalls) {
                if (call.success()) {
                    successes++;
                }
            }
            int requests = recentCalls.size();
            int failures = requests - successes;
            double errorRate = requests > 0 ? (double) failures / requests : 0.0;

            return new CircuitBreakerMetrics(
                    name,
                    state,
                    failureTimestamps.size(),
                    successes,
                    requests,
                    errorRate,
                    totalRequests,
                    totalFailures,
                    rejectedCalls,
                    lastFailureAt,
                    lastSuccessAt,
                    state == CircuitState.OPEN ? nextAttemptAt : null,
                    healthFor(state, errorRate));
        } finally {
            lock.unlock();
        }
    }

    public HealthStatus health() {
        return metrics().health();
    }

    /**
     * Returns the breaker to CLOSED with empty history and counters.
     * Intended for operators and tests.
     */
    public void reset() {
        List<CircuitBreakerEvent> events = new ArrayList<>();
        lock.lock();
        try {
            if (state != CircuitState.CLOSED) {
                events.add(new CircuitBreakerEvent.StateChange(name, state, CircuitState.CLOSED));
            }
            state = CircuitState.CLOSED;
            failureTimestamps.clear();
            recentCalls.clear();
            nextAttemptAt = null;
            trialInFlight = false;
            trialGeneration++;
            totalRequests = 0;
            totalFailures = 0;
            rejectedCalls = 0;
            lastFailureAt = null;
            lastSuccessAt = null;
        } finally {
            lock.unlock();
        }
        log.info("Circuit breaker [{}] reset", name);
        publish(events);
    }

    /**
     * Returns the trial generation if the call is admitted as the HALF_OPEN trial,
     * otherwise {@link #NO_TRIAL}.
     */
    private long admit() {
        List<CircuitBreakerEvent> events = new ArrayList<>();
        long trial = NO_TRIAL;
        lock.lock();
        try {
            Instant now = clock.instant();
            if (state == CircuitState.OPEN) {
                if (now.isBefore(nextAttemptAt)) {
                    rejectedCalls++;
                    throw rejection(nextAttemptAt, now);
                }
                transition(CircuitState.HALF_OPEN, events);
                trialGeneration++;
                trialInFlight = true;
                trial = trialGeneration;
            } else if (state == CircuitState.HALF_OPEN) {
                if (trialInFlight) {
                    rejectedCalls++;
                    throw rejection(null, now);
                }
                trialInFlight = true;
                trial = trialGeneration;
            }
        } finally {
            lock.unlock();
        }
        publish(events);
        return trial;
    }

    private void onSuccess(long trial) {
        List<CircuitBreakerEvent> events = new ArrayList<>();
        lock.lock();
        try {
            Instant now = clock.instant();
            record(now, true);
            lastSuccessAt = now;
            boolean currentTrial = isCurrentTrial(trial);
            if (currentTrial) {
                trialInFlight = false;
            }

            if (state == CircuitState.HALF_OPEN && currentTrial) {
                failureTimestamps.clear();
                transition(CircuitState.CLOSED, events);
                nextAttemptAt = null;
                events.add(new CircuitBreakerEvent.Recovered(name));
            } else if (state == CircuitState.CLOSED) {
                // A success resets the rolling window
                failureTimestamps.clear();
            }
        } finally {
            lock.unlock();
        }
        publish(events);
    }

    private void onFailure(long trial) {
        List<CircuitBreakerEvent> events = new ArrayList<>();
        lock.lock();
        try {
            Instant now = clock.instant();
            record(now, false);
            totalFailures++;
            lastFailureAt = now;
            if (isCurrentTrial(trial)) {
                trialInFlight = false;
            }

            failureTimestamps.addLast(now);
            pruneFailures(now);

            if (state == CircuitState.HALF_OPEN) {
                open(now, events);
            } else if (state == CircuitState.CLOSED && failureTimestamps.size() >= config.tripThreshold()) {
                open(now, events);
            }
        } finally {
            lock.unlock();
        }
        publish(events);
    }

    private boolean isCurrentTrial(long trial) {
        return trial != NO_TRIAL && trial == trialGeneration && trialInFlight;
    }

    private void open(Instant now, List<CircuitBreakerEvent> events) {
        // Any outstanding trial belongs to the round that just failed
        trialInFlight = false;
        transition(CircuitState.OPEN, events);
        nextAttemptAt = now.plus(config.recoveryTimeout());
        events.add(new CircuitBreakerEvent.Opened(name, failureTimestamps.size(), nextAttemptAt));
    }

    private void transition(CircuitState to, List<CircuitBreakerEvent> events) {
        CircuitState from = state;
        state = to;
        events.add(new CircuitBreakerEvent.StateChange(name, from, to));
    }

    private void record(Instant now, boolean success) {
        totalRequests++;
        recentCalls.addLast(new RecordedCall(now, success));
        pruneRecentCalls(now);
    }

    private void pruneFailures(Instant now) {
        Instant cutoff = now.minus(config.monitoringWindow());
        while (!failureTimestamps.isEmpty() && !failureTimestamps.peekFirst().isAfter(cutoff)) {
            failureTimestamps.removeFirst();
        }
    }

    private void pruneRecentCalls(Instant now) {
        Instant cutoff = now.minus(config.monitoringWindow());
        while (!recentCalls.isEmpty()
                && (recentCalls.size() > MAX_RECENT_CALLS || !recentCalls.peekFirst().at().isAfter(cutoff))) {
            recentCalls.removeFirst();
        }
    }

    private CircuitOpenException rejection(Instant retryAt, Instant now) {
        ErrorContext context = ErrorContext.builder("CircuitBreaker", "execute")
                .timestamp(now)
                .metadata("breaker", name)
                .build();
        return new CircuitOpenException(name, retryAt, context);
    }

    private void publish(List<CircuitBreakerEvent> events) {
        for (CircuitBreakerEvent event : events) {
            logEvent(event);
            for (CircuitBreakerListener listener : listeners) {
                try {
                    listener.onEvent(event);
                } catch (RuntimeException e) {
                    log.error("Circuit breaker listener {} failed for [{}]",
                            listener.getClass().getName(), name, e);
                }
            }
        }
    }

    private void logEvent(CircuitBreakerEvent event) {
        if (event instanceof CircuitBreakerEvent.StateChange change) {
            log.info("Circuit breaker [{}] state changed {} -> {}", name, change.from(), change.to());
        } else if (event instanceof CircuitBreakerEvent.Opened opened) {
            log.warn("Circuit breaker [{}] opened after {} failures, next attempt at {}",
                    name, opened.failureCount(), opened.nextAttemptAt());
        } else if (event instanceof CircuitBreakerEvent.Recovered) {
            log.info("Circuit breaker [{}] recovered", name);
        }
    }

    static HealthStatus healthFor(CircuitState state, double errorRate) {
        if (state == CircuitState.OPEN || errorRate > UNHEALTHY_ERROR_RATE) {
            return HealthStatus.UNHEALTHY;
        }
        if (state == CircuitState.HALF_OPEN || errorRate > DEGRADED_ERROR_RATE) {
            return HealthStatus.DEGRADED;
        }
        return HealthStatus.HEALTHY;
    }

    public static final class Builder {
        private final String name;
        private CircuitBreakerConfig config = CircuitBreakerConfig.defaults();
        private Clock clock = Clock.systemUTC();
        private final List<CircuitBreakerListener> listeners = new ArrayList<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name must not be null");
        }

        public Builder config(CircuitBreakerConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public Builder listener(CircuitBreakerListener listener) {
            this.listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
            return this;
        }

        public Builder listeners(List<? extends CircuitBreakerListener> listeners) {
            for (CircuitBreakerListener listener : listeners) {
                listener(listener);
            }
            return this;
        }

        public CircuitBreaker build() {
            return new CircuitBreaker(name, config, clock, listeners);
        }
    }
}
