package org.javai.resilience.breaker;

import java.time.Instant;
import java.util.Objects;

/**
 * Notifications emitted by a {@link CircuitBreaker} to its listeners.
 */
public sealed interface CircuitBreakerEvent
        permits CircuitBreakerEvent.StateChange, CircuitBreakerEvent.Opened, CircuitBreakerEvent.Recovered {

    /**
     * The name of the breaker that emitted the event.
     */
    String breaker();

    /**
     * The breaker moved from one state to another.
     */
    record StateChange(String breaker, CircuitState from, CircuitState to) implements CircuitBreakerEvent {
        public StateChange {
            Objects.requireNonNull(breaker, "breaker must not be null");
            Objects.requireNonNull(from, "from must not be null");
            Objects.requireNonNull(to, "to must not be null");
        }
    }

    /**
     * The breaker opened.
     *
     * @param failureCount Failures within the monitoring window at the time of opening
     * @param nextAttemptAt When the next trial call will be admitted
     */
    record Opened(String breaker, int failureCount, Instant nextAttemptAt) implements CircuitBreakerEvent {
        public Opened {
            Objects.requireNonNull(breaker, "breaker must not be null");
        }
    }

    /**
     * A trial call succeeded and the breaker closed again.
     */
    record Recovered(String breaker) implements CircuitBreakerEvent {
        public Recovered {
            Objects.requireNonNull(breaker, "breaker must not be null");
        }
    }
}
