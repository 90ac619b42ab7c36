package org.javai.resilience;

import java.time.Instant;
import java.util.Map;

/**
 * Thrown without invoking the operation when a circuit breaker rejects a call.
 * Always SYSTEM, HIGH and not retryable.
 */
public class CircuitOpenException extends ClassifiedException {

    private final String breakerName;
    private final Instant nextAttemptAt;

    public CircuitOpenException(String breakerName, Instant nextAttemptAt, ErrorContext context) {
        super("Circuit breaker is OPEN for " + breakerName,
                ErrorKind.SYSTEM,
                Severity.HIGH,
                context,
                null,
                RecoveryStrategy.FALLBACK,
                false,
                0);
        this.breakerName = breakerName;
        this.nextAttemptAt = nextAttemptAt;
    }

    public String breakerName() {
        return breakerName;
    }

    /**
     * When the breaker will next admit a trial call (may be null while a trial is in flight).
     */
    public Instant nextAttemptAt() {
        return nextAttemptAt;
    }

    @Override
    public Map<String, Object> describe() {
        Map<String, Object> fields = super.describe();
        fields.put("breaker", breakerName);
        if (nextAttemptAt != null) {
            fields.put("nextAttemptAt", nextAttemptAt.toString());
        }
        return fields;
    }
}
