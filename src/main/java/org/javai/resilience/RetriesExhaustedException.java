package org.javai.resilience;

/**
 * Terminal failure after every retry attempt failed. Wraps the last raw failure;
 * {@link #retryCount()} equals the number of attempts made.
 */
public class RetriesExhaustedException extends ClassifiedException {

    public RetriesExhaustedException(int attempts, Throwable lastError, ErrorContext context) {
        super("Operation failed after " + attempts + " attempts",
                ErrorKind.SYSTEM,
                Severity.HIGH,
                context,
                lastError,
                RecoveryStrategy.ABORT,
                false,
                attempts);
    }
}
