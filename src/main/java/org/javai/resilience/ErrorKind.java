package org.javai.resilience;

/**
 * The closed set of error kinds. Every kind carries a default severity,
 * a default recovery strategy and a default retryability.
 */
public enum ErrorKind {
    NETWORK(Severity.LOW, RecoveryStrategy.RETRY, true),
    TIMEOUT(Severity.LOW, RecoveryStrategy.RETRY, true),
    RATE_LIMIT(Severity.MEDIUM, RecoveryStrategy.RETRY, true),
    API(Severity.MEDIUM, RecoveryStrategy.RETRY, true),
    AUTHENTICATION(Severity.HIGH, RecoveryStrategy.ABORT, false),
    CONFIGURATION(Severity.HIGH, RecoveryStrategy.ABORT, false),
    VALIDATION(Severity.MEDIUM, RecoveryStrategy.SKIP, false),
    MISSING_DATA(Severity.MEDIUM, RecoveryStrategy.FALLBACK, false),
    PROCESSING(Severity.MEDIUM, RecoveryStrategy.FALLBACK, false),
    MEMORY(Severity.CRITICAL, RecoveryStrategy.ABORT, false),
    STATE(Severity.HIGH, RecoveryStrategy.ABORT, false),
    SYSTEM(Severity.HIGH, RecoveryStrategy.ABORT, false),
    RESOURCE_EXHAUSTION(Severity.CRITICAL, RecoveryStrategy.DEGRADE, false),
    INTERNAL(Severity.MEDIUM, RecoveryStrategy.ABORT, false),
    BUSINESS_LOGIC(Severity.LOW, RecoveryStrategy.SKIP, false);

    private final Severity defaultSeverity;
    private final RecoveryStrategy defaultStrategy;
    private final boolean retryableByDefault;

    ErrorKind(Severity defaultSeverity, RecoveryStrategy defaultStrategy, boolean retryableByDefault) {
        this.defaultSeverity = defaultSeverity;
        this.defaultStrategy = defaultStrategy;
        this.retryableByDefault = retryableByDefault;
    }

    public Severity defaultSeverity() {
        return defaultSeverity;
    }

    public RecoveryStrategy defaultStrategy() {
        return defaultStrategy;
    }

    /**
     * True for NETWORK, TIMEOUT, RATE_LIMIT and API.
     */
    public boolean isRetryableByDefault() {
        return retryableByDefault;
    }
}
