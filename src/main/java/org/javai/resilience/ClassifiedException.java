package org.javai.resilience;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A failure that has been placed in the error taxonomy.
 *
 * <p>Instances are immutable. The raw failure, when there is one, is kept as the
 * {@linkplain #getCause() cause}. {@code retryable} defaults from the kind unless
 * the creator overrides it.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * throw ClassifiedException.builder(ErrorKind.MISSING_DATA, "No quotes for AAPL", context)
 *     .recoveryStrategy(RecoveryStrategy.FALLBACK)
 *     .build();
 * }</pre>
 */
public class ClassifiedException extends RuntimeException {

    private final ErrorKind kind;
    private final Severity severity;
    private final ErrorContext context;
    private final RecoveryStrategy recoveryStrategy;
    private final boolean retryable;
    private final int retryCount;

    protected ClassifiedException(
            String message,
            ErrorKind kind,
            Severity severity,
            ErrorContext context,
            Throwable causedBy,
            RecoveryStrategy recoveryStrategy,
            boolean retryable,
            int retryCount
    ) {
        super(Objects.requireNonNull(message, "message must not be null"), causedBy);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.severity = Objects.requireNonNull(severity, "severity must not be null");
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.recoveryStrategy = Objects.requireNonNull(recoveryStrategy, "recoveryStrategy must not be null");
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must be >= 0, was: " + retryCount);
        }
        this.retryable = retryable;
        this.retryCount = retryCount;
    }

    /**
     * Creates a classified exception using the kind's defaults for severity,
     * recovery strategy and retryability.
     */
    public static ClassifiedException of(ErrorKind kind, String message, ErrorContext context) {
        return builder(kind, message, context).build();
    }

    public static Builder builder(ErrorKind kind, String message, ErrorContext context) {
        return new Builder(kind, message, context);
    }

    public ErrorKind kind() {
        return kind;
    }

    public Severity severity() {
        return severity;
    }

    public ErrorContext context() {
        return context;
    }

    public RecoveryStrategy recoveryStrategy() {
        return recoveryStrategy;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public int retryCount() {
        return retryCount;
    }

    /**
     * A flat, ordered view for structured logging and JSON output.
     */
    public Map<String, Object> describe() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("type", getClass().getSimpleName());
        fields.put("message", getMessage());
        fields.put("kind", kind.name());
        fields.put("severity", severity.name());
        fields.put("recoveryStrategy", recoveryStrategy.name());
        fields.put("retryable", retryable);
        fields.put("retryCount", retryCount);
        fields.put("component", context.component());
        fields.put("operation", context.operation());
        if (context.correlationId() != null) {
            fields.put("correlationId", context.correlationId());
        }
        if (context.subjectId() != null) {
            fields.put("subjectId", context.subjectId());
        }
        Throwable cause = getCause();
        if (cause != null) {
            fields.put("cause", cause.getClass().getName());
            if (cause.getMessage() != null) {
                fields.put("causeMessage", cause.getMessage());
            }
        }
        return fields;
    }

    public static final class Builder {
        private final ErrorKind kind;
        private final String message;
        private final ErrorContext context;
        private Severity severity;
        private RecoveryStrategy recoveryStrategy;
        private Boolean retryable;
        private Throwable cause;
        private int retryCount;

        private Builder(ErrorKind kind, String message, ErrorContext context) {
            this.kind = Objects.requireNonNull(kind);
            this.message = Objects.requireNonNull(message);
            this.context = Objects.requireNonNull(context);
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder recoveryStrategy(RecoveryStrategy strategy) {
            this.recoveryStrategy = strategy;
            return this;
        }

        /**
         * Overrides the kind's default retryability.
         */
        public Builder retryable(boolean retryable) {
            this.retryable = retryable;
            return this;
        }

        public Builder cause(Throwable cause) {
            this.cause = cause;
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public ClassifiedException build() {
            return new ClassifiedException(
                    message,
                    kind,
                    severity != null ? severity : kind.defaultSeverity(),
                    context,
                    cause,
                    recoveryStrategy != null ? recoveryStrategy : kind.defaultStrategy(),
                    retryable != null ? retryable : kind.isRetryableByDefault(),
                    retryCount
            );
        }
    }
}
