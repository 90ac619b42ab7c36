package org.javai.resilience.ops;

import org.javai.resilience.ClassifiedException;
import org.javai.resilience.ErrorContext;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Receives structured log entries from the resilience core.
 */
public interface LogSink {

    void write(LogLevel level, String component, String operation, String message, Map<String, Object> metadata);

    /**
     * Writes a classified error at the level derived from its severity, with the
     * context metadata and the error's fields under {@code "error"}.
     */
    default void logError(ClassifiedException error) {
        ErrorContext context = error.context();
        Map<String, Object> metadata = new LinkedHashMap<>(context.metadata());
        metadata.put("error", error.describe());
        write(LogLevel.forSeverity(error.severity()),
                context.component(),
                context.operation(),
                error.getMessage(),
                metadata);
    }

    /**
     * A sink that discards everything. Useful for testing.
     */
    static LogSink noOp() {
        return (level, component, operation, message, metadata) -> {};
    }
}
