package org.javai.resilience.ops;

import org.javai.resilience.Severity;

/**
 * Levels accepted by a {@link LogSink}.
 */
public enum LogLevel {
    DEBUG,
    INFO,
    WARN,
    ERROR,
    CRITICAL;

    /**
     * LOW maps to WARN, MEDIUM and HIGH to ERROR, CRITICAL to CRITICAL.
     */
    public static LogLevel forSeverity(Severity severity) {
        return switch (severity) {
            case LOW -> WARN;
            case MEDIUM, HIGH -> ERROR;
            case CRITICAL -> CRITICAL;
        };
    }
}
