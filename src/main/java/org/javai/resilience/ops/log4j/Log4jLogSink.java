package org.javai.resilience.ops.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.resilience.ops.LogLevel;
import org.javai.resilience.ops.LogSink;

import java.util.Map;
import java.util.Objects;

/**
 * Writes log entries through Log4j2.
 *
 * <p>Levels map one-to-one, with {@code CRITICAL} registered as a custom Log4j level
 * between FATAL and ERROR. Each entry carries a marker named after its level so that
 * appenders can route critical entries separately.</p>
 *
 * <p>Entries are formatted as {@code [component.operation] message | key=value, ...}.</p>
 */
public class Log4jLogSink implements LogSink {

    static final Level CRITICAL = Level.forName("CRITICAL", 150);

    private static final Marker RESILIENCE_MARKER = MarkerManager.getMarker("RESILIENCE");
    private static final Marker CRITICAL_MARKER = MarkerManager.getMarker("CRITICAL").addParents(RESILIENCE_MARKER);

    private final Logger logger;

    static final String DEFAULT_LOGGER_NAME = "org.javai.resilience.LogSink";

    /**
     * Writes to the {@code org.javai.resilience.LogSink} logger.
     */
    public Log4jLogSink() {
        this(LogManager.getLogger(DEFAULT_LOGGER_NAME));
    }

    /**
     * Writes to the named logger, so that resilience output can be routed
     * alongside an application's own loggers.
     */
    public Log4jLogSink(String loggerName) {
        this(LogManager.getLogger(loggerName));
    }

    public Log4jLogSink(Logger logger) {
        this.logger = Objects.requireNonNull(logger, "logger must not be null");
    }

    @Override
    public void write(LogLevel level, String component, String operation, String message, Map<String, Object> metadata) {
        Level log4jLevel = levelFor(level);
        if (!logger.isEnabled(log4jLevel)) {
            return;
        }
        logger.atLevel(log4jLevel)
                .withMarker(level == LogLevel.CRITICAL ? CRITICAL_MARKER : RESILIENCE_MARKER)
                .log(format(component, operation, message, metadata));
    }

    static String format(String component, String operation, String message, Map<String, Object> metadata) {
        return "[" + component + "." + operation + "] " + message + formatMetadata(metadata);
    }

    private static String formatMetadata(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(" | ");
        boolean first = true;
        for (Map.Entry<String, Object> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.toString();
    }

    static Level levelFor(LogLevel level) {
        return switch (level) {
            case DEBUG -> Level.DEBUG;
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
            case CRITICAL -> CRITICAL;
        };
    }
}
