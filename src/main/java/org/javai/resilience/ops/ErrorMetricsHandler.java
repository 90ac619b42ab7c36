package org.javai.resilience.ops;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.javai.resilience.ClassifiedException;
import org.javai.resilience.ErrorContext;
import org.javai.resilience.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Counts errors per {@code component.KIND} and emits one JSON line per error via SLF4J.
 *
 * <p>Register it as a global handler. Counts accumulate until {@link #reset()};
 * trends cover the last hour.</p>
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"error","timestamp":"2024-01-20T10:30:00Z","key":"NewsFetcher.TIMEOUT","kind":"TIMEOUT",...}
 * }</pre>
 */
public class ErrorMetricsHandler implements ErrorHandler {

    private static final String DEFAULT_LOGGER_NAME = "org.javai.resilience.Metrics";
    private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;
    static final Duration TREND_WINDOW = Duration.ofHours(1);

    private final Logger logger;
    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper();
    private final Map<String, LongAdder> counts = new ConcurrentHashMap<>();
    private final Map<String, Deque<Instant>> trends = new ConcurrentHashMap<>();
    private volatile Instant lastReset;

    public ErrorMetricsHandler() {
        this(LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
    }

    public ErrorMetricsHandler(String loggerName) {
        this(LoggerFactory.getLogger(loggerName), Clock.systemUTC());
    }

    public ErrorMetricsHandler(Clock clock) {
        this(LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), clock);
    }

    ErrorMetricsHandler(Logger logger, Clock clock) {
        this.logger = Objects.requireNonNull(logger, "logger must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.lastReset = clock.instant();
    }

    @Override
    public void handle(ClassifiedException error, ErrorContext context) throws JsonProcessingException {
        String key = keyFor(error, context);
        Instant now = clock.instant();

        counts.computeIfAbsent(key, k -> new LongAdder()).increment();
        Deque<Instant> trend = trends.computeIfAbsent(key, k -> new ArrayDeque<>());
        synchronized (trend) {
            trend.addLast(now);
            prune(trend, now);
        }

        if (logger.isInfoEnabled()) {
            logger.info(toJson(error, context, key, now));
        }
    }

    /**
     * Lifetime counts since the last reset, keyed by {@code component.KIND}.
     */
    public Map<String, Long> counts() {
        Map<String, Long> snapshot = new TreeMap<>();
        counts.forEach((key, adder) -> snapshot.put(key, adder.sum()));
        return snapshot;
    }

    public long count(String component, ErrorKind kind) {
        LongAdder adder = counts.get(component + "." + kind);
        return adder == null ? 0 : adder.sum();
    }

    /**
     * Counts within the last hour, keyed by {@code component.KIND}.
     */
    public Map<String, Integer> recentCounts() {
        Instant now = clock.instant();
        Map<String, Integer> snapshot = new TreeMap<>();
        trends.forEach((key, trend) -> {
            synchronized (trend) {
                prune(trend, now);
                snapshot.put(key, trend.size());
            }
        });
        return snapshot;
    }

    public Instant lastReset() {
        return lastReset;
    }

    public void reset() {
        counts.clear();
        trends.clear();
        lastReset = clock.instant();
    }

    String toJson(ClassifiedException error, ErrorContext context, String key, Instant at) throws JsonProcessingException {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("eventType", "error");
        event.put("timestamp", ISO_FORMATTER.format(at));
        event.put("key", key);
        event.put("kind", error.kind().name());
        event.put("severity", error.severity().name());
        event.put("recoveryStrategy", error.recoveryStrategy().name());
        event.put("retryable", error.isRetryable());
        event.put("component", context.component());
        event.put("operation", context.operation());
        event.put("message", error.getMessage());
        if (context.correlationId() != null) {
            event.put("correlationId", context.correlationId());
        }
        if (context.subjectId() != null) {
            event.put("subjectId", context.subjectId());
        }
        if (!context.metadata().isEmpty()) {
            Map<String, String> tags = new LinkedHashMap<>();
            context.metadata().forEach((k, v) -> tags.put(k, String.valueOf(v)));
            event.put("tags", tags);
        }
        return mapper.writeValueAsString(event);
    }

    private static String keyFor(ClassifiedException error, ErrorContext context) {
        return context.component() + "." + error.kind();
    }

    private static void prune(Deque<Instant> trend, Instant now) {
        Instant cutoff = now.minus(TREND_WINDOW);
        while (!trend.isEmpty() && trend.peekFirst().isBefore(cutoff)) {
            trend.removeFirst();
        }
    }
}
