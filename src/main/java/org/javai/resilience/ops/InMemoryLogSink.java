package org.javai.resilience.ops;

import org.javai.resilience.ClassifiedException;
import org.javai.resilience.ErrorContext;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Keeps the most recent log entries in memory, oldest evicted first.
 * Useful for diagnostics endpoints and for asserting on log output in tests.
 */
public class InMemoryLogSink implements LogSink {

    public static final int DEFAULT_CAPACITY = 10_000;

    private final int capacity;
    private final Clock clock;
    private final Deque<LogEntry> entries = new ArrayDeque<>();

    /**
     * One recorded entry.
     *
     * @param error The classified error for entries written through {@link #logError} (may be null)
     */
    public record LogEntry(
            Instant timestamp,
            LogLevel level,
            String component,
            String operation,
            String message,
            Map<String, Object> metadata,
            ClassifiedException error
    ) {
        public LogEntry {
            Objects.requireNonNull(timestamp, "timestamp must not be null");
            Objects.requireNonNull(level, "level must not be null");
            metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        }
    }

    public InMemoryLogSink() {
        this(DEFAULT_CAPACITY, Clock.systemUTC());
    }

    public InMemoryLogSink(int capacity, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, was: " + capacity);
        }
        this.capacity = capacity;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public void write(LogLevel level, String component, String operation, String message, Map<String, Object> metadata) {
        append(new LogEntry(clock.instant(), level, component, operation, message, metadata, null));
    }

    @Override
    public void logError(ClassifiedException error) {
        ErrorContext context = error.context();
        append(new LogEntry(clock.instant(),
                LogLevel.forSeverity(error.severity()),
                context.component(),
                context.operation(),
                error.getMessage(),
                context.metadata(),
                error));
    }

    public synchronized List<LogEntry> entries() {
        return List.copyOf(entries);
    }

    /**
     * Entries matching the given level and component; a null argument matches anything.
     */
    public synchronized List<LogEntry> entries(LogLevel level, String component) {
        List<LogEntry> matching = new ArrayList<>();
        for (LogEntry entry : entries) {
            if ((level == null || entry.level() == level)
                    && (component == null || component.equals(entry.component()))) {
                matching.add(entry);
            }
        }
        return matching;
    }

    /**
     * Counts of logged errors keyed by {@code KIND_SEVERITY}, e.g. {@code NETWORK_LOW}.
     */
    public synchronized Map<String, Long> errorStats() {
        Map<String, Long> stats = new LinkedHashMap<>();
        for (LogEntry entry : entries) {
            if (entry.error() != null) {
                String key = entry.error().kind() + "_" + entry.error().severity();
                stats.merge(key, 1L, Long::sum);
            }
        }
        return stats;
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized void clear() {
        entries.clear();
    }

    private synchronized void append(LogEntry entry) {
        entries.addLast(entry);
        while (entries.size() > capacity) {
            entries.removeFirst();
        }
    }
}
