package org.javai.resilience;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Where and when an error happened. Created fresh per call site and never mutated.
 *
 * @param component The component reporting the error (e.g., "NewsFetcher", "LlmClient")
 * @param operation The operation that failed (e.g., "fetchHeadlines")
 * @param timestamp When the context was created
 * @param correlationId Trace correlation identifier (may be null)
 * @param subjectId What the operation was about, such as a ticker or a request id (may be null)
 * @param metadata Additional key-value pairs, in insertion order
 */
public record ErrorContext(
        String component,
        String operation,
        Instant timestamp,
        String correlationId,
        String subjectId,
        Map<String, Object> metadata
) {

    public ErrorContext {
        Objects.requireNonNull(component, "component must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        metadata = metadata == null || metadata.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static ErrorContext of(String component, String operation) {
        return new ErrorContext(component, operation, Instant.now(), null, null, null);
    }

    public static Builder builder(String component, String operation) {
        return new Builder(component, operation);
    }

    /**
     * Returns a copy with the given entry appended to the metadata.
     */
    public ErrorContext withMetadata(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(metadata);
        merged.put(key, value);
        return new ErrorContext(component, operation, timestamp, correlationId, subjectId, merged);
    }

    public static final class Builder {
        private final String component;
        private final String operation;
        private Instant timestamp;
        private Clock clock = Clock.systemUTC();
        private String correlationId;
        private String subjectId;
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        private Builder(String component, String operation) {
            this.component = Objects.requireNonNull(component);
            this.operation = Objects.requireNonNull(operation);
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock);
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder subjectId(String subjectId) {
            this.subjectId = subjectId;
            return this;
        }

        public Builder metadata(String key, Object value) {
            this.metadata.put(Objects.requireNonNull(key), value);
            return this;
        }

        public Builder metadata(Map<String, ?> entries) {
            this.metadata.putAll(entries);
            return this;
        }

        public ErrorContext build() {
            Instant at = timestamp != null ? timestamp : clock.instant();
            return new ErrorContext(component, operation, at, correlationId, subjectId, metadata);
        }
    }
}
