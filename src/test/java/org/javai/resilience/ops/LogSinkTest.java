package org.javai.resilience.ops;

import org.javai.resilience.ClassifiedException;
import org.javai.resilience.ErrorContext;
import org.javai.resilience.ErrorKind;
import org.javai.resilience.Severity;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class LogSinkTest {

    record Written(LogLevel level, String component, String operation, String message, Map<String, Object> metadata) {}

    @Test
    void forSeverity_mapsLowToWarnAndCriticalToCritical() {
        assertThat(LogLevel.forSeverity(Severity.LOW)).isEqualTo(LogLevel.WARN);
        assertThat(LogLevel.forSeverity(Severity.MEDIUM)).isEqualTo(LogLevel.ERROR);
        assertThat(LogLevel.forSeverity(Severity.HIGH)).isEqualTo(LogLevel.ERROR);
        assertThat(LogLevel.forSeverity(Severity.CRITICAL)).isEqualTo(LogLevel.CRITICAL);
    }

    @Test
    void logError_writesContextMetadataAndErrorFields() {
        List<Written> written = new ArrayList<>();
        LogSink sink = (level, component, operation, message, metadata) ->
                written.add(new Written(level, component, operation, message, metadata));
        ErrorContext context = ErrorContext.builder("Fundamentals", "balanceSheet")
                .metadata("ticker", "MSFT")
                .build();

        sink.logError(ClassifiedException.of(ErrorKind.AUTHENTICATION, "Invalid API key", context));

        assertThat(written).singleElement().satisfies(entry -> {
            assertThat(entry.level()).isEqualTo(LogLevel.ERROR);
            assertThat(entry.component()).isEqualTo("Fundamentals");
            assertThat(entry.operation()).isEqualTo("balanceSheet");
            assertThat(entry.message()).isEqualTo("Invalid API key");
            assertThat(entry.metadata()).containsEntry("ticker", "MSFT").containsKey("error");
            assertThat((Map<String, Object>) entry.metadata().get("error")).containsEntry("kind", "AUTHENTICATION");
        });
    }

    @Test
    void noOp_acceptsEverything() {
        assertThatCode(() -> LogSink.noOp().write(LogLevel.CRITICAL, "c", "o", "m", null))
                .doesNotThrowAnyException();
    }
}
