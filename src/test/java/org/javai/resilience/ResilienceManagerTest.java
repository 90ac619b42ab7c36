package org.javai.resilience;

import org.javai.resilience.breaker.CircuitBreaker;
import org.javai.resilience.breaker.CircuitBreakerConfig;
import org.javai.resilience.breaker.CircuitBreakerEvent;
import org.javai.resilience.breaker.CircuitState;
import org.javai.resilience.breaker.HealthStatus;
import org.javai.resilience.classify.HttpStatusException;
import org.javai.resilience.ops.InMemoryLogSink;
import org.javai.resilience.ops.LogLevel;
import org.javai.resilience.retry.RetryCancelledException;
import org.javai.resilience.retry.RetryConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.*;

class ResilienceManagerTest {

    private MutableClock clock;
    private InMemoryLogSink sink;
    private List<Duration> sleepTimes;
    private List<CircuitBreakerEvent> breakerEvents;
    private ResilienceManager manager;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-01-20T10:00:00Z");
        sink = new InMemoryLogSink(InMemoryLogSink.DEFAULT_CAPACITY, clock);
        sleepTimes = new ArrayList<>();
        breakerEvents = new ArrayList<>();

        ResilienceSettings settings = new ResilienceSettings(
                CircuitBreakerConfig.ofMillis(5, 60_000, 300_000, 3),
                RetryConfig.builder().baseDelay(Duration.ofMillis(1000)).maxDelay(Duration.ofMillis(10_000)).jitter(false).build());

        manager = ResilienceManager.builder()
                .settings(settings)
                .logSink(sink)
                .clock(clock)
                .sleeper(sleepTimes::add)
                .circuitBreakerListener(breakerEvents::add)
                .build();
    }

    @AfterEach
    void tearDown() {
        manager.close();
    }

    @Test
    void executeWithRetry_success_returnsResult() {
        String result = manager.executeWithRetry(() -> "quote", manager.context("MarketData", "quote"));

        assertThat(result).isEqualTo("quote");
        assertThat(sink.entries()).isEmpty();
    }

    @Test
    void executeWithRetry_exhausted_reportsEveryAttemptAndTerminalError() {
        ErrorContext context = manager.context("NewsFetcher", "headlines");
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> manager.executeWithRetry(() -> {
            attempts.incrementAndGet();
            throw new ConnectException("Connection refused");
        }, context))
                .isInstanceOf(RetriesExhaustedException.class);

        assertThat(attempts).hasValue(3);
        assertThat(sleepTimes).containsExactly(Duration.ofMillis(1000), Duration.ofMillis(2000));
        assertThat(manager.errorMetrics().count("NewsFetcher", ErrorKind.NETWORK)).isEqualTo(3);
        assertThat(manager.errorMetrics().count("NewsFetcher", ErrorKind.SYSTEM)).isEqualTo(1);
        assertThat(sink.errorStats())
                .containsEntry("NETWORK_LOW", 3L)
                .containsEntry("SYSTEM_HIGH", 1L);
        assertThat(sink.entries(LogLevel.INFO, "RetryEngine")).hasSize(2);
    }

    @Test
    void executeWithRetry_override_replacesDefaultConfig() {
        RetryConfig once = RetryConfig.builder().maxAttempts(1).jitter(false).build();

        assertThatThrownBy(() -> manager.executeWithRetry(() -> {
            throw new ConnectException("refused");
        }, manager.context("NewsFetcher", "headlines"), once))
                .isInstanceOfSatisfying(RetriesExhaustedException.class, e ->
                        assertThat(e.retryCount()).isEqualTo(1));
        assertThat(sleepTimes).isEmpty();
    }

    @Test
    void executeWithRetry_nonRetryable_failsOnceAndRunsDefaultHandler() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> manager.executeWithRetry(() -> {
            attempts.incrementAndGet();
            throw new HttpStatusException(401, "Unauthorized");
        }, manager.context("LlmClient", "complete")))
                .isInstanceOfSatisfying(ClassifiedException.class, e ->
                        assertThat(e.kind()).isEqualTo(ErrorKind.AUTHENTICATION));

        assertThat(attempts).hasValue(1);
        assertThat(sink.entries(LogLevel.ERROR, "LlmClient")).extracting(InMemoryLogSink.LogEntry::message)
                .contains("Authentication failed, check API keys and permissions", "Unauthorized");
    }

    @Test
    void getCircuitBreaker_sameName_returnsSameInstanceAndFirstConfigWins() {
        CircuitBreakerConfig custom = CircuitBreakerConfig.ofMillis(2, 30_000, 300_000, 0);

        CircuitBreaker first = manager.getCircuitBreaker("newsapi", custom);
        CircuitBreaker second = manager.getCircuitBreaker("newsapi", CircuitBreakerConfig.defaults());
        CircuitBreaker third = manager.getCircuitBreaker("newsapi");

        assertThat(second).isSameAs(first);
        assertThat(third).isSameAs(first);
        assertThat(first.config()).isEqualTo(custom);
        assertThat(manager.getCircuitBreaker("finnhub").config())
                .isEqualTo(CircuitBreakerConfig.ofMillis(5, 60_000, 300_000, 3));
        assertThat(manager.circuitBreakerNames()).containsExactly("finnhub", "newsapi");
    }

    @Test
    void getCircuitBreaker_opened_logsAndNotifiesListeners() {
        CircuitBreaker breaker = manager.getCircuitBreaker("finnhub");
        for (int i = 0; i < 5; i++) {
            assertThatThrownBy(() -> breaker.execute(() -> { throw new IOException("down"); }))
                    .isInstanceOf(IOException.class);
        }

        assertThat(breaker.state()).isEqualTo(CircuitState.OPEN);
        assertThat(sink.entries(LogLevel.ERROR, "CircuitBreaker")).extracting(InMemoryLogSink.LogEntry::message)
                .containsExactly("Circuit breaker finnhub opened after 5 failures");
        assertThat(breakerEvents).hasAtLeastOneElementOfType(CircuitBreakerEvent.Opened.class);
        assertThat(manager.healthStatuses()).containsEntry("finnhub", HealthStatus.UNHEALTHY);
    }

    @Test
    void executeWithBreaker_openBreaker_failsFastWithoutInvokingOperation() {
        ErrorContext context = manager.context("MarketData", "quote");
        manager.getCircuitBreaker("finnhub", CircuitBreakerConfig.ofMillis(2, 60_000, 300_000, 0));
        AtomicInteger invoked = new AtomicInteger();

        assertThatThrownBy(() -> manager.executeWithBreaker("finnhub", () -> {
            invoked.incrementAndGet();
            throw new ConnectException("refused");
        }, context, null))
                .isInstanceOf(CircuitOpenException.class);
        assertThat(invoked).hasValue(2);

        assertThatThrownBy(() -> manager.executeWithBreaker("finnhub", () -> invoked.incrementAndGet(), context, null))
                .isInstanceOf(CircuitOpenException.class);
        assertThat(invoked).hasValue(2);
    }

    @Test
    void executeWithBreaker_afterRecoveryTimeout_trialSucceedsAndCloses() {
        ErrorContext context = manager.context("MarketData", "quote");
        CircuitBreaker breaker = manager.getCircuitBreaker("finnhub", CircuitBreakerConfig.ofMillis(1, 60_000, 300_000, 0));
        assertThatThrownBy(() -> manager.executeWithBreaker("finnhub", () -> {
            throw new ConnectException("refused");
        }, context, null)).isInstanceOf(CircuitOpenException.class);

        clock.advance(Duration.ofSeconds(61));

        assertThat(manager.executeWithBreaker("finnhub", () -> "quote", context, null)).isEqualTo("quote");
        assertThat(breaker.state()).isEqualTo(CircuitState.CLOSED);
        assertThat(sink.entries(LogLevel.INFO, "CircuitBreaker")).extracting(InMemoryLogSink.LogEntry::message)
                .contains("Circuit breaker finnhub recovered");
    }

    @Test
    void handleError_classifiesDispatchesAndLogs() {
        List<ClassifiedException> handled = new ArrayList<>();
        manager.handlers().register(ErrorKind.RATE_LIMIT, (error, context) -> handled.add(error));
        ErrorContext context = manager.context("LlmClient", "complete");

        ClassifiedException result = manager.handleError(new HttpStatusException(429, "Too Many Requests"), context);

        assertThat(result.kind()).isEqualTo(ErrorKind.RATE_LIMIT);
        assertThat(result.context()).isSameAs(context);
        assertThat(handled).containsExactly(result);
        assertThat(sink.entries(LogLevel.WARN, "LlmClient")).extracting(InMemoryLogSink.LogEntry::message)
                .containsExactly("Rate limit encountered, backing off");
        assertThat(sink.entries(LogLevel.ERROR, "LlmClient")).extracting(InMemoryLogSink.LogEntry::message)
                .containsExactly("Too Many Requests");
    }

    @Test
    void handleError_critical_runsCriticalHandler() {
        manager.handleError(new OutOfMemoryError("Java heap space"), manager.context("Indexer", "build"));

        assertThat(sink.entries(LogLevel.CRITICAL, "Indexer")).extracting(InMemoryLogSink.LogEntry::message)
                .contains("Critical error detected, immediate attention required", "Java heap space");
    }

    @Test
    void handleError_throwingHandler_doesNotPreventLogging() {
        manager.handlers().registerGlobal((error, context) -> {
            throw new IllegalStateException("handler broke");
        });

        ClassifiedException result = manager.handleError(new IOException("disk gone"), manager.context("Cache", "put"));

        assertThat(result.kind()).isEqualTo(ErrorKind.INTERNAL);
        assertThat(sink.errorStats()).containsEntry("INTERNAL_MEDIUM", 1L);
        assertThat(manager.handlers().handlerFailures()).isEqualTo(1);
    }

    @Test
    void executeWithFallback_failure_returnsFallbackAndHandlesError() {
        String result = manager.executeWithFallback(() -> {
            throw new IOException("feed unavailable");
        }, "cached headlines", manager.context("NewsFetcher", "headlines"));

        assertThat(result).isEqualTo("cached headlines");
        assertThat(manager.errorMetrics().count("NewsFetcher", ErrorKind.INTERNAL)).isEqualTo(1);
    }

    @Test
    void executeWithFallback_success_returnsValue() {
        assertThat(manager.executeWithFallback(() -> "live", "cached", manager.context("NewsFetcher", "headlines")))
                .isEqualTo("live");
    }

    @Test
    void wrap_failure_throwsClassifiedException() {
        Supplier<String> wrapped = manager.wrap(() -> {
            throw new HttpStatusException(503, "Service Unavailable");
        }, manager.context("Fundamentals", "income"));

        assertThatThrownBy(wrapped::get)
                .isInstanceOfSatisfying(ClassifiedException.class, e -> assertThat(e.kind()).isEqualTo(ErrorKind.API));
        assertThat(manager.errorMetrics().count("Fundamentals", ErrorKind.API)).isEqualTo(1);
    }

    @Test
    void stats_includeErrorCountsAndBreakerMetrics() {
        manager.getCircuitBreaker("finnhub");
        manager.handleError(new ConnectException("refused"), manager.context("MarketData", "quote"));

        ResilienceStats stats = manager.stats();

        assertThat(stats.errorCounts()).containsEntry("MarketData.NETWORK", 1L);
        assertThat(stats.recentErrorCounts()).containsEntry("MarketData.NETWORK", 1);
        assertThat(stats.circuitBreakers()).containsKey("finnhub");
        assertThat(stats.circuitBreakers().get("finnhub").state()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void resetAll_closesEveryBreaker() {
        CircuitBreaker breaker = manager.getCircuitBreaker("finnhub", CircuitBreakerConfig.ofMillis(1, 60_000, 300_000, 0));
        assertThatThrownBy(() -> breaker.execute(() -> { throw new IOException("down"); }))
                .isInstanceOf(IOException.class);
        assertThat(breaker.state()).isEqualTo(CircuitState.OPEN);

        manager.resetAll();

        assertThat(breaker.state()).isEqualTo(CircuitState.CLOSED);
        assertThat(manager.healthStatuses()).containsEntry("finnhub", HealthStatus.HEALTHY);
    }

    @Test
    void executeWithRetry_operationInterrupted_isNotReportedAsError() {
        try {
            assertThatThrownBy(() -> manager.executeWithRetry(() -> {
                throw new InterruptedException();
            }, manager.context("NewsFetcher", "headlines")))
                    .isInstanceOf(RetryCancelledException.class);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }

        assertThat(sink.errorStats()).isEmpty();
        assertThat(manager.errorMetrics().counts()).isEmpty();
    }

    @Test
    void stats_keepKeysSorted() {
        manager.getCircuitBreaker("newsapi");
        manager.getCircuitBreaker("alphavantage");
        manager.getCircuitBreaker("finnhub");
        manager.handleError(new IOException("disk gone"), manager.context("Zeta", "op"));
        manager.handleError(new ConnectException("refused"), manager.context("Alpha", "op"));

        ResilienceStats stats = manager.stats();

        assertThat(stats.circuitBreakers().keySet()).containsExactly("alphavantage", "finnhub", "newsapi");
        assertThat(stats.errorCounts().keySet()).containsExactly("Alpha.NETWORK", "Zeta.INTERNAL");
        assertThatThrownBy(() -> stats.errorCounts().put("x", 1L))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void build_calledTwice_givesEachManagerItsOwnHandlers() {
        ResilienceManager.Builder builder = ResilienceManager.builder().logSink(sink).clock(clock);

        try (ResilienceManager first = builder.build(); ResilienceManager second = builder.build()) {
            first.handlers().registerGlobal((error, context) -> {});

            assertThat(first.handlers()).isNotSameAs(second.handlers());
            assertThat(first.handlers().globalHandlerCount()).isEqualTo(2);
            assertThat(second.handlers().globalHandlerCount()).isEqualTo(1);
            assertThat(second.handlers().handlerCount(ErrorKind.RATE_LIMIT)).isEqualTo(1);
            assertThat(first.errorMetrics()).isNotSameAs(second.errorMetrics());
        }
    }

    @Test
    void shutdown_rejectsFurtherRetries() {
        manager.shutdown();

        assertThatThrownBy(() -> manager.executeWithRetry(() -> "x", manager.context("NewsFetcher", "headlines")))
                .isInstanceOf(RetryCancelledException.class);
    }

    @Test
    void defaultHandlers_canBeDisabled() {
        try (ResilienceManager bare = ResilienceManager.builder()
                .logSink(sink)
                .clock(clock)
                .defaultHandlers(false)
                .build()) {
            assertThat(bare.handlers().handlerCount(ErrorKind.RATE_LIMIT)).isZero();
            assertThat(bare.handlers().criticalHandlerCount()).isZero();
            assertThat(bare.handlers().globalHandlerCount()).isEqualTo(1);
        }
        assertThat(manager.handlers().handlerCount(ErrorKind.RATE_LIMIT)).isEqualTo(1);
        assertThat(manager.handlers().handlerCount(ErrorKind.AUTHENTICATION)).isEqualTo(1);
    }
}
