package org.javai.resilience.ops;

import org.javai.resilience.ClassifiedException;
import org.javai.resilience.ErrorKind;
import org.javai.resilience.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Maps error kinds to ordered handler lists and runs them for each dispatched error.
 *
 * <p>{@link #dispatch} runs, in registration order, the handlers for the error's kind,
 * then the global handlers, then (for CRITICAL errors only) the critical handlers.
 * Every invocation is isolated: a handler that throws is logged and the remaining
 * handlers still run. {@code dispatch} never throws.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * HandlerRegistry registry = new HandlerRegistry();
 * registry.register(ErrorKind.RATE_LIMIT, (error, context) -> throttle.slowDown());
 * registry.registerGlobal(metricsHandler);
 * registry.registerCritical((error, context) -> pager.page(error.getMessage()));
 * }</pre>
 */
public final class HandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(HandlerRegistry.class);

    private final Map<ErrorKind, List<ErrorHandler>> handlers = new ConcurrentHashMap<>();
    private final List<ErrorHandler> globalHandlers = new CopyOnWriteArrayList<>();
    private final List<ErrorHandler> criticalHandlers = new CopyOnWriteArrayList<>();
    private final AtomicLong handlerFailures = new AtomicLong();

    /**
     * Adds a handler that runs for errors of the given kind.
     */
    public void register(ErrorKind kind, ErrorHandler handler) {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(handler, "handler must not be null");
        handlers.computeIfAbsent(kind, k -> new CopyOnWriteArrayList<>()).add(handler);
    }

    /**
     * Adds a handler that runs for every error, after the kind-specific handlers.
     */
    public void registerGlobal(ErrorHandler handler) {
        globalHandlers.add(Objects.requireNonNull(handler, "handler must not be null"));
    }

    /**
     * Adds a handler that runs only for CRITICAL errors, after the global handlers.
     */
    public void registerCritical(ErrorHandler handler) {
        criticalHandlers.add(Objects.requireNonNull(handler, "handler must not be null"));
    }

    public void dispatch(ClassifiedException error) {
        if (error == null) {
            log.warn("Ignoring dispatch of null error");
            return;
        }
        for (ErrorHandler handler : handlers.getOrDefault(error.kind(), List.of())) {
            invoke("kind", handler, error);
        }
        for (ErrorHandler handler : globalHandlers) {
            invoke("global", handler, error);
        }
        if (error.severity() == Severity.CRITICAL) {
            for (ErrorHandler handler : criticalHandlers) {
                invoke("critical", handler, error);
            }
        }
    }

    public int handlerCount(ErrorKind kind) {
        return handlers.getOrDefault(kind, List.of()).size();
    }

    public int globalHandlerCount() {
        return globalHandlers.size();
    }

    public int criticalHandlerCount() {
        return criticalHandlers.size();
    }

    /**
     * Number of handler invocations that threw since this registry was created.
     */
    public long handlerFailures() {
        return handlerFailures.get();
    }

    private void invoke(String scope, ErrorHandler handler, ClassifiedException error) {
        try {
            handler.handle(error, error.context());
        } catch (Exception e) {
            handlerFailures.incrementAndGet();
            log.error("Error in {} handler {} while handling {} from [{}.{}]",
                    scope,
                    handler.getClass().getName(),
                    error.kind(),
                    error.context().component(),
                    error.context().operation(),
                    e);
        }
    }
}
