package org.javai.resilience.ops;

import org.javai.resilience.ClassifiedException;
import org.javai.resilience.ErrorContext;

/**
 * A side-effecting reaction to a classified error, such as an alert or a metric.
 * Handlers may fail; {@link HandlerRegistry} isolates their failures.
 */
@FunctionalInterface
public interface ErrorHandler {

    void handle(ClassifiedException error, ErrorContext context) throws Exception;
}
