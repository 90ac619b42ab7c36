package org.javai.resilience.classify;

import org.javai.resilience.ClassifiedException;
import org.javai.resilience.ErrorContext;

/**
 * Places raw failures in the error taxonomy.
 * Implementations must be pure functions of their inputs.
 */
@FunctionalInterface
public interface ErrorClassifier {

    /**
     * Classifies a failure. A failure that is already a {@link ClassifiedException}
     * must be returned unchanged.
     *
     * @param error The raw failure
     * @param context Where the failure happened
     * @return The classified form of the failure
     */
    ClassifiedException classify(Throwable error, ErrorContext context);
}
