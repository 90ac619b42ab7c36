package org.javai.resilience.classify;

/**
 * Implemented by exceptions that carry an HTTP response status, so that
 * {@link DefaultErrorClassifier} can classify them without knowing the client library.
 */
public interface HttpStatusAware {

    int statusCode();
}
