package org.javai.resilience.retry;

import java.util.concurrent.CancellationException;

/**
 * Signals that a retry loop was abandoned because its engine shut down or its thread
 * was interrupted during backoff. This is not an operational failure: the retry
 * engine neither classifies it nor reports it to its listener.
 */
public class RetryCancelledException extends CancellationException {

    public RetryCancelledException(String message) {
        super(message);
    }

    public RetryCancelledException(String message, Throwable cause) {
        super(message);
        initCause(cause);
    }
}
