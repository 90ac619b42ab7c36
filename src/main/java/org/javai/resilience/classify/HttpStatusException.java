package org.javai.resilience.classify;

import java.io.IOException;

/**
 * A ready-made {@link HttpStatusAware} exception for API clients that report
 * non-success responses by throwing.
 */
public class HttpStatusException extends IOException implements HttpStatusAware {

    private final int statusCode;

    public HttpStatusException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public HttpStatusException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    @Override
    public int statusCode() {
        return statusCode;
    }
}
