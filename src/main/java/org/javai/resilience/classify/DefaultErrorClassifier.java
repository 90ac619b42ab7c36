package org.javai.resilience.classify;

import org.javai.resilience.ClassifiedException;
import org.javai.resilience.ErrorContext;
import org.javai.resilience.ErrorKind;

import java.net.ConnectException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Default classification rules for raw failures.
 *
 * <p>Rules are applied in order, first match wins:</p>
 * <ol>
 *   <li>Already classified: returned unchanged</li>
 *   <li>HTTP 401/403 anywhere in the cause chain: AUTHENTICATION</li>
 *   <li>HTTP 429: RATE_LIMIT</li>
 *   <li>HTTP 5xx: API</li>
 *   <li>Socket, HTTP or {@link TimeoutException} timeouts: TIMEOUT</li>
 *   <li>Connection refused/reset, unknown host and other socket errors: NETWORK</li>
 *   <li>{@link OutOfMemoryError}: MEMORY</li>
 *   <li>Message mentioning a timeout: TIMEOUT</li>
 *   <li>Anything else: INTERNAL</li>
 * </ol>
 *
 * <p>Severity, recovery strategy and retryability come from the {@link ErrorKind} defaults.</p>
 */
public class DefaultErrorClassifier implements ErrorClassifier {

    private static final int MAX_CAUSE_DEPTH = 10;

    @Override
    public ClassifiedException classify(Throwable error, ErrorContext context) {
        if (error instanceof ClassifiedException classified) {
            return classified;
        }
        return ClassifiedException.builder(kindOf(error), messageOf(error), context)
                .cause(error)
                .build();
    }

    static ErrorKind kindOf(Throwable t) {
        Integer status = findStatusCode(t);
        if (status != null) {
            if (status == 401 || status == 403) {
                return ErrorKind.AUTHENTICATION;
            }
            if (status == 429) {
                return ErrorKind.RATE_LIMIT;
            }
            if (status >= 500 && status < 600) {
                return ErrorKind.API;
            }
        }

        if (t instanceof SocketTimeoutException
                || t instanceof HttpTimeoutException
                || t instanceof TimeoutException) {
            return ErrorKind.TIMEOUT;
        }

        if (t instanceof ConnectException
                || t instanceof SocketException
                || t instanceof UnknownHostException) {
            return ErrorKind.NETWORK;
        }

        if (t instanceof OutOfMemoryError) {
            return ErrorKind.MEMORY;
        }

        if (mentionsTimeout(t.getMessage())) {
            return ErrorKind.TIMEOUT;
        }

        return ErrorKind.INTERNAL;
    }

    private static Integer findStatusCode(Throwable t) {
        Throwable current = t;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof HttpStatusAware aware) {
                return aware.statusCode();
            }
            current = current.getCause();
        }
        return null;
    }

    private static boolean mentionsTimeout(String message) {
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        return lower.contains("timeout") || lower.contains("timed out");
    }

    private static String messageOf(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getName();
    }
}
