package com.marketrouter.common.breaker;

import com.marketrouter.common.exception.CircuitOpenException;
import com.marketrouter.common.exception.ProviderException;
import org.apache.commons.lang3.StringUtils;
import reactor.core.Exceptions;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps an arbitrary provider error to a {@link FailureType}.
 *
 * <p>Resolution order:
 * <ol>
 *   <li>{@link ProviderException} already carries its type.</li>
 *   <li>Well-known JDK exception types (timeouts, socket/connect errors, parse errors).</li>
 *   <li>Keywords in the exception class name.</li>
 *   <li>Keywords in the message.</li>
 * </ol>
 * Anything left over is {@link FailureType#UNKNOWN}.
 *
 * <p>Stateless and thread-safe.
 */
public final class FailureClassifier {

    private static final String[] TIMEOUT_KEYWORDS      = {"timeout", "timed out"};
    private static final String[] RATE_LIMIT_KEYWORDS   = {"rate limit", "rate-limit", "ratelimit", "too many requests", "429", "quota"};
    private static final String[] CONNECTION_KEYWORDS   = {"connection", "connect", "network", "unreachable", "refused", "reset by peer"};
    private static final String[] SERVER_KEYWORDS       = {"server error", "internal error", "bad gateway", "service unavailable",
                                                           "500", "502", "503", "504"};
    private static final String[] DATA_QUALITY_KEYWORDS = {"empty", "parse", "format", "invalid data", "missing field",
                                                           "malformed", "data quality"};

    private FailureClassifier() {}

    public static FailureType classify(Throwable error) {
        if (error == null) {
            return FailureType.UNKNOWN;
        }
        Throwable t = unwrap(error);

        if (t instanceof ProviderException pe && pe.getFailureType() != null) {
            return pe.getFailureType();
        }
        if (t instanceof CircuitOpenException) {
            return FailureType.UNKNOWN;
        }
        if (t instanceof TimeoutException || t instanceof SocketTimeoutException) {
            return FailureType.TIMEOUT;
        }
        if (t instanceof ConnectException || t instanceof UnknownHostException
                || t instanceof NoRouteToHostException) {
            return FailureType.CONNECTION;
        }
        if (t instanceof NumberFormatException) {
            return FailureType.DATA_QUALITY;
        }

        String typeName = t.getClass().getSimpleName();
        if (StringUtils.containsIgnoreCase(typeName, "timeout")) {
            return FailureType.TIMEOUT;
        }
        if (StringUtils.containsAnyIgnoreCase(typeName, "RateLimit", "TooManyRequests")) {
            return FailureType.RATE_LIMIT;
        }
        if (StringUtils.containsIgnoreCase(typeName, "connect")) {
            return FailureType.CONNECTION;
        }

        String message = t.getMessage();
        if (StringUtils.isBlank(message)) {
            return FailureType.UNKNOWN;
        }
        if (StringUtils.containsAnyIgnoreCase(message, TIMEOUT_KEYWORDS)) {
            return FailureType.TIMEOUT;
        }
        if (StringUtils.containsAnyIgnoreCase(message, RATE_LIMIT_KEYWORDS)) {
            return FailureType.RATE_LIMIT;
        }
        if (StringUtils.containsAnyIgnoreCase(message, CONNECTION_KEYWORDS)) {
            return FailureType.CONNECTION;
        }
        if (StringUtils.containsAnyIgnoreCase(message, SERVER_KEYWORDS)) {
            return FailureType.SERVER_ERROR;
        }
        if (StringUtils.containsAnyIgnoreCase(message, DATA_QUALITY_KEYWORDS)) {
            return FailureType.DATA_QUALITY;
        }
        return FailureType.UNKNOWN;
    }

    /**
     * Strips the wrappers that executors and Reactor's {@code block()} put around the
     * real cause.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable t = Exceptions.unwrap(error);
        while ((t instanceof ExecutionException || t instanceof CompletionException) && t.getCause() != null) {
            t = Exceptions.unwrap(t.getCause());
        }
        return t;
    }
}
