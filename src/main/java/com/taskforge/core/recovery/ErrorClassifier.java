package com.taskforge.core.recovery;

import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientResponseException;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps raw failures onto {@link ErrorKind}s by exception type, status code and message patterns.
 * <p>
 * Rules are checked in a fixed order and the first match wins: network, rate limit,
 * authentication, client status, server status, tool, validation, timeout, unknown.
 */
@Component
public class ErrorClassifier {

    private static final Pattern STATUS_IN_MESSAGE =
            Pattern.compile("\\b(?:status|http|code)[\\s:=]*([45]\\d\\d)\\b", Pattern.CASE_INSENSITIVE);

    public ClassifiedError classify(Throwable error) {
        String message = messageOf(error);
        String lower = message.toLowerCase(Locale.ROOT);
        Integer status = statusOf(error, message);

        if (rootTimeout(error)) {
            return of(ErrorKind.TIMEOUT_ERROR, Severity.MEDIUM, message, status, true,
                    RecoveryStrategy.RETRY_WITH_BACKOFF, error);
        }
        if (error instanceof ConnectException || error instanceof UnknownHostException
                || error instanceof NoRouteToHostException
                || containsAny(lower, "network", "fetch", "connection", "timeout", "econnrefused", "etimedout")) {
            return of(ErrorKind.NETWORK_ERROR, Severity.HIGH, message, status, true,
                    RecoveryStrategy.RETRY_WITH_BACKOFF, error);
        }
        if (containsAny(lower, "rate limit", "too many requests") || isStatus(status, 429)) {
            return of(ErrorKind.RATE_LIMIT_ERROR, Severity.MEDIUM, message, status, true,
                    RecoveryStrategy.RETRY_WITH_BACKOFF, error);
        }
        if (containsAny(lower, "unauthorized", "authentication", "api key") || isStatus(status, 401)
                || isStatus(status, 403)) {
            return of(ErrorKind.AUTHENTICATION_ERROR, Severity.CRITICAL, message, status, false,
                    RecoveryStrategy.ABORT, error);
        }
        if (status != null && status >= 400 && status < 500) {
            boolean notFound = status == 404;
            return of(ErrorKind.API_ERROR, notFound ? Severity.LOW : Severity.MEDIUM, message, status,
                    status == 408 || status == 429,
                    notFound ? RecoveryStrategy.SKIP_STEP : RecoveryStrategy.RETRY, error);
        }
        if (status != null && status >= 500) {
            return of(ErrorKind.API_ERROR, Severity.HIGH, message, status, true,
                    RecoveryStrategy.RETRY_WITH_BACKOFF, error);
        }
        if (containsAny(lower, "tool", "capability", "instrument", "function")) {
            return of(ErrorKind.TOOL_ERROR, Severity.MEDIUM, message, status, true,
                    RecoveryStrategy.ALTERNATIVE_TOOL, error);
        }
        if (containsAny(lower, "validation", "invalid", "required", "missing")) {
            return of(ErrorKind.VALIDATION_ERROR, Severity.LOW, message, status, false,
                    RecoveryStrategy.SIMPLIFY_REQUEST, error);
        }
        if (lower.contains("timed out")) {
            return of(ErrorKind.TIMEOUT_ERROR, Severity.MEDIUM, message, status, true,
                    RecoveryStrategy.RETRY_WITH_BACKOFF, error);
        }
        return of(ErrorKind.UNKNOWN_ERROR, Severity.MEDIUM, message, status, true,
                RecoveryStrategy.RETRY, error);
    }

    /**
     * Picks the strategy to execute. Critical errors always abort. Non-retryable errors
     * abort unless the suggestion does not re-invoke anything (skip or simplify).
     */
    public RecoveryStrategy selectStrategy(ClassifiedError error) {
        if (error.severity() == Severity.CRITICAL) {
            return RecoveryStrategy.ABORT;
        }
        if (!error.retryable() && !error.suggestedStrategy().isTerminal()) {
            return RecoveryStrategy.ABORT;
        }
        return error.suggestedStrategy();
    }

    private static ClassifiedError of(ErrorKind kind, Severity severity, String message, Integer status,
                                      boolean retryable, RecoveryStrategy strategy, Throwable cause) {
        return new ClassifiedError(kind, severity, message, status, retryable, strategy, cause);
    }

    /** A {@link TimeoutException}, possibly wrapped once by the router. */
    private static boolean rootTimeout(Throwable error) {
        return error instanceof TimeoutException
                || (error != null && error.getCause() instanceof TimeoutException);
    }

    private static String messageOf(Throwable error) {
        if (error == null) {
            return "Unknown error";
        }
        String message = error.getMessage();
        return message != null && !message.isBlank() ? message : error.getClass().getSimpleName();
    }

    private static Integer statusOf(Throwable error, String message) {
        if (error instanceof RestClientResponseException responseException) {
            return responseException.getStatusCode().value();
        }
        if (error instanceof StatusCodeCarrier carrier) {
            return carrier.statusCode();
        }
        Matcher m = STATUS_IN_MESSAGE.matcher(message);
        return m.find() ? Integer.valueOf(m.group(1)) : null;
    }

    private static boolean isStatus(Integer status, int expected) {
        return status != null && status == expected;
    }

    private static boolean containsAny(String text, String... needles) {
        for (String needle : needles) {
            if (text.contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
