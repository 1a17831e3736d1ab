package com.taskforge.core.recovery;

/**
 * A raw failure mapped onto the error taxonomy.
 *
 * @param kind              taxonomy bucket
 * @param severity          how bad the failure is
 * @param message           original error message
 * @param statusCode        HTTP-like status code when one was found, otherwise null
 * @param retryable         whether re-invoking can plausibly succeed
 * @param suggestedStrategy strategy proposed by the classifier
 * @param cause             the original throwable
 */
public record ClassifiedError(
    ErrorKind kind,
    Severity severity,
    String message,
    Integer statusCode,
    boolean retryable,
    RecoveryStrategy suggestedStrategy,
    Throwable cause
) {}
