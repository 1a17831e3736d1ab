package com.taskforge.core.recovery;

import com.taskforge.core.concurrent.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;

/**
 * Exponential backoff settings plus the two retry loops built on them.
 *
 * @param maxRetries        total attempts, including the first
 * @param initialDelayMs    pause after the first failure
 * @param maxDelayMs        ceiling for any single pause
 * @param backoffMultiplier growth factor between pauses
 */
public record RetryPolicy(int maxRetries, long initialDelayMs, long maxDelayMs, double backoffMultiplier) {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, 1000, 10000, 2.0);
    }

    /**
     * Runs {@code call} up to {@link #maxRetries()} times, sleeping with exponential backoff between attempts.
     */
    public RecoveryOutcome retryWithBackoff(Callable<Object> call, Sleeper sleeper) {
        Exception last = null;
        long delay = initialDelayMs;
        for (int attempt = 0; attempt < maxRetries; attempt++) {
            try {
                return RecoveryOutcome.success(call.call(), RecoveryStrategy.RETRY_WITH_BACKOFF, attempt + 1);
            } catch (Exception e) {
                last = e;
                log.debug("Backoff attempt {}/{} failed: {}", attempt + 1, maxRetries, e.getMessage());
                if (attempt < maxRetries - 1) {
                    if (!pause(sleeper, delay)) {
                        return RecoveryOutcome.failure(RecoveryStrategy.RETRY_WITH_BACKOFF, attempt + 1,
                                "Interrupted while backing off");
                    }
                    delay = Math.min((long) (delay * backoffMultiplier), maxDelayMs);
                }
            }
        }
        return RecoveryOutcome.failure(RecoveryStrategy.RETRY_WITH_BACKOFF, maxRetries, messageOf(last));
    }

    /**
     * Runs {@code call} up to {@code attempts} times without pausing.
     */
    public static RecoveryOutcome retrySimple(Callable<Object> call, int attempts) {
        Exception last = null;
        for (int attempt = 0; attempt < attempts; attempt++) {
            try {
                return RecoveryOutcome.success(call.call(), RecoveryStrategy.RETRY, attempt + 1);
            } catch (Exception e) {
                last = e;
            }
        }
        return RecoveryOutcome.failure(RecoveryStrategy.RETRY, attempts, messageOf(last));
    }

    private static boolean pause(Sleeper sleeper, long delay) {
        try {
            sleeper.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static String messageOf(Exception e) {
        return e != null && e.getMessage() != null ? e.getMessage() : "All retries failed";
    }
}
