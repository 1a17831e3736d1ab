package com.taskforge.core.recovery;

/**
 * Result of executing a {@link RecoveryStrategy}.
 *
 * @param recovered true when {@code result} should be returned in place of the error
 * @param result    replacement result (may be a structured failure for skip/simplify)
 * @param strategy  the strategy that ran
 * @param attempts  number of invocations made while recovering
 * @param error     last error message when not recovered
 */
public record RecoveryOutcome(
    boolean recovered,
    Object result,
    RecoveryStrategy strategy,
    int attempts,
    String error
) {

    public static RecoveryOutcome success(Object result, RecoveryStrategy strategy, int attempts) {
        return new RecoveryOutcome(true, result, strategy, attempts, null);
    }

    public static RecoveryOutcome failure(RecoveryStrategy strategy, int attempts, String error) {
        return new RecoveryOutcome(false, null, strategy, attempts, error);
    }
}
