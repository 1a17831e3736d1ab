package com.taskforge.core.recovery;

import java.util.Locale;

/**
 * What to do after a capability call failed.
 */
public enum RecoveryStrategy {
    RETRY,
    RETRY_WITH_BACKOFF,
    ALTERNATIVE_TOOL,
    SKIP_STEP,
    SIMPLIFY_REQUEST,
    ABORT;

    /** Strategies that never re-invoke anything. */
    public boolean isTerminal() {
        return this == SKIP_STEP || this == SIMPLIFY_REQUEST || this == ABORT;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
