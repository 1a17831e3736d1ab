package com.taskforge.core.spawn;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SessionStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean isActive() {
        return this == PENDING || this == RUNNING;
    }

    public boolean canTransitionTo(SessionStatus next) {
        if (isTerminal() || next == this) {
            return false;
        }
        return next.isTerminal() || (this == PENDING && next == RUNNING);
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
