package com.taskforge.core.queue;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TaskStatus {
    QUEUED,
    RUNNING,
    PAUSED,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Forward-only moves plus {@code PAUSED -> RUNNING}. Any non-terminal status may
     * end in a terminal one; a terminal status never changes again.
     */
    public boolean canTransitionTo(TaskStatus next) {
        if (isTerminal() || next == this) {
            return false;
        }
        if (next.isTerminal()) {
            return true;
        }
        return switch (this) {
            case QUEUED -> next == RUNNING;
            case RUNNING -> next == PAUSED;
            case PAUSED -> next == RUNNING;
            default -> false;
        };
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
