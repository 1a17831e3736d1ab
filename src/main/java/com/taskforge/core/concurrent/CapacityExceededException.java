package com.taskforge.core.concurrent;

/**
 * Thrown synchronously at submission time when a bounded registry is full.
 */
public class CapacityExceededException extends RuntimeException {

    private final int limit;

    public CapacityExceededException(String message, int limit) {
        super(message);
        this.limit = limit;
    }

    public int getLimit() {
        return limit;
    }
}
