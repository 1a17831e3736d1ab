package com.taskforge.core.router;

/**
 * Unchecked wrapper for a checked failure thrown by a capability. The message is
 * the original one so error classification still sees it.
 */
public class CapabilityExecutionException extends RuntimeException {

    private final String capability;

    public CapabilityExecutionException(String capability, Throwable cause) {
        super(cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName(), cause);
        this.capability = capability;
    }

    public String getCapability() {
        return capability;
    }
}
