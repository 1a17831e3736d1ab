package com.taskforge.core.capability;

/**
 * Thrown when a capability call is refused before the capability is invoked.
 */
public class CapabilityRejectedException extends RuntimeException {

    private final String capability;
    private final String reason;

    public CapabilityRejectedException(String capability, String reason, String message) {
        super(message);
        this.capability = capability;
        this.reason = reason;
    }

    public String getCapability() {
        return capability;
    }

    /** Short machine-readable rejection reason, used as a metric tag. */
    public String getReason() {
        return reason;
    }
}
