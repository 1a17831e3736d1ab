package com.taskforge.core.router;

/**
 * Thrown when a capability keeps returning the same non-informative result.
 */
public class LoopDetectedException extends RuntimeException {

    private final String capability;
    private final int repeats;

    public LoopDetectedException(String capability, int repeats) {
        super("Capability " + capability + " returned the same non-informative result " + repeats + " times");
        this.capability = capability;
        this.repeats = repeats;
    }

    public String getCapability() {
        return capability;
    }

    public int getRepeats() {
        return repeats;
    }
}
