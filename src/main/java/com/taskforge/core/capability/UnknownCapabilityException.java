package com.taskforge.core.capability;

public class UnknownCapabilityException extends RuntimeException {

    public UnknownCapabilityException(String name) {
        super("Unknown capability: " + name);
    }
}
