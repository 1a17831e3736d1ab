package com.taskforge.core.react;

import java.util.Map;

/**
 * A capability call requested by the model during a think turn.
 */
public record CapabilityCall(String capability, Map<String, Object> args) {

    public CapabilityCall {
        args = args == null ? Map.of() : args;
    }
}
