package com.taskforge.core.react;

import java.util.List;

/**
 * Structured answer the model gives on each think turn: either capability calls
 * to make next, or a final answer when {@code calls} is empty.
 */
public record ReActTurn(String thought, List<CapabilityCall> calls, String answer) {

    public ReActTurn {
        calls = calls == null ? List.of() : calls;
    }
}
