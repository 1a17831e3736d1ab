package com.taskforge.core.spawn;

import java.util.List;

/**
 * What a {@link SessionExecutor} hands back on success.
 */
public record SessionOutcome(String result, String signature, List<String> toolsUsed) {

    public SessionOutcome {
        toolsUsed = toolsUsed == null ? List.of() : List.copyOf(toolsUsed);
    }

    public static SessionOutcome of(String result) {
        return new SessionOutcome(result, null, List.of());
    }
}
