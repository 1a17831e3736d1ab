package com.taskforge.core.spawn;

/**
 * Request to run an instruction in its own isolated session.
 *
 * @param name          human-readable label, shown in summaries and capacity errors
 * @param instruction   what the session should do
 * @param timeoutMs     per-session timeout; null for the configured default
 * @param maxIterations iteration budget; null for the configured default
 */
public record SpawnConfig(String name, String instruction, Long timeoutMs, Integer maxIterations) {

    public static SpawnConfig of(String name, String instruction) {
        return new SpawnConfig(name, instruction, null, null);
    }
}
