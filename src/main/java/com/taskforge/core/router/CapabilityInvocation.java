package com.taskforge.core.router;

import java.time.Instant;
import java.util.Map;

/**
 * A completed capability call handed to {@link InvocationHook}s.
 */
public record CapabilityInvocation(
    String runId,
    String capability,
    Map<String, Object> args,
    Object result,
    long latencyMs,
    Instant completedAt
) {}
