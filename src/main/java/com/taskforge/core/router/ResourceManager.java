package com.taskforge.core.router;

/**
 * Quota gate consulted before and after each capability invocation.
 */
public interface ResourceManager {

    LimitCheck checkLimits(String capability, long estimatedTokens);

    void recordUsage(String capability, long tokens);
}
