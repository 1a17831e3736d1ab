package com.taskforge.core.router;

/**
 * Post-processing hook run after every successful invocation (signing, audit trail,
 * analytics). Hooks run off the calling thread and their failures are only logged.
 */
@FunctionalInterface
public interface InvocationHook {

    void afterInvocation(CapabilityInvocation invocation) throws Exception;
}
