package com.taskforge.core.capability;

import com.taskforge.core.model.TaskAction;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A named external operation the agent can invoke.
 * <p>
 * Implementations are registered in the {@link CapabilityRegistry}; every invocation
 * goes through the router, never directly.
 */
public interface Capability {

    String name();

    default String description() {
        return "";
    }

    /** Action categories this capability can satisfy when checking task completion. */
    default Set<TaskAction> actions() {
        return Set.of();
    }

    /**
     * Checks arguments before invocation.
     *
     * @throws CapabilityRejectedException when the arguments are unacceptable
     */
    default void validate(Map<String, Object> args) {
    }

    Object invoke(Map<String, Object> args) throws Exception;

    /**
     * Lets a capability demand an obligatory next call after it returned {@code result}.
     */
    default Optional<PendingFollowUp> followUpFor(Map<String, Object> args, Object result) {
        return Optional.empty();
    }
}
