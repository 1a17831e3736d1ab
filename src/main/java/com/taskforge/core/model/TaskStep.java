package com.taskforge.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * One ordered step of a decomposed instruction.
 *
 * @param action               what kind of work the step performs
 * @param requiredCapabilities capability names that can satisfy the step, in preference order
 * @param reasoning            short explanation of why the step exists
 */
public record TaskStep(
    TaskAction action,
    List<String> requiredCapabilities,
    String reasoning
) implements Serializable {

    public TaskStep {
        requiredCapabilities = requiredCapabilities == null ? List.of() : List.copyOf(requiredCapabilities);
        reasoning = reasoning == null ? "" : reasoning;
    }

    public String firstCapability() {
        return requiredCapabilities.isEmpty() ? null : requiredCapabilities.get(0);
    }
}
