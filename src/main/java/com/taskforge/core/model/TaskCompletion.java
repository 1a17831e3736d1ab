package com.taskforge.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Outcome of checking an {@link Intent} against the capabilities that actually ran.
 *
 * @param complete                true when every step is satisfied
 * @param completedSteps          satisfied steps, in intent order
 * @param missingSteps            unsatisfied steps, in intent order
 * @param suggestedNextCapability first required capability of the first missing step (nullable)
 */
public record TaskCompletion(
    boolean complete,
    List<TaskStep> completedSteps,
    List<TaskStep> missingSteps,
    String suggestedNextCapability
) implements Serializable {}
