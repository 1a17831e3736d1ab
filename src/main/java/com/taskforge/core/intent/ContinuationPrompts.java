package com.taskforge.core.intent;

import com.taskforge.core.model.TaskStep;

import java.util.Map;

/**
 * Builds the hint appended to a transcript when a multi-step task is not finished yet.
 */
public final class ContinuationPrompts {

    private ContinuationPrompts() {}

    public static String build(TaskStep pendingStep, Object lastResult) {
        StringBuilder prompt = new StringBuilder();
        if (lastResult instanceof Map<?, ?> map && map.get("rows_count") != null) {
            prompt.append("Extracted ").append(map.get("rows_count")).append(" rows. ");
        }
        prompt.append("Continue: next step - ").append(pendingStep.action().description());
        if (!pendingStep.reasoning().isBlank()) {
            prompt.append(" (").append(pendingStep.reasoning()).append(")");
        }
        prompt.append(". ");
        String capability = pendingStep.firstCapability();
        if (capability != null) {
            prompt.append("Use `").append(capability).append("` with data from the previous step.");
        } else {
            prompt.append("Pick a suitable capability and use data from the previous step.");
        }
        return prompt.toString();
    }
}
