package com.taskforge.core.intent;

import com.taskforge.core.capability.CapabilityRegistry;
import com.taskforge.core.model.Intent;
import com.taskforge.core.model.TaskCompletion;
import com.taskforge.core.model.TaskStep;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Decides which steps of an {@link Intent} the executed capabilities have satisfied.
 * <p>
 * A step counts as done when one of its required capabilities ran, or when any
 * executed capability is tagged with the step's action.
 */
@Component
public class TaskCompletionValidator {

    private final CapabilityRegistry registry;

    public TaskCompletionValidator(CapabilityRegistry registry) {
        this.registry = registry;
    }

    public TaskCompletion validate(Intent intent, Collection<String> executedCapabilities) {
        List<TaskStep> completed = new ArrayList<>();
        List<TaskStep> missing = new ArrayList<>();
        for (TaskStep step : intent.steps()) {
            if (isSatisfied(step, executedCapabilities)) {
                completed.add(step);
            } else {
                missing.add(step);
            }
        }
        String next = missing.isEmpty() ? null : missing.get(0).firstCapability();
        return new TaskCompletion(missing.isEmpty(), completed, missing, next);
    }

    private boolean isSatisfied(TaskStep step, Collection<String> executed) {
        for (String required : step.requiredCapabilities()) {
            if (executed.contains(required)) {
                return true;
            }
        }
        for (String capability : executed) {
            if (registry.actionsFor(capability).contains(step.action())) {
                return true;
            }
        }
        return false;
    }
}
