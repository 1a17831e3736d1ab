package com.taskforge.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Decomposition of a natural-language instruction into ordered steps.
 */
public record Intent(
    List<TaskStep> steps,
    boolean multiStep,
    ClassifiedBy classifiedBy
) implements Serializable {

    public Intent {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public static Intent of(List<TaskStep> steps, ClassifiedBy classifiedBy) {
        return new Intent(steps, steps != null && steps.size() > 1, classifiedBy);
    }

    public enum ClassifiedBy {
        MODEL,
        FALLBACK
    }
}
