package com.taskforge.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Action category of a single step within an {@link Intent}.
 */
public enum TaskAction {
    EXTRACT("extract the data"),
    SEARCH("search for information"),
    CALCULATE("compute the result"),
    CREATE("create the artifact"),
    COMPARE("compare the items"),
    ANALYZE("analyze the data"),
    TRANSFORM("transform the data"),
    NAVIGATE("navigate to the target"),
    CONFIGURE("apply the configuration"),
    DIAGNOSE("diagnose the problem");

    private final String description;

    TaskAction(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }

    /** Wire name used in model prompts and JSON payloads. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<TaskAction> fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
