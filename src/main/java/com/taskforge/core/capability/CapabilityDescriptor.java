package com.taskforge.core.capability;

import java.util.List;

/**
 * Prompt-facing summary of a registered capability.
 */
public record CapabilityDescriptor(String name, String description, List<String> actions) {}
