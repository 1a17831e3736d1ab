package com.taskforge.core.spawn;

import java.util.List;
import java.util.Map;

/**
 * Counts of sessions per status plus the names of the active ones.
 *
 * @param text display form listing up to ten of the newest sessions
 */
public record SessionSummary(int total, Map<String, Integer> byStatus, List<String> activeNames, String text) {}
