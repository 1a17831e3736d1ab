package com.taskforge.core.react;

import com.taskforge.core.model.Intent;
import com.taskforge.core.model.TranscriptEntry;

import java.util.List;

/**
 * Outcome of one {@link ReActController} run.
 *
 * @param result               final answer text (best effort when the run stopped early)
 * @param transcript           entries produced during this run, in order
 * @param executedCapabilities distinct capabilities invoked, in first-use order
 * @param continuationAttempts continuation prompts issued after the first cycle
 * @param intent               the intent the run was checked against
 */
public record ReActResult(
    String result,
    List<TranscriptEntry> transcript,
    List<String> executedCapabilities,
    int continuationAttempts,
    Intent intent
) {}
