package com.taskforge.core.queue;

import com.taskforge.core.model.TranscriptEntry;

import java.util.List;

/**
 * What a caller needs to restart a task from its last checkpoint.
 */
public record ResumeData(
    String instruction,
    List<TranscriptEntry> transcript,
    Checkpoint checkpoint,
    int remainingIterations
) {}
