package com.taskforge.core.queue;

import com.taskforge.core.model.TranscriptEntry;

import java.util.List;

public record TaskResult(String result, List<TranscriptEntry> transcript) {

    public TaskResult {
        transcript = transcript == null ? List.of() : List.copyOf(transcript);
    }

    public static TaskResult of(String result) {
        return new TaskResult(result, List.of());
    }
}
