package com.taskforge.core.queue;

import com.taskforge.core.model.TranscriptEntry;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Intermediate state of a background task.
 *
 * @param iteration          progress-report count the checkpoint was taken at
 * @param transcriptSnapshot transcript at that point
 * @param partialResults     results gathered so far, keyed by the executor's own names;
 *                           null values are kept
 * @param savedAt            when it was stored
 */
public record Checkpoint(
    int iteration,
    List<TranscriptEntry> transcriptSnapshot,
    Map<String, Object> partialResults,
    Instant savedAt
) {

    public Checkpoint {
        transcriptSnapshot = transcriptSnapshot == null ? List.of() : List.copyOf(transcriptSnapshot);
        partialResults = partialResults == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(partialResults));
    }
}
