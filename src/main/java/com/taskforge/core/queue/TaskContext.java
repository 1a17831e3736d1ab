package com.taskforge.core.queue;

import com.taskforge.core.concurrent.CancellationToken;
import com.taskforge.core.model.TranscriptEntry;

import java.util.List;
import java.util.Map;

/**
 * Handle given to a {@link TaskExecutor} for reporting progress and observing cancellation.
 */
public final class TaskContext {

    private final TaskQueue queue;
    private final BackgroundTask task;
    private final CancellationToken token;

    TaskContext(TaskQueue queue, BackgroundTask task, CancellationToken token) {
        this.queue = queue;
        this.task = task;
        this.token = token;
    }

    public String taskId() {
        return task.getId();
    }

    /**
     * Reports progress. Every report counts as one iteration and may trigger an
     * automatic checkpoint.
     */
    public void reportProgress(int percent, String step) {
        queue.reportIteration(task, percent, step);
    }

    public boolean checkpoint(int iteration, List<TranscriptEntry> transcript, Map<String, Object> partialResults) {
        return queue.saveCheckpoint(task.getId(), iteration, transcript, partialResults);
    }

    public boolean isPaused() {
        return task.getStatus() == TaskStatus.PAUSED;
    }

    public CancellationToken token() {
        return token;
    }
}
