package com.taskforge.core.queue;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.taskforge.core.model.TranscriptEntry;

import java.time.Instant;
import java.util.List;

/**
 * A long-running instruction tracked by the {@link TaskQueue}.
 * <p>
 * All state changes go through the task's own monitor, so a status check and the
 * following update are atomic and a task reaches exactly one terminal status.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class BackgroundTask {

    private String id;
    private String instruction;
    private List<TranscriptEntry> history;
    private List<String> attachments;
    private TaskStatus status;
    private int progress;
    private String currentStep;
    private Checkpoint checkpoint;
    private TaskResult result;
    private String error;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant completedAt;
    private int maxIterations;
    private int iterationCount;

    private BackgroundTask() {
    }

    BackgroundTask(String id, String instruction, List<TranscriptEntry> history, List<String> attachments,
                   int maxIterations, Instant now) {
        this.id = id;
        this.instruction = instruction;
        this.history = history == null ? List.of() : List.copyOf(history);
        this.attachments = attachments == null ? List.of() : List.copyOf(attachments);
        this.status = TaskStatus.QUEUED;
        this.currentStep = "Queued";
        this.maxIterations = maxIterations;
        this.createdAt = now;
        this.updatedAt = now;
    }

    synchronized boolean transitionTo(TaskStatus next, String step, Instant now) {
        if (!status.canTransitionTo(next)) {
            return false;
        }
        status = next;
        currentStep = step;
        updatedAt = now;
        if (next.isTerminal()) {
            completedAt = now;
        }
        return true;
    }

    synchronized boolean complete(TaskResult taskResult, Instant now) {
        if (!transitionTo(TaskStatus.COMPLETED, "Completed", now)) {
            return false;
        }
        progress = 100;
        result = taskResult;
        return true;
    }

    synchronized boolean fail(String message, Instant now) {
        if (!transitionTo(TaskStatus.FAILED, "Error: " + message, now)) {
            return false;
        }
        error = message;
        return true;
    }

    /**
     * @return false once the task is terminal; late reports are dropped
     */
    synchronized boolean updateProgress(int percent, String step, Instant now) {
        if (status.isTerminal()) {
            return false;
        }
        progress = Math.min(100, Math.max(0, percent));
        currentStep = step;
        updatedAt = now;
        return true;
    }

    synchronized int nextIteration() {
        return ++iterationCount;
    }

    synchronized boolean acceptCheckpoint(Checkpoint next, Instant now) {
        if (status.isTerminal()) {
            return false;
        }
        if (checkpoint != null && next.iteration() <= checkpoint.iteration()) {
            return false;
        }
        checkpoint = next;
        updatedAt = now;
        return true;
    }

    public String getId() {
        return id;
    }

    public String getInstruction() {
        return instruction;
    }

    public List<TranscriptEntry> getHistory() {
        return history;
    }

    public List<String> getAttachments() {
        return attachments;
    }

    public synchronized TaskStatus getStatus() {
        return status;
    }

    public synchronized int getProgress() {
        return progress;
    }

    public synchronized String getCurrentStep() {
        return currentStep;
    }

    public synchronized Checkpoint getCheckpoint() {
        return checkpoint;
    }

    public synchronized TaskResult getResult() {
        return result;
    }

    public synchronized String getError() {
        return error;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public synchronized Instant getUpdatedAt() {
        return updatedAt;
    }

    public synchronized Instant getCompletedAt() {
        return completedAt;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public synchronized int getIterationCount() {
        return iterationCount;
    }
}
