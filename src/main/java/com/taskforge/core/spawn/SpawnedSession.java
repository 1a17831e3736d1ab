package com.taskforge.core.spawn;

import com.fasterxml.jackson.annotation.JsonAutoDetect;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * A sub-agent session started by the {@link SessionSpawner}. Guarded by its own monitor.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class SpawnedSession {

    private String runId;
    private String name;
    private String instruction;
    private SessionStatus status;
    private int progress;
    private String currentStep;
    private String result;
    private String error;
    private String signature;
    private List<String> toolsUsed = List.of();
    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;
    private int maxIterations;
    private long timeoutMs;

    private SpawnedSession() {
    }

    SpawnedSession(String runId, String name, String instruction, int maxIterations, long timeoutMs, Instant now) {
        this.runId = runId;
        this.name = name;
        this.instruction = instruction;
        this.status = SessionStatus.PENDING;
        this.currentStep = "Initializing";
        this.maxIterations = maxIterations;
        this.timeoutMs = timeoutMs;
        this.createdAt = now;
    }

    synchronized boolean start(Instant now) {
        if (!status.canTransitionTo(SessionStatus.RUNNING)) {
            return false;
        }
        status = SessionStatus.RUNNING;
        startedAt = now;
        currentStep = "Starting";
        return true;
    }

    synchronized boolean complete(SessionOutcome outcome, Instant now) {
        if (status != SessionStatus.RUNNING) {
            return false;
        }
        status = SessionStatus.COMPLETED;
        progress = 100;
        currentStep = "Done";
        result = outcome.result();
        signature = outcome.signature();
        toolsUsed = outcome.toolsUsed();
        completedAt = now;
        return true;
    }

    synchronized boolean fail(String message, Instant now) {
        if (!status.canTransitionTo(SessionStatus.FAILED)) {
            return false;
        }
        status = SessionStatus.FAILED;
        error = message;
        currentStep = "Failed: " + message;
        completedAt = now;
        return true;
    }

    /**
     * Fails only a session that is still running, so a late executor error never
     * overwrites a cancellation or a timeout.
     */
    synchronized boolean failIfRunning(String message, Instant now) {
        return status == SessionStatus.RUNNING && fail(message, now);
    }

    synchronized boolean cancel(Instant now) {
        if (status != SessionStatus.RUNNING) {
            return false;
        }
        status = SessionStatus.CANCELLED;
        currentStep = "Cancelled";
        completedAt = now;
        return true;
    }

    synchronized boolean updateProgress(int percent, String step) {
        if (status != SessionStatus.RUNNING) {
            return false;
        }
        progress = Math.max(0, Math.min(percent, 99));
        currentStep = step;
        return true;
    }

    public synchronized Duration elapsed(Instant now) {
        Instant from = startedAt != null ? startedAt : createdAt;
        Instant to = completedAt != null ? completedAt : now;
        return Duration.between(from, to);
    }

    public String getRunId() {
        return runId;
    }

    public String getName() {
        return name;
    }

    public String getInstruction() {
        return instruction;
    }

    public synchronized SessionStatus getStatus() {
        return status;
    }

    public synchronized int getProgress() {
        return progress;
    }

    public synchronized String getCurrentStep() {
        return currentStep;
    }

    public synchronized String getResult() {
        return result;
    }

    public synchronized String getError() {
        return error;
    }

    public synchronized String getSignature() {
        return signature;
    }

    public synchronized List<String> getToolsUsed() {
        return toolsUsed;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public synchronized Instant getStartedAt() {
        return startedAt;
    }

    public synchronized Instant getCompletedAt() {
        return completedAt;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
