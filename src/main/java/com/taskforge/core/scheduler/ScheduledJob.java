package com.taskforge.core.scheduler;

import com.fasterxml.jackson.annotation.JsonAutoDetect;

import java.time.Instant;

/**
 * A recurring instruction run as a spawned session whenever its cron expression matches.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class ScheduledJob {

    private String id;
    private String name;
    private String cronExpression;
    private String instruction;
    private boolean enabled;
    private Instant createdAt;
    private Instant lastRunAt;
    private Instant nextRunAt;
    private int runCount;
    private String lastRunId;
    private String lastRunStatus;

    private ScheduledJob() {
    }

    ScheduledJob(String id, String name, String cronExpression, String instruction, Instant createdAt) {
        this.id = id;
        this.name = name;
        this.cronExpression = cronExpression;
        this.instruction = instruction;
        this.enabled = true;
        this.createdAt = createdAt;
    }

    synchronized void update(String newName, String newCron, String newInstruction) {
        if (newName != null) {
            name = newName;
        }
        if (newCron != null) {
            cronExpression = newCron;
        }
        if (newInstruction != null) {
            instruction = newInstruction;
        }
    }

    synchronized void setEnabled(boolean value) {
        enabled = value;
    }

    synchronized void setNextRunAt(Instant value) {
        nextRunAt = value;
    }

    synchronized void recordRun(String runId, Instant at, Instant next) {
        lastRunAt = at;
        lastRunId = runId;
        runCount++;
        nextRunAt = next;
        lastRunStatus = null;
    }

    synchronized void recordRunStatus(String runId, String status) {
        if (runId.equals(lastRunId)) {
            lastRunStatus = status;
        }
    }

    public String getId() {
        return id;
    }

    public synchronized String getName() {
        return name;
    }

    public synchronized String getCronExpression() {
        return cronExpression;
    }

    public synchronized String getInstruction() {
        return instruction;
    }

    public synchronized boolean isEnabled() {
        return enabled;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public synchronized Instant getLastRunAt() {
        return lastRunAt;
    }

    public synchronized Instant getNextRunAt() {
        return nextRunAt;
    }

    public synchronized int getRunCount() {
        return runCount;
    }

    public synchronized String getLastRunId() {
        return lastRunId;
    }

    public synchronized String getLastRunStatus() {
        return lastRunStatus;
    }
}
