package com.taskforge.core.queue;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "taskforge.queue")
public class TaskQueueProperties {

    private int maxConcurrent = 2;
    private int defaultMaxIterations = 25;
    private int checkpointInterval = 3;
    private long taskTimeoutMs = 30 * 60 * 1000L;
    private long retentionMs = 24 * 60 * 60 * 1000L;

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    public void setMaxConcurrent(int maxConcurrent) {
        this.maxConcurrent = maxConcurrent;
    }

    public int getDefaultMaxIterations() {
        return defaultMaxIterations;
    }

    public void setDefaultMaxIterations(int defaultMaxIterations) {
        this.defaultMaxIterations = defaultMaxIterations;
    }

    public int getCheckpointInterval() {
        return checkpointInterval;
    }

    public void setCheckpointInterval(int checkpointInterval) {
        this.checkpointInterval = checkpointInterval;
    }

    public long getTaskTimeoutMs() {
        return taskTimeoutMs;
    }

    public void setTaskTimeoutMs(long taskTimeoutMs) {
        this.taskTimeoutMs = taskTimeoutMs;
    }

    public long getRetentionMs() {
        return retentionMs;
    }

    public void setRetentionMs(long retentionMs) {
        this.retentionMs = retentionMs;
    }
}
