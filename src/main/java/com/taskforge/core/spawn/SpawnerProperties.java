package com.taskforge.core.spawn;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "taskforge.spawner")
public class SpawnerProperties {

    private int maxConcurrent = 3;
    private long defaultTimeoutMs = 5 * 60 * 1000L;
    private int defaultMaxIterations = 15;
    private long awaitTimeoutMs = 5 * 60 * 1000L;
    private long retentionMs = 24 * 60 * 60 * 1000L;

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    public void setMaxConcurrent(int maxConcurrent) {
        this.maxConcurrent = maxConcurrent;
    }

    public long getDefaultTimeoutMs() {
        return defaultTimeoutMs;
    }

    public void setDefaultTimeoutMs(long defaultTimeoutMs) {
        this.defaultTimeoutMs = defaultTimeoutMs;
    }

    public int getDefaultMaxIterations() {
        return defaultMaxIterations;
    }

    public void setDefaultMaxIterations(int defaultMaxIterations) {
        this.defaultMaxIterations = defaultMaxIterations;
    }

    public long getAwaitTimeoutMs() {
        return awaitTimeoutMs;
    }

    public void setAwaitTimeoutMs(long awaitTimeoutMs) {
        this.awaitTimeoutMs = awaitTimeoutMs;
    }

    public long getRetentionMs() {
        return retentionMs;
    }

    public void setRetentionMs(long retentionMs) {
        this.retentionMs = retentionMs;
    }
}
