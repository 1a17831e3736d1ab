package com.taskforge.core.intent;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "taskforge.intent")
public class IntentProperties {

    private long cacheTtlMs = 5 * 60 * 1000L;
    private int cacheMaxEntries = 500;
    private boolean modelEnabled = true;

    public long getCacheTtlMs() {
        return cacheTtlMs;
    }

    public void setCacheTtlMs(long cacheTtlMs) {
        this.cacheTtlMs = cacheTtlMs;
    }

    public int getCacheMaxEntries() {
        return cacheMaxEntries;
    }

    public void setCacheMaxEntries(int cacheMaxEntries) {
        this.cacheMaxEntries = cacheMaxEntries;
    }

    public boolean isModelEnabled() {
        return modelEnabled;
    }

    public void setModelEnabled(boolean modelEnabled) {
        this.modelEnabled = modelEnabled;
    }
}
