package com.taskforge.core.router;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "taskforge.router")
public class RouterProperties {

    private List<String> allowedPathPrefixes = new ArrayList<>(List.of("/mnt/user-data/", "/mnt/skills/", "/tmp/"));
    private List<String> pathFields = new ArrayList<>(List.of("path", "file_path", "filename", "file", "file_name"));
    private int cacheMaxEntries = 200;
    private long callTimeoutMs = 35_000;
    private long sessionCallTimeoutMs = 300_000;
    private History history = new History();
    private Quota quota = new Quota();

    public List<String> getAllowedPathPrefixes() {
        return allowedPathPrefixes;
    }

    public void setAllowedPathPrefixes(List<String> allowedPathPrefixes) {
        this.allowedPathPrefixes = allowedPathPrefixes;
    }

    public List<String> getPathFields() {
        return pathFields;
    }

    public void setPathFields(List<String> pathFields) {
        this.pathFields = pathFields;
    }

    public int getCacheMaxEntries() {
        return cacheMaxEntries;
    }

    public void setCacheMaxEntries(int cacheMaxEntries) {
        this.cacheMaxEntries = cacheMaxEntries;
    }

    /** Per-call limit for ordinary capabilities. Zero or less waits indefinitely. */
    public long getCallTimeoutMs() {
        return callTimeoutMs;
    }

    public void setCallTimeoutMs(long callTimeoutMs) {
        this.callTimeoutMs = callTimeoutMs;
    }

    /** Per-call limit for {@code session_*} capabilities, which wait on a whole child run. */
    public long getSessionCallTimeoutMs() {
        return sessionCallTimeoutMs;
    }

    public void setSessionCallTimeoutMs(long sessionCallTimeoutMs) {
        this.sessionCallTimeoutMs = sessionCallTimeoutMs;
    }

    long callTimeoutFor(String capability) {
        return capability.startsWith("session_") ? sessionCallTimeoutMs : callTimeoutMs;
    }

    public History getHistory() {
        return history;
    }

    public void setHistory(History history) {
        this.history = history;
    }

    public Quota getQuota() {
        return quota;
    }

    public void setQuota(Quota quota) {
        this.quota = quota;
    }

    /**
     * Per-capability call history used for loop detection.
     */
    public static class History {
        private int callsPerCapability = 5;
        private long windowMs = 10_000;
        private int maxCapabilities = 200;
        private long backoffBaseMs = 2000;
        private long backoffMaxMs = 8000;
        private int loopThreshold = 3;

        public int getCallsPerCapability() {
            return callsPerCapability;
        }

        public void setCallsPerCapability(int callsPerCapability) {
            this.callsPerCapability = callsPerCapability;
        }

        public long getWindowMs() {
            return windowMs;
        }

        public void setWindowMs(long windowMs) {
            this.windowMs = windowMs;
        }

        public int getMaxCapabilities() {
            return maxCapabilities;
        }

        public void setMaxCapabilities(int maxCapabilities) {
            this.maxCapabilities = maxCapabilities;
        }

        public long getBackoffBaseMs() {
            return backoffBaseMs;
        }

        public void setBackoffBaseMs(long backoffBaseMs) {
            this.backoffBaseMs = backoffBaseMs;
        }

        public long getBackoffMaxMs() {
            return backoffMaxMs;
        }

        public void setBackoffMaxMs(long backoffMaxMs) {
            this.backoffMaxMs = backoffMaxMs;
        }

        public int getLoopThreshold() {
            return loopThreshold;
        }

        public void setLoopThreshold(int loopThreshold) {
            this.loopThreshold = loopThreshold;
        }
    }

    /**
     * Sliding-window quota enforced before each invocation. Zero disables a limit.
     */
    public static class Quota {
        private boolean enabled = false;
        private int maxCalls = 0;
        private long maxTokens = 0;
        private long windowMs = 60_000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getMaxCalls() {
            return maxCalls;
        }

        public void setMaxCalls(int maxCalls) {
            this.maxCalls = maxCalls;
        }

        public long getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(long maxTokens) {
            this.maxTokens = maxTokens;
        }

        public long getWindowMs() {
            return windowMs;
        }

        public void setWindowMs(long windowMs) {
            this.windowMs = windowMs;
        }
    }
}
