package com.taskforge.core.recovery;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "taskforge.recovery")
public class RecoveryProperties {

    private int maxRetries = 3;
    private long initialDelayMs = 1000;
    private long maxDelayMs = 10000;
    private double backoffMultiplier = 2.0;
    private int simpleRetryAttempts = 2;

    /** Fallback capability to try when a capability fails with a tool error. */
    private Map<String, String> alternatives = new LinkedHashMap<>();

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public long getInitialDelayMs() {
        return initialDelayMs;
    }

    public void setInitialDelayMs(long initialDelayMs) {
        this.initialDelayMs = initialDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public void setMaxDelayMs(long maxDelayMs) {
        this.maxDelayMs = maxDelayMs;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public void setBackoffMultiplier(double backoffMultiplier) {
        this.backoffMultiplier = backoffMultiplier;
    }

    public int getSimpleRetryAttempts() {
        return simpleRetryAttempts;
    }

    public void setSimpleRetryAttempts(int simpleRetryAttempts) {
        this.simpleRetryAttempts = simpleRetryAttempts;
    }

    public Map<String, String> getAlternatives() {
        return alternatives;
    }

    public void setAlternatives(Map<String, String> alternatives) {
        this.alternatives = alternatives;
    }

    public RetryPolicy toRetryPolicy() {
        return new RetryPolicy(maxRetries, initialDelayMs, maxDelayMs, backoffMultiplier);
    }
}
