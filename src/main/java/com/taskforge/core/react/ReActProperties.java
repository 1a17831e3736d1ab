package com.taskforge.core.react;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "taskforge.react")
public class ReActProperties {

    private int maxContinuationAttempts = 3;
    private int maxToolTurns = 8;
    private int maxContextMessages = 20;
    private int recentKeep = 5;
    private int observationMaxChars = 4000;
    private String systemPrompt = """
            You are a task-execution agent. Work step by step. On each turn answer with JSON:
            a short "thought", the "calls" to make next (capability name and args), and an
            "answer" once no more calls are needed. Only use the listed capabilities.
            """;

    public int getMaxContinuationAttempts() {
        return maxContinuationAttempts;
    }

    public void setMaxContinuationAttempts(int maxContinuationAttempts) {
        this.maxContinuationAttempts = maxContinuationAttempts;
    }

    public int getMaxToolTurns() {
        return maxToolTurns;
    }

    public void setMaxToolTurns(int maxToolTurns) {
        this.maxToolTurns = maxToolTurns;
    }

    public int getMaxContextMessages() {
        return maxContextMessages;
    }

    public void setMaxContextMessages(int maxContextMessages) {
        this.maxContextMessages = maxContextMessages;
    }

    public int getRecentKeep() {
        return recentKeep;
    }

    public void setRecentKeep(int recentKeep) {
        this.recentKeep = recentKeep;
    }

    public int getObservationMaxChars() {
        return observationMaxChars;
    }

    public void setObservationMaxChars(int observationMaxChars) {
        this.observationMaxChars = observationMaxChars;
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }

    public void setSystemPrompt(String systemPrompt) {
        this.systemPrompt = systemPrompt;
    }
}
