package com.taskforge.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for creating (all fields required) or updating (null fields
 * unchanged) a scheduled job.
 */
public record JobRequest(
    String name,
    @JsonProperty("cron_expression") String cronExpression,
    String instruction
) {}
