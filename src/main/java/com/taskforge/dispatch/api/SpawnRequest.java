package com.taskforge.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/sessions.
 *
 * @param timeoutMs     nullable, defaults to the configured session timeout
 * @param maxIterations nullable, defaults to the configured iteration budget
 */
public record SpawnRequest(
    String name,
    String instruction,
    @JsonProperty("timeout_ms") Long timeoutMs,
    @JsonProperty("max_iterations") Integer maxIterations
) {}
