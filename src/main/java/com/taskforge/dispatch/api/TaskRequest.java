package com.taskforge.dispatch.api;

import com.taskforge.core.model.TranscriptEntry;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/tasks.
 *
 * @param instruction natural-language instruction
 * @param history     prior conversation; nullable
 * @param attachments attachment names to mention; nullable
 */
public record TaskRequest(
    String instruction,
    List<TranscriptEntry> history,
    List<String> attachments
) {}
