package com.taskforge.core.model;

import java.io.Serializable;

/**
 * A single message in an agent run transcript.
 *
 * @param role       who produced the entry
 * @param content    message text (observations carry serialized capability results)
 * @param capability capability name for {@link Role#OBSERVATION} entries, null otherwise
 */
public record TranscriptEntry(
    Role role,
    String content,
    String capability
) implements Serializable {

    public TranscriptEntry {
        content = content == null ? "" : content;
    }

    public static TranscriptEntry user(String content) {
        return new TranscriptEntry(Role.USER, content, null);
    }

    public static TranscriptEntry assistant(String content) {
        return new TranscriptEntry(Role.ASSISTANT, content, null);
    }

    public static TranscriptEntry observation(String capability, String content) {
        return new TranscriptEntry(Role.OBSERVATION, content, capability);
    }

    public enum Role {
        USER,
        ASSISTANT,
        OBSERVATION
    }
}
