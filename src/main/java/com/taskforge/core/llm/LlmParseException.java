package com.taskforge.core.llm;

/**
 * Thrown when model output cannot be mapped onto the requested type.
 */
public class LlmParseException extends ModelBackendException {

    public LlmParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
