package com.taskforge.core.llm;

/**
 * Thrown when the model answers with no content at all.
 */
public class LlmEmptyResponseException extends ModelBackendException {

    public LlmEmptyResponseException(String message) {
        super(message);
    }
}
