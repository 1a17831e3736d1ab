package com.taskforge.core.llm;

/**
 * Base type for failures raised by a {@link ModelBackend}.
 */
public class ModelBackendException extends RuntimeException {

    public ModelBackendException(String message) {
        super(message);
    }

    public ModelBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
