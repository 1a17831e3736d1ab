package com.taskforge.core.audit;

public class AuditLogParseException extends RuntimeException {

    public AuditLogParseException(String message) {
        super(message);
    }

    public AuditLogParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
