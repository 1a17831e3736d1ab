package com.taskforge.core.recovery;

import java.util.Locale;

public enum ErrorKind {
    NETWORK_ERROR,
    RATE_LIMIT_ERROR,
    AUTHENTICATION_ERROR,
    API_ERROR,
    TOOL_ERROR,
    VALIDATION_ERROR,
    TIMEOUT_ERROR,
    UNKNOWN_ERROR;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
