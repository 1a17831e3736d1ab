package com.taskforge.core.recovery;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
