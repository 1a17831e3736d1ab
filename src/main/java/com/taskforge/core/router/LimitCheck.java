package com.taskforge.core.router;

public record LimitCheck(boolean allowed, String reason) {

    public static LimitCheck allow() {
        return new LimitCheck(true, null);
    }

    public static LimitCheck deny(String reason) {
        return new LimitCheck(false, reason);
    }
}
