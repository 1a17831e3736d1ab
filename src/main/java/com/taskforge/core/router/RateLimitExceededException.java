package com.taskforge.core.router;

public class RateLimitExceededException extends RuntimeException {

    public RateLimitExceededException(String reason) {
        super("Rate limit exceeded: " + reason);
    }
}
