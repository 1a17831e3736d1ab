package com.taskforge.core.scheduler;

public class InvalidCronExpressionException extends RuntimeException {

    private final String expression;

    public InvalidCronExpressionException(String expression, String detail) {
        super("Invalid cron expression: \"" + expression + "\" (" + detail + ")");
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }
}
