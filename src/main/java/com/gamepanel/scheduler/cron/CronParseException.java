package com.gamepanel.scheduler.cron;

/**
 * Raised when a cron expression cannot be interpreted. Schedule writes must be rejected on this error.
 */
public class CronParseException extends IllegalArgumentException {

    private final String expression;

    public CronParseException(String expression, String message) {
        super("Invalid cron expression '" + expression + "': " + message);
        this.expression = expression;
    }

    public CronParseException(String expression, String message, Throwable cause) {
        super("Invalid cron expression '" + expression + "': " + message, cause);
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }
}
