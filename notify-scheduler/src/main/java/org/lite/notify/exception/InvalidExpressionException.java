package org.lite.notify.exception;

/**
 * Exception thrown when a cron expression cannot be parsed or has no future fire time
 */
public class InvalidExpressionException extends NotifySchedulerException {

    private final String expression;

    public InvalidExpressionException(String expression, String reason) {
        super(String.format("Invalid cron expression '%s': %s", expression, reason));
        this.expression = expression;
    }

    public InvalidExpressionException(String expression, String reason, Throwable cause) {
        super(String.format("Invalid cron expression '%s': %s", expression, reason), cause);
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }
}
