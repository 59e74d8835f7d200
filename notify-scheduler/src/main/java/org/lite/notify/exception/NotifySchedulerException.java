package org.lite.notify.exception;

/**
 * Base type for errors raised by the scheduling engine.
 */
public class NotifySchedulerException extends RuntimeException {

    public NotifySchedulerException(String message) {
        super(message);
    }

    public NotifySchedulerException(String message, Throwable cause) {
        super(message, cause);
    }
}
