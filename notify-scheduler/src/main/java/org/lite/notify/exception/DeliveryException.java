package org.lite.notify.exception;

/**
 * Exception thrown when a provider rejects a message or cannot be reached
 */
public class DeliveryException extends NotifySchedulerException {

    public DeliveryException(String message) {
        super(message);
    }

    public DeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
