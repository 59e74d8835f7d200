package org.lite.notify.exception;

/**
 * Exception thrown when a channel type is not one of the supported channels
 */
public class UnsupportedChannelException extends NotifySchedulerException {

    public UnsupportedChannelException(String channelType) {
        super(String.format("Unsupported notification channel: %s", channelType));
    }
}
