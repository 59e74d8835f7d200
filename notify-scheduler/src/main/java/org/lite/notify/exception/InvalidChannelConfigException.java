package org.lite.notify.exception;

/**
 * Exception thrown when a channel config lacks a key the channel requires
 */
public class InvalidChannelConfigException extends NotifySchedulerException {

    private final String field;

    public InvalidChannelConfigException(String channel, String field) {
        super(String.format("Channel '%s' config is missing required field '%s'", channel, field));
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
