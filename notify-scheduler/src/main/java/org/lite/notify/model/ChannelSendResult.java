package org.lite.notify.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChannelSendResult {

    public static final String SENT = "sent";
    public static final String FAILED = "failed";

    private String channel;     // channel type value
    private String status;      // sent | failed
    private String error;
    private Instant sentAt;

    public boolean isSent() {
        return SENT.equals(status);
    }

    public static ChannelSendResult sent(String channel, Instant at) {
        return new ChannelSendResult(channel, SENT, null, at);
    }

    public static ChannelSendResult failed(String channel, String error) {
        return new ChannelSendResult(channel, FAILED, error, null);
    }
}
