package org.lite.notify.service;

import org.lite.notify.enums.ChannelType;
import org.lite.notify.exception.DeliveryException;
import org.lite.notify.exception.InvalidChannelConfigException;

import java.util.Map;

public interface ChannelDispatchService {

    /**
     * Render placeholders in title and body and deliver them with exactly one outbound call.
     * @throws InvalidChannelConfigException if a required config key is missing
     * @throws DeliveryException if the provider rejects the message or cannot be reached
     */
    void send(ChannelType channelType, Map<String, Object> config, String title, String body);
}
