package org.lite.notify.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Where a task is delivered: either one channel or a named list of channels.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "mode")
@JsonSubTypes({
        @JsonSubTypes.Type(value = SingleChannelDelivery.class, name = "single"),
        @JsonSubTypes.Type(value = MultiChannelDelivery.class, name = "multi")
})
public sealed interface Delivery permits SingleChannelDelivery, MultiChannelDelivery {

    /**
     * Channels this delivery targets, in dispatch order.
     */
    List<ChannelTarget> targets();
}
