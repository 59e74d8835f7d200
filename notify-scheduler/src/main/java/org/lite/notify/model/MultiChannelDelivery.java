package org.lite.notify.model;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

public record MultiChannelDelivery(List<ChannelTarget> channels) implements Delivery {

    public MultiChannelDelivery {
        if (channels == null || channels.isEmpty()) {
            throw new IllegalArgumentException("Multi-channel delivery needs at least one channel");
        }
        Set<String> keys = new HashSet<>();
        for (ChannelTarget channel : channels) {
            if (!keys.add(channel.key())) {
                throw new IllegalArgumentException("Duplicate channel key in multi-channel delivery: " + channel.key());
            }
        }
        channels = List.copyOf(channels);
    }

    @Override
    public List<ChannelTarget> targets() {
        return channels;
    }
}
