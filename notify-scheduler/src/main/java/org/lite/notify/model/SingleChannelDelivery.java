package org.lite.notify.model;

import org.lite.notify.enums.ChannelType;

import java.util.List;
import java.util.Map;
import java.util.Objects;

public record SingleChannelDelivery(ChannelType type, Map<String, Object> config) implements Delivery {

    public SingleChannelDelivery {
        Objects.requireNonNull(type, "type");
        config = config == null ? Map.of() : Map.copyOf(config);
    }

    @Override
    public List<ChannelTarget> targets() {
        return List.of(new ChannelTarget(null, type, config));
    }
}
