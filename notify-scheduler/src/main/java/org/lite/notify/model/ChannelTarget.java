package org.lite.notify.model;

import org.lite.notify.enums.ChannelType;

import java.util.Map;

/**
 * One configured channel. {@code name} distinguishes two channels of the same type
 * inside a multi-channel delivery and is optional otherwise.
 */
public record ChannelTarget(String name, ChannelType type, Map<String, Object> config) {

    public ChannelTarget {
        config = config == null ? Map.of() : Map.copyOf(config);
    }

    public String key() {
        return name != null && !name.isBlank() ? name : type.getValue();
    }
}
