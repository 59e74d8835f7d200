package org.lite.notify.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lite.notify.enums.ChannelType;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChannelInfo {
    private String value;
    private String label;
    private List<String> configFields;

    public static ChannelInfo of(ChannelType type) {
        return new ChannelInfo(type.getValue(), type.getLabel(), type.getRequiredFields());
    }
}
