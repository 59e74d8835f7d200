package org.lite.notify.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.lite.notify.exception.UnsupportedChannelException;

import java.util.List;

/**
 * Closed set of delivery channels. Each constant carries the config keys the
 * dispatcher requires before it will make the outbound call.
 */
public enum ChannelType {
    WEBHOOK("webhook", "Generic Webhook", List.of("webhook_url")),
    WECOM_WEBHOOK("wecom_webhook", "WeCom Webhook", List.of("webhook_url")),
    FEISHU_WEBHOOK("feishu_webhook", "Feishu Webhook", List.of("webhook_url")),
    DINGTALK_WEBHOOK("dingtalk_webhook", "DingTalk Webhook", List.of("webhook_url")),
    PUSHPLUS("pushplus", "PushPlus", List.of("token")),
    SERVERCHAN("serverchan", "ServerChan", List.of("token")),
    SLACK_WEBHOOK("slack_webhook", "Slack Webhook", List.of("webhook_url"));

    private final String value;
    private final String label;
    private final List<String> requiredFields;

    ChannelType(String value, String label, List<String> requiredFields) {
        this.value = value;
        this.label = label;
        this.requiredFields = requiredFields;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getLabel() {
        return label;
    }

    public List<String> getRequiredFields() {
        return requiredFields;
    }

    @JsonCreator
    public static ChannelType fromValue(String value) {
        if (value != null) {
            for (ChannelType type : values()) {
                if (type.value.equalsIgnoreCase(value.trim()) || type.name().equalsIgnoreCase(value.trim())) {
                    return type;
                }
            }
        }
        throw new UnsupportedChannelException(value);
    }
}
