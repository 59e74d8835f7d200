package org.lite.notify.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lite.notify.enums.AlertType;
import org.lite.notify.enums.ChannelType;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

@Document(collection = "alert_rules")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@CompoundIndex(name = "user_type_enabled_idx", def = "{'userId': 1, 'ruleType': 1, 'enabled': 1}")
public class AlertRule {

    public static final String TIME_WINDOW_MINUTES = "time_window_minutes";
    public static final String THRESHOLD = "threshold";
    public static final String MAX_DURATION_SECONDS = "max_duration_seconds";
    public static final String MIN_EXECUTIONS = "min_executions";
    public static final String FAILURE_RATE_PERCENT = "failure_rate_percent";
    public static final String COOLDOWN_MINUTES = "cooldown_minutes";

    @Id
    private String id;

    private String userId;
    private String taskId;                  // null applies the rule to every task of the user
    private String name;

    private AlertType ruleType;
    private Map<String, Object> parameters;

    // Where the alert goes
    private ChannelType alertChannel;
    private Map<String, Object> alertChannelConfig;

    @Builder.Default
    private boolean enabled = true;
    private Instant lastTriggeredAt;

    public boolean appliesTo(String candidateTaskId) {
        return taskId == null || taskId.equals(candidateTaskId);
    }

    public long longParameter(String key, long defaultValue) {
        if (parameters == null) {
            return defaultValue;
        }
        Object value = parameters.get(key);
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Long.parseLong(text.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }
}
