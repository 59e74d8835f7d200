package org.lite.notify.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lite.notify.enums.HookType;
import org.lite.notify.enums.TaskStatus;
import org.lite.notify.model.ChannelSendResult;
import org.lite.notify.model.ChannelTarget;
import org.lite.notify.model.Delivery;
import org.lite.notify.model.HookConfig;
import org.lite.notify.model.MultiChannelDelivery;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Document(collection = "notify_tasks")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class NotificationTask {
    @Id
    private String id;

    @Indexed
    private String userId;                  // Owner of the task and of its logs

    private String title;
    private String content;

    private Delivery delivery;              // Single channel or named channel list

    // Timing
    private Instant scheduledTime;          // Next (or only) firing
    private boolean recurring;
    private String cronExpression;          // Present iff recurring

    @Indexed
    @Builder.Default
    private TaskStatus status = TaskStatus.PENDING;

    // Result bookkeeping
    private Instant sentTime;
    private String errorMsg;

    @Field("send_results")
    private Map<String, ChannelSendResult> sendResults;     // Multi-channel mode only

    @Field("hooks_config")
    private Map<HookType, HookConfig> hooksConfig;

    @CreatedDate
    private Instant createdAt;

    @LastModifiedDate
    private Instant updatedAt;

    // Bumped on every save; a save carrying a stale value is rejected
    @Version
    private Long version;

    public boolean isMultiChannel() {
        return delivery instanceof MultiChannelDelivery;
    }

    public String jobId() {
        return jobIdFor(id, recurring);
    }

    public static String jobIdFor(String taskId, boolean recurring) {
        return recurring ? "recurring_task_" + taskId : "task_" + taskId;
    }

    /**
     * Plain-map view handed to hook scripts.
     */
    public Map<String, Object> toSnapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("id", id);
        snapshot.put("user_id", userId);
        snapshot.put("title", title);
        snapshot.put("content", content);
        snapshot.put("channels", delivery == null ? null
                : delivery.targets().stream().map(ChannelTarget::key).toList());
        snapshot.put("multi_channel", isMultiChannel());
        snapshot.put("scheduled_time", scheduledTime == null ? null : scheduledTime.toString());
        snapshot.put("status", status == null ? null : status.name().toLowerCase());
        snapshot.put("sent_time", sentTime == null ? null : sentTime.toString());
        snapshot.put("error_msg", errorMsg);
        snapshot.put("is_recurring", recurring);
        snapshot.put("cron_expression", cronExpression);
        return snapshot;
    }
}
