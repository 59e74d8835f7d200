package org.lite.notify.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lite.notify.enums.ExecutionLogStatus;
import org.lite.notify.model.ChannelSendResult;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;

@Document(collection = "task_execution_logs")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@CompoundIndexes({
    // Duplicate-window and alert-window lookups
    @CompoundIndex(name = "task_start_idx", def = "{'taskId': 1, 'startTime': -1}"),
    @CompoundIndex(name = "task_status_start_idx", def = "{'taskId': 1, 'status': 1, 'startTime': -1}")
})
public class ExecutionLog {
    @Id
    private String id;

    private String taskId;
    private String userId;
    private String jobId;                   // task_{id} or recurring_task_{id}

    // Timeline
    private Instant startTime;
    private Instant endTime;
    private Long durationMs;

    @Builder.Default
    private ExecutionLogStatus status = ExecutionLogStatus.STARTED;

    @Field("send_results")
    private Map<String, ChannelSendResult> sendResults;
    private int successCount;
    private int failureCount;

    // Who ran it
    private String workerId;
    private String hostId;

    private boolean duplicate;
    @Indexed
    private String duplicateCheckKey;       // {taskId}_{epochSecond(startTime)}

    private String errorMessage;
    private String errorStack;

    public static String duplicateCheckKey(String taskId, Instant startTime) {
        return taskId + "_" + startTime.truncatedTo(ChronoUnit.SECONDS).getEpochSecond();
    }
}
