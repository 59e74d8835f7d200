package org.lite.notify.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lite.notify.enums.HookStatus;
import org.lite.notify.enums.HookType;
import org.lite.notify.enums.ScriptType;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;
import java.util.Map;

@Document(collection = "hook_execution_logs")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HookExecutionLog {
    @Id
    private String id;

    private String taskId;
    @Indexed
    private String executionLogId;

    private HookType hookType;
    private ScriptType scriptType;
    private String scriptContent;           // Snapshot, truncated

    private Instant startTime;
    private Instant endTime;
    private Long durationMs;

    private HookStatus status;
    private String output;                  // Truncated stdout
    private String errorMessage;

    @Field("return_data")
    private Map<String, Object> returnData;
}
