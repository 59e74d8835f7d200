package org.lite.notify.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionEvent {

    public static final String TASK_EXECUTED = "task_executed";
    public static final String TASK_SKIPPED = "task_skipped";

    private String type;
    private String taskId;
    private String title;
    private String status;      // sent | failed | skipped
    private String message;
    private Instant timestamp;
}
