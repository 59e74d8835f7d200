package org.lite.notify.service;

import org.lite.notify.entity.ExecutionLog;
import org.lite.notify.entity.HookExecutionLog;
import org.lite.notify.entity.NotificationTask;
import org.lite.notify.enums.ExecutionLogStatus;
import org.lite.notify.enums.HookType;
import org.lite.notify.model.HookConfig;
import org.lite.notify.model.HookResult;

import java.time.Instant;
import java.util.List;

/**
 * Append-only record of firings and hook runs, with the time-windowed counts
 * the duplicate guard and alert rules need.
 */
public interface ExecutionLogService {

    /**
     * True when a started or successful firing of the task began within the
     * duplicate window before {@code now}.
     */
    boolean hasRecentExecution(String taskId, Instant now);

    ExecutionLog recordDuplicateSkip(NotificationTask task, Instant now, String workerId, String hostId);

    /**
     * Persists a {@code STARTED} entry before anything is dispatched.
     */
    ExecutionLog start(NotificationTask task, Instant now, String workerId, String hostId);

    ExecutionLog finish(ExecutionLog executionLog);

    HookExecutionLog recordHookExecution(String taskId, String executionLogId, HookType hookType, HookConfig config,
                                         Instant startTime, Instant endTime, HookResult result);

    long countDuplicates(String taskId, Instant since);

    long countByStatus(String taskId, ExecutionLogStatus status, Instant since);

    /**
     * Entries that reached a terminal outcome (success or failed).
     */
    long countCompleted(String taskId, Instant since);

    long countLongerThan(String taskId, long durationMs, Instant since);

    List<ExecutionLog> findRecent(String taskId, int limit);

    List<HookExecutionLog> findHookLogs(String executionLogId);
}
