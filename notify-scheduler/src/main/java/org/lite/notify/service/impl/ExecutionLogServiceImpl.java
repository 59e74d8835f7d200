package org.lite.notify.service.impl;

import lombok.RequiredArgsConstructor;
import org.lite.notify.config.SchedulerProperties;
import org.lite.notify.entity.ExecutionLog;
import org.lite.notify.entity.HookExecutionLog;
import org.lite.notify.entity.NotificationTask;
import org.lite.notify.enums.ExecutionLogStatus;
import org.lite.notify.enums.HookStatus;
import org.lite.notify.enums.HookType;
import org.lite.notify.model.HookConfig;
import org.lite.notify.model.HookResult;
import org.lite.notify.repository.ExecutionLogRepository;
import org.lite.notify.repository.HookExecutionLogRepository;
import org.lite.notify.service.ExecutionLogService;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Service
@RequiredArgsConstructor
public class ExecutionLogServiceImpl implements ExecutionLogService {

    // Statuses that count as "already ran" inside the duplicate window
    static final Set<ExecutionLogStatus> IN_FLIGHT_OR_DONE = EnumSet.of(ExecutionLogStatus.STARTED, ExecutionLogStatus.SUCCESS);
    static final Set<ExecutionLogStatus> COMPLETED = EnumSet.of(ExecutionLogStatus.SUCCESS, ExecutionLogStatus.FAILED);

    private final ExecutionLogRepository executionLogRepository;
    private final HookExecutionLogRepository hookExecutionLogRepository;
    private final SchedulerProperties properties;

    @Override
    public boolean hasRecentExecution(String taskId, Instant now) {
        Instant since = now.minus(properties.getDuplicateWindow());
        Boolean found = executionLogRepository.findByTaskIdAndStatusInAndStartTimeAfter(taskId, IN_FLIGHT_OR_DONE, since)
                .hasElements()
                .block();
        return Boolean.TRUE.equals(found);
    }

    @Override
    public ExecutionLog recordDuplicateSkip(NotificationTask task, Instant now, String workerId, String hostId) {
        ExecutionLog entry = ExecutionLog.builder()
                .taskId(task.getId())
                .userId(task.getUserId())
                .jobId(task.jobId())
                .startTime(now)
                .endTime(now)
                .durationMs(0L)
                .status(ExecutionLogStatus.SKIPPED)
                .duplicate(true)
                .duplicateCheckKey(ExecutionLog.duplicateCheckKey(task.getId(), now))
                .workerId(workerId)
                .hostId(hostId)
                .errorMessage("Duplicate execution within " + properties.getDuplicateWindow().toSeconds() + "s window")
                .build();
        return executionLogRepository.save(entry).block();
    }

    @Override
    public ExecutionLog start(NotificationTask task, Instant now, String workerId, String hostId) {
        ExecutionLog entry = ExecutionLog.builder()
                .taskId(task.getId())
                .userId(task.getUserId())
                .jobId(task.jobId())
                .startTime(now)
                .status(ExecutionLogStatus.STARTED)
                .duplicateCheckKey(ExecutionLog.duplicateCheckKey(task.getId(), now))
                .workerId(workerId)
                .hostId(hostId)
                .build();
        return executionLogRepository.save(entry).block();
    }

    @Override
    public ExecutionLog finish(ExecutionLog executionLog) {
        if (executionLog.getEndTime() != null && executionLog.getStartTime() != null) {
            executionLog.setDurationMs(Duration.between(executionLog.getStartTime(), executionLog.getEndTime()).toMillis());
        }
        return executionLogRepository.save(executionLog).block();
    }

    @Override
    public HookExecutionLog recordHookExecution(String taskId, String executionLogId, HookType hookType, HookConfig config,
                                                Instant startTime, Instant endTime, HookResult result) {
        SchedulerProperties.Hooks limits = properties.getHooks();
        HookExecutionLog entry = HookExecutionLog.builder()
                .taskId(taskId)
                .executionLogId(executionLogId)
                .hookType(hookType)
                .scriptType(config.getScriptType())
                .scriptContent(truncate(config.getScript(), limits.getMaxScriptSnapshotLength()))
                .startTime(startTime)
                .endTime(endTime)
                .durationMs(Duration.between(startTime, endTime).toMillis())
                .status(hookStatus(result))
                .output(truncate(result.getOutput(), limits.getMaxOutputLength()))
                .errorMessage(result.getError())
                .returnData(result.getData())
                .build();
        return hookExecutionLogRepository.save(entry).block();
    }

    @Override
    public long countDuplicates(String taskId, Instant since) {
        return orZero(executionLogRepository.countByTaskIdAndDuplicateTrueAndStartTimeAfter(taskId, since).block());
    }

    @Override
    public long countByStatus(String taskId, ExecutionLogStatus status, Instant since) {
        return orZero(executionLogRepository.countByTaskIdAndStatusAndStartTimeAfter(taskId, status, since).block());
    }

    @Override
    public long countCompleted(String taskId, Instant since) {
        return orZero(executionLogRepository.countByTaskIdAndStatusInAndStartTimeAfter(taskId, COMPLETED, since).block());
    }

    @Override
    public long countLongerThan(String taskId, long durationMs, Instant since) {
        return orZero(executionLogRepository.countByTaskIdAndDurationMsGreaterThanAndStartTimeAfter(taskId, durationMs, since).block());
    }

    @Override
    public List<ExecutionLog> findRecent(String taskId, int limit) {
        return executionLogRepository.findByTaskIdOrderByStartTimeDesc(taskId, PageRequest.of(0, Math.max(limit, 1)))
                .collectList()
                .block();
    }

    @Override
    public List<HookExecutionLog> findHookLogs(String executionLogId) {
        return hookExecutionLogRepository.findByExecutionLogIdOrderByStartTimeAsc(executionLogId)
                .collectList()
                .block();
    }

    static HookStatus hookStatus(HookResult result) {
        if (result.isTimedOut()) {
            return HookStatus.TIMEOUT;
        }
        return result.isSuccess() ? HookStatus.SUCCESS : HookStatus.FAILED;
    }

    static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }

    private static long orZero(Long count) {
        return Optional.ofNullable(count).orElse(0L);
    }
}
