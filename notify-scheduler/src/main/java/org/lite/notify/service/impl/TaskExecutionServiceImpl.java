package org.lite.notify.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.lite.notify.entity.ExecutionLog;
import org.lite.notify.entity.NotificationTask;
import org.lite.notify.enums.AlertType;
import org.lite.notify.enums.ExecutionLogStatus;
import org.lite.notify.enums.HookType;
import org.lite.notify.enums.TaskStatus;
import org.lite.notify.exception.InvalidExpressionException;
import org.lite.notify.exception.NotifySchedulerException;
import org.lite.notify.model.ChannelSendResult;
import org.lite.notify.model.ChannelTarget;
import org.lite.notify.model.Delivery;
import org.lite.notify.model.ExecutionEvent;
import org.lite.notify.model.HookConfig;
import org.lite.notify.model.HookResult;
import org.lite.notify.scheduler.TaskLockManager;
import org.lite.notify.service.AlertEvaluationService;
import org.lite.notify.service.ChannelDispatchService;
import org.lite.notify.service.EventBroadcastService;
import org.lite.notify.service.ExecutionLogService;
import org.lite.notify.service.HookRunnerService;
import org.lite.notify.service.TaskExecutionService;
import org.lite.notify.service.TaskSchedulingService;
import org.lite.notify.service.TaskStoreService;
import org.lite.notify.service.TriggerCalculationService;
import org.springframework.stereotype.Service;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@Service
@Slf4j
public class TaskExecutionServiceImpl implements TaskExecutionService {

    private final TaskStoreService taskStoreService;
    private final ExecutionLogService executionLogService;
    private final ChannelDispatchService channelDispatchService;
    private final HookRunnerService hookRunnerService;
    private final EventBroadcastService eventBroadcastService;
    private final AlertEvaluationService alertEvaluationService;
    private final TriggerCalculationService triggerCalculationService;
    private final TaskSchedulingService taskSchedulingService;
    private final TaskLockManager taskLockManager;
    private final Clock clock;
    private final String hostId;

    public TaskExecutionServiceImpl(TaskStoreService taskStoreService,
                                    ExecutionLogService executionLogService,
                                    ChannelDispatchService channelDispatchService,
                                    HookRunnerService hookRunnerService,
                                    EventBroadcastService eventBroadcastService,
                                    AlertEvaluationService alertEvaluationService,
                                    TriggerCalculationService triggerCalculationService,
                                    TaskSchedulingService taskSchedulingService,
                                    TaskLockManager taskLockManager,
                                    Clock clock) {
        this.taskStoreService = taskStoreService;
        this.executionLogService = executionLogService;
        this.channelDispatchService = channelDispatchService;
        this.hookRunnerService = hookRunnerService;
        this.eventBroadcastService = eventBroadcastService;
        this.alertEvaluationService = alertEvaluationService;
        this.triggerCalculationService = triggerCalculationService;
        this.taskSchedulingService = taskSchedulingService;
        this.taskLockManager = taskLockManager;
        this.clock = clock;
        this.hostId = resolveHostId();
    }

    @Override
    public void execute(String taskId) {
        taskLockManager.runLocked(taskId, () -> fire(taskId));
    }

    private void fire(String taskId) {
        String workerId = Thread.currentThread().getName();
        NotificationTask task = null;
        ExecutionLog executionLog = null;
        try {
            Optional<NotificationTask> loaded = taskStoreService.findById(taskId);
            if (loaded.isEmpty()) {
                log.error("[Quartz] Task {} not found", taskId);
                return;
            }
            task = loaded.get();
            Instant startedAt = clock.instant();

            if (executionLogService.hasRecentExecution(taskId, startedAt)) {
                log.warn("[Quartz] Task {} already ran within the duplicate window, skipping", taskId);
                executionLogService.recordDuplicateSkip(task, startedAt, workerId, hostId);
                publish(task, ExecutionEvent.TASK_SKIPPED, "skipped", "Duplicate execution skipped");
                alertEvaluationService.evaluate(taskId, AlertType.DUPLICATE_EXECUTION);
                return;
            }

            if (!isDue(task)) {
                log.info("[Quartz] Task {} is {}, skipping", taskId, task.getStatus());
                return;
            }

            executionLog = executionLogService.start(task, startedAt, workerId, hostId);
            log.info("[Quartz] Executing task {}: {}", taskId, task.getTitle());

            HookResult before = runHook(HookType.BEFORE_EXECUTE, task, executionLog, Map.of());
            if (!before.isSuccess()) {
                log.warn("[Hook] before_execute failed for task {}, dispatching anyway: {}", taskId, before.getError());
            }

            DispatchOutcome outcome = dispatch(task);
            Instant completedAt = clock.instant();
            NotificationTask updated = applyOutcome(task, outcome, completedAt);
            rescheduleIfNeeded(updated);

            Map<String, Object> hookContext = new LinkedHashMap<>();
            hookContext.put("send_results", outcome.results());
            if (outcome.success()) {
                runHook(HookType.AFTER_SUCCESS, updated, executionLog, hookContext);
            } else {
                hookContext.put("error", outcome.errorMsg());
                runHook(HookType.AFTER_FAILURE, updated, executionLog, hookContext);
            }

            executionLog.setEndTime(clock.instant());
            executionLog.setStatus(outcome.success() ? ExecutionLogStatus.SUCCESS : ExecutionLogStatus.FAILED);
            executionLog.setSendResults(outcome.results());
            executionLog.setSuccessCount(outcome.successCount());
            executionLog.setFailureCount(outcome.failureCount());
            executionLog.setErrorMessage(outcome.success() ? null : outcome.errorMsg());
            executionLogService.finish(executionLog);

            if (outcome.success()) {
                log.info("[Quartz] Task {} delivered ({} sent, {} failed)", taskId, outcome.successCount(), outcome.failureCount());
                publish(updated, ExecutionEvent.TASK_EXECUTED, ChannelSendResult.SENT,
                        outcome.errorMsg() == null ? "Sent successfully" : outcome.errorMsg());
            } else {
                log.error("[Quartz] Task {} failed: {}", taskId, outcome.errorMsg());
                publish(updated, ExecutionEvent.TASK_EXECUTED, ChannelSendResult.FAILED, outcome.errorMsg());
                alertEvaluationService.evaluate(taskId, AlertType.EXECUTION_FAILURE);
                alertEvaluationService.evaluate(taskId, AlertType.HIGH_FAILURE_RATE);
            }
            alertEvaluationService.evaluate(taskId, AlertType.LONG_RUNNING);
        } catch (Exception e) {
            handleUnexpected(taskId, task, executionLog, e);
        }
    }

    /**
     * One-time tasks fire only while pending; recurring tasks fire unless the
     * user stopped them.
     */
    private boolean isDue(NotificationTask task) {
        TaskStatus status = task.getStatus();
        if (status == TaskStatus.CANCELLED || status == TaskStatus.PAUSED) {
            return false;
        }
        return task.isRecurring() || status == TaskStatus.PENDING;
    }

    private DispatchOutcome dispatch(NotificationTask task) {
        Delivery delivery = task.getDelivery();
        if (delivery == null) {
            throw new NotifySchedulerException("Task " + task.getId() + " has no delivery configured");
        }

        Map<String, ChannelSendResult> results = new LinkedHashMap<>();
        String lastError = null;
        int sent = 0;
        for (ChannelTarget target : delivery.targets()) {
            String channel = target.type().getValue();
            try {
                channelDispatchService.send(target.type(), target.config(), task.getTitle(), task.getContent());
                results.put(target.key(), ChannelSendResult.sent(channel, clock.instant()));
                sent++;
            } catch (RuntimeException e) {
                lastError = errorText(e);
                log.warn("[Dispatch] Channel {} of task {} failed: {}", target.key(), task.getId(), lastError);
                results.put(target.key(), ChannelSendResult.failed(channel, lastError));
            }
        }

        int total = results.size();
        int failed = total - sent;
        if (!task.isMultiChannel()) {
            return new DispatchOutcome(sent > 0, sent > 0 ? null : lastError, false, results, sent, failed);
        }
        String summary = failed == 0 ? null : String.format("%d/%d channels succeeded, %d failed", sent, total, failed);
        return new DispatchOutcome(sent > 0, summary, true, results, sent, failed);
    }

    /**
     * Merges the outcome into the task as currently stored, so a cancel or
     * pause written during the firing survives. A concurrent save makes the
     * merge run again on the newer copy.
     */
    private NotificationTask applyOutcome(NotificationTask snapshot, DispatchOutcome outcome, Instant completedAt) {
        Optional<NotificationTask> merged = taskStoreService.update(snapshot.getId(), task -> {
            boolean heldByUser = task.getStatus() == TaskStatus.CANCELLED || task.getStatus() == TaskStatus.PAUSED;
            if (outcome.success()) {
                task.setSentTime(completedAt);
            }
            // Recurring tasks re-arm whatever the outcome; the failure stays on errorMsg and the log
            if (!heldByUser) {
                if (task.isRecurring()) {
                    task.setStatus(TaskStatus.PENDING);
                } else {
                    task.setStatus(outcome.success() ? TaskStatus.SENT : TaskStatus.FAILED);
                }
            }
            task.setErrorMsg(outcome.errorMsg());
            if (outcome.multiChannel()) {
                task.setSendResults(outcome.results());
            }
            if (task.isRecurring()) {
                rollForward(task, completedAt);
            }
            return task;
        });
        if (merged.isEmpty()) {
            log.warn("[Quartz] Task {} was deleted during its firing", snapshot.getId());
            return snapshot;
        }
        return merged.get();
    }

    private void rescheduleIfNeeded(NotificationTask task) {
        try {
            taskSchedulingService.rescheduleAfterFiring(task);
        } catch (RuntimeException e) {
            log.error("[Quartz] Could not register the next run of task {}: {}", task.getId(), e.getMessage(), e);
        }
    }

    private void rollForward(NotificationTask task, Instant reference) {
        try {
            Instant next = triggerCalculationService.nextFireTime(task.getCronExpression(), reference);
            task.setScheduledTime(next);
            log.info("[Quartz] Task {} next run at {}", task.getId(), next);
        } catch (InvalidExpressionException e) {
            log.error("[Quartz] Cannot advance recurring task {} ({}): {}",
                    task.getId(), task.getCronExpression(), e.getMessage());
        }
    }

    private HookResult runHook(HookType hookType, NotificationTask task, ExecutionLog executionLog,
                               Map<String, Object> context) {
        HookConfig config = hookRunnerService.resolve(task, hookType);
        if (config == null) {
            return HookResult.skippedResult();
        }
        Instant start = clock.instant();
        HookResult result = hookRunnerService.run(hookType, task, context);
        try {
            executionLogService.recordHookExecution(task.getId(), executionLog == null ? null : executionLog.getId(),
                    hookType, config, start, clock.instant(), result);
        } catch (RuntimeException e) {
            log.warn("[Hook] Could not record {} hook run for task {}: {}", hookType.getValue(), task.getId(), e.getMessage());
        }
        return result;
    }

    private void handleUnexpected(String taskId, NotificationTask task, ExecutionLog executionLog, Exception e) {
        String error = errorText(e);
        log.error("[Quartz] Unexpected error executing task {}: {}", taskId, error, e);
        try {
            NotificationTask failed = taskStoreService.update(taskId, current -> {
                if (current.getStatus() != TaskStatus.CANCELLED && current.getStatus() != TaskStatus.PAUSED) {
                    current.setStatus(TaskStatus.FAILED);
                }
                current.setErrorMsg(error);
                return current;
            }).orElse(task);

            if (executionLog != null) {
                executionLog.setEndTime(clock.instant());
                executionLog.setStatus(ExecutionLogStatus.FAILED);
                executionLog.setErrorMessage(error);
                executionLog.setErrorStack(stackTrace(e));
                executionLogService.finish(executionLog);
            }
            if (failed != null) {
                runHook(HookType.AFTER_FAILURE, failed, executionLog, Map.of("error", error));
                publish(failed, ExecutionEvent.TASK_EXECUTED, ChannelSendResult.FAILED, error);
            }
            alertEvaluationService.evaluate(taskId, AlertType.EXECUTION_FAILURE);
        } catch (Exception nested) {
            log.error("[Quartz] Failure handling for task {} failed: {}", taskId, nested.getMessage(), nested);
        }
    }

    private void publish(NotificationTask task, String type, String status, String message) {
        if (task.getUserId() == null) {
            return;
        }
        eventBroadcastService.publish(task.getUserId(), ExecutionEvent.builder()
                .type(type)
                .taskId(task.getId())
                .title(task.getTitle())
                .status(status)
                .message(message)
                .timestamp(clock.instant())
                .build());
    }

    private static String errorText(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static String stackTrace(Throwable e) {
        StringWriter writer = new StringWriter();
        e.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }

    private static String resolveHostId() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.warn("[Quartz] Could not resolve host name: {}", e.getMessage());
            return "unknown";
        }
    }

    private record DispatchOutcome(boolean success, String errorMsg, boolean multiChannel,
                                   Map<String, ChannelSendResult> results, int successCount, int failureCount) {
    }
}
