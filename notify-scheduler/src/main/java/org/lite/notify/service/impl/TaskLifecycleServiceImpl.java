package org.lite.notify.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.notify.entity.NotificationTask;
import org.lite.notify.enums.TaskStatus;
import org.lite.notify.exception.InvalidChannelConfigException;
import org.lite.notify.exception.InvalidTaskStateException;
import org.lite.notify.exception.TaskNotFoundException;
import org.lite.notify.model.ChannelTarget;
import org.lite.notify.service.TaskLifecycleService;
import org.lite.notify.service.TaskSchedulingService;
import org.lite.notify.service.TaskStoreService;
import org.lite.notify.service.TriggerCalculationService;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

@Service
@RequiredArgsConstructor
@Slf4j
public class TaskLifecycleServiceImpl implements TaskLifecycleService {

    private static final Set<TaskStatus> CANCELLABLE = EnumSet.of(TaskStatus.PENDING, TaskStatus.PAUSED, TaskStatus.FAILED);

    private final TaskStoreService taskStoreService;
    private final TaskSchedulingService taskSchedulingService;
    private final TriggerCalculationService triggerCalculationService;
    private final Clock clock;

    @Override
    public NotificationTask create(String userId, NotificationTask task) {
        if (isBlank(task.getTitle()) || isBlank(task.getContent())) {
            throw new IllegalArgumentException("Title and content are required");
        }
        if (task.getDelivery() == null) {
            throw new IllegalArgumentException("A delivery channel is required");
        }
        for (ChannelTarget target : task.getDelivery().targets()) {
            for (String field : target.type().getRequiredFields()) {
                Object value = target.config().get(field);
                if (value == null || String.valueOf(value).isBlank()) {
                    throw new InvalidChannelConfigException(target.type().getValue(), field);
                }
            }
        }

        NotificationTask fresh = NotificationTask.builder()
                .userId(userId)
                .title(task.getTitle())
                .content(task.getContent())
                .delivery(task.getDelivery())
                .recurring(task.isRecurring())
                .cronExpression(task.isRecurring() ? task.getCronExpression() : null)
                .scheduledTime(task.getScheduledTime())
                .hooksConfig(task.getHooksConfig())
                .status(TaskStatus.PENDING)
                .build();
        armTiming(fresh);

        NotificationTask saved = taskStoreService.save(fresh);
        taskSchedulingService.schedule(saved);
        log.info("Task {} created for user {}, first run at {}", saved.getId(), userId, saved.getScheduledTime());
        return saved;
    }

    @Override
    public NotificationTask get(String taskId) {
        return taskStoreService.findById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    @Override
    public List<NotificationTask> list(String userId, TaskStatus status) {
        return taskStoreService.findByUserId(userId).stream()
                .filter(task -> status == null || task.getStatus() == status)
                .sorted(Comparator.comparing(NotificationTask::getCreatedAt,
                        Comparator.nullsLast(Comparator.<Instant>reverseOrder())))
                .toList();
    }

    @Override
    public NotificationTask cancel(String taskId) {
        NotificationTask saved = transition(taskId, "cancel", task -> CANCELLABLE.contains(task.getStatus()),
                TaskStatus.CANCELLED);
        taskSchedulingService.unschedule(taskId, saved.isRecurring());
        log.info("Task {} cancelled", taskId);
        return saved;
    }

    @Override
    public NotificationTask pause(String taskId) {
        NotificationTask saved = transition(taskId, "pause", task -> task.getStatus() == TaskStatus.PENDING
                || (task.isRecurring() && task.getStatus() == TaskStatus.FAILED), TaskStatus.PAUSED);
        taskSchedulingService.unschedule(taskId, saved.isRecurring());
        log.info("Task {} paused", taskId);
        return saved;
    }

    @Override
    public NotificationTask resume(String taskId) {
        NotificationTask saved = taskStoreService.update(taskId, task -> {
            if (task.getStatus() != TaskStatus.PAUSED) {
                throw new InvalidTaskStateException(taskId, task.getStatus(), "resume");
            }
            task.setStatus(TaskStatus.PENDING);
            if (task.isRecurring()) {
                task.setScheduledTime(triggerCalculationService.nextFireTime(task.getCronExpression(), clock.instant()));
            }
            return task;
        }).orElseThrow(() -> new TaskNotFoundException(taskId));
        taskSchedulingService.schedule(saved);
        log.info("Task {} resumed, next run at {}", taskId, saved.getScheduledTime());
        return saved;
    }

    @Override
    public NotificationTask rearm(String taskId, NotificationTask edits) {
        NotificationTask saved = taskStoreService.update(taskId, task -> {
            task.setTitle(edits.getTitle() != null ? edits.getTitle() : task.getTitle());
            task.setContent(edits.getContent() != null ? edits.getContent() : task.getContent());
            task.setDelivery(edits.getDelivery() != null ? edits.getDelivery() : task.getDelivery());
            task.setHooksConfig(edits.getHooksConfig() != null ? edits.getHooksConfig() : task.getHooksConfig());
            task.setRecurring(edits.isRecurring());
            task.setCronExpression(edits.isRecurring() ? edits.getCronExpression() : null);
            task.setScheduledTime(edits.getScheduledTime());
            armTiming(task);
            task.setStatus(TaskStatus.PENDING);
            task.setErrorMsg(null);
            return task;
        }).orElseThrow(() -> new TaskNotFoundException(taskId));

        taskSchedulingService.schedule(saved);
        log.info("Task {} re-armed for {}", saved.getId(), saved.getScheduledTime());
        return saved;
    }

    @Override
    public void delete(String taskId) {
        get(taskId);
        taskSchedulingService.unschedule(taskId);
        taskStoreService.deleteById(taskId);
        log.info("Task {} deleted", taskId);
    }

    private NotificationTask transition(String taskId, String operation,
                                        Predicate<NotificationTask> allowed, TaskStatus target) {
        return taskStoreService.update(taskId, task -> {
            if (!allowed.test(task)) {
                throw new InvalidTaskStateException(taskId, task.getStatus(), operation);
            }
            task.setStatus(target);
            return task;
        }).orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    /**
     * Recurring tasks get their first fire time from the cron expression;
     * one-time tasks must carry one.
     */
    private void armTiming(NotificationTask task) {
        if (task.isRecurring()) {
            task.setScheduledTime(triggerCalculationService.nextFireTime(task.getCronExpression(), clock.instant()));
        } else if (task.getScheduledTime() == null) {
            throw new IllegalArgumentException("One-time task needs a scheduled time");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
