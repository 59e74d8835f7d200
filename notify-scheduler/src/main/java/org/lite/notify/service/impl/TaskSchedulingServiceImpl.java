package org.lite.notify.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.notify.entity.NotificationTask;
import org.lite.notify.enums.TaskStatus;
import org.lite.notify.exception.NotifySchedulerException;
import org.lite.notify.model.ScheduledJobInfo;
import org.lite.notify.service.NotifyQuartzService;
import org.lite.notify.service.TaskSchedulingService;
import org.lite.notify.service.TaskStoreService;
import org.lite.notify.service.TriggerCalculationService;
import org.quartz.SchedulerException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class TaskSchedulingServiceImpl implements TaskSchedulingService {

    private final NotifyQuartzService notifyQuartzService;
    private final TriggerCalculationService triggerCalculationService;
    private final TaskStoreService taskStoreService;
    private final Clock clock;

    @Override
    public void schedule(NotificationTask task) {
        String taskId = task.getId();
        if (taskId == null) {
            throw new IllegalArgumentException("Task must be saved before it can be scheduled");
        }
        try {
            if (task.isRecurring()) {
                String jobId = NotificationTask.jobIdFor(taskId, true);
                Optional<String> quartzExpression = triggerCalculationService.toQuartzExpression(task.getCronExpression());
                if (quartzExpression.isPresent()) {
                    notifyQuartzService.scheduleCron(jobId, taskId, quartzExpression.get(), triggerCalculationService.getZone());
                } else {
                    // Re-registered after every firing, see rescheduleAfterFiring
                    notifyQuartzService.scheduleOnce(jobId, taskId, nextRecurringTime(task));
                }
                notifyQuartzService.unschedule(NotificationTask.jobIdFor(taskId, false));
            } else {
                if (task.getScheduledTime() == null) {
                    throw new NotifySchedulerException("One-time task " + taskId + " has no scheduled time");
                }
                notifyQuartzService.scheduleOnce(NotificationTask.jobIdFor(taskId, false), taskId, task.getScheduledTime());
                notifyQuartzService.unschedule(NotificationTask.jobIdFor(taskId, true));
            }
        } catch (SchedulerException e) {
            throw new NotifySchedulerException("Failed to schedule task " + taskId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void rescheduleAfterFiring(NotificationTask task) {
        if (!task.isRecurring() || task.getStatus() != TaskStatus.PENDING
                || triggerCalculationService.toQuartzExpression(task.getCronExpression()).isPresent()) {
            return;
        }
        schedule(task);
        log.debug("[Quartz] Recurring task {} re-registered for {}", task.getId(), task.getScheduledTime());
    }

    @Override
    public void unschedule(String taskId, boolean recurring) {
        String jobId = NotificationTask.jobIdFor(taskId, recurring);
        try {
            if (!notifyQuartzService.unschedule(jobId)) {
                log.debug("[Quartz] No job {} to remove", jobId);
            }
        } catch (SchedulerException e) {
            throw new NotifySchedulerException("Failed to unschedule task " + taskId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void unschedule(String taskId) {
        unschedule(taskId, false);
        unschedule(taskId, true);
    }

    @Override
    public int loadPendingOnStartup() {
        List<NotificationTask> pending = taskStoreService.findByStatus(TaskStatus.PENDING);
        log.info("[Quartz] Found {} pending tasks to load", pending.size());

        Instant now = clock.instant();
        int registered = 0;
        for (NotificationTask task : pending) {
            try {
                boolean elapsed = task.getScheduledTime() == null || task.getScheduledTime().isBefore(now);
                if (!task.isRecurring() && elapsed) {
                    log.warn("[Quartz] One-time task {} was due at {}, not loading it", task.getId(), task.getScheduledTime());
                    continue;
                }
                if (task.isRecurring() && elapsed) {
                    Instant next = triggerCalculationService.nextFireTime(task.getCronExpression(), now);
                    task.setScheduledTime(next);
                    task = taskStoreService.save(task);
                    log.info("[Quartz] Recurring task {} was overdue, next run moved to {}", task.getId(), next);
                }
                schedule(task);
                registered++;
            } catch (RuntimeException e) {
                log.error("[Quartz] Failed to load task {} on startup: {}", task.getId(), e.getMessage());
            }
        }
        log.info("[Quartz] Loaded {} of {} pending tasks", registered, pending.size());
        return registered;
    }

    @Override
    public List<ScheduledJobInfo> getScheduledJobs() {
        try {
            return notifyQuartzService.listJobs();
        } catch (SchedulerException e) {
            throw new NotifySchedulerException("Failed to list scheduled jobs: " + e.getMessage(), e);
        }
    }

    private Instant nextRecurringTime(NotificationTask task) {
        Instant now = clock.instant();
        if (task.getScheduledTime() != null && task.getScheduledTime().isAfter(now)) {
            return task.getScheduledTime();
        }
        return triggerCalculationService.nextFireTime(task.getCronExpression(), now);
    }

    @Override
    public boolean isRunning() {
        try {
            return notifyQuartzService.isRunning();
        } catch (SchedulerException e) {
            log.warn("[Quartz] Could not read scheduler state: {}", e.getMessage());
            return false;
        }
    }
}
