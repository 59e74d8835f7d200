package org.lite.notify.service;

import org.lite.notify.entity.NotificationTask;
import org.lite.notify.model.ScheduledJobInfo;

import java.util.List;

public interface TaskSchedulingService {

    /**
     * Register (or replace) the task's job. A one-time task gets a single
     * absolute-time trigger, a recurring one a cron trigger. The job of the
     * other kind is removed, so switching recurrence never leaves two jobs.
     */
    void schedule(NotificationTask task);

    /**
     * Register the next firing of a recurring task whose schedule Quartz cannot
     * express as a cron trigger (day-of-month and day-of-week both restricted).
     * Such tasks get a single-shot trigger at their rolled-forward
     * {@code scheduledTime}. No-op for every other task.
     */
    void rescheduleAfterFiring(NotificationTask task);

    /**
     * Remove the registration of one kind. No-op when absent.
     */
    void unschedule(String taskId, boolean recurring);

    /**
     * Remove any registration of the task.
     */
    void unschedule(String taskId);

    /**
     * Re-register every pending task after a restart.
     * @return number of tasks registered
     */
    int loadPendingOnStartup();

    List<ScheduledJobInfo> getScheduledJobs();

    boolean isRunning();
}
