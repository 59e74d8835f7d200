package org.lite.notify.service;

import org.lite.notify.model.ScheduledJobInfo;
import org.quartz.SchedulerException;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

/**
 * Thin layer over the Quartz scheduler. Every registration replaces an
 * existing job with the same id.
 */
public interface NotifyQuartzService {

    String JOB_GROUP = "notifyTasks";
    String TRIGGER_GROUP = "notifyTasksTriggers";
    String TASK_ID_KEY = "taskId";

    void scheduleOnce(String jobId, String taskId, Instant fireAt) throws SchedulerException;

    void scheduleCron(String jobId, String taskId, String quartzCronExpression, ZoneId zone) throws SchedulerException;

    /**
     * @return false when no such job was registered
     */
    boolean unschedule(String jobId) throws SchedulerException;

    boolean exists(String jobId) throws SchedulerException;

    List<ScheduledJobInfo> listJobs() throws SchedulerException;

    boolean isRunning() throws SchedulerException;
}
