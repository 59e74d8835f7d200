package org.lite.notify.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.notify.model.ScheduledJobInfo;
import org.lite.notify.scheduler.NotifyTaskQuartzJob;
import org.lite.notify.service.NotifyQuartzService;
import org.quartz.CronScheduleBuilder;
import org.quartz.CronTrigger;
import org.quartz.JobBuilder;
import org.quartz.JobDataMap;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.SimpleScheduleBuilder;
import org.quartz.Trigger;
import org.quartz.TriggerBuilder;
import org.quartz.TriggerKey;
import org.quartz.impl.matchers.GroupMatcher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Date;
import java.util.List;
import java.util.TimeZone;

@Service
@RequiredArgsConstructor
@Slf4j
public class NotifyQuartzServiceImpl implements NotifyQuartzService {

    private final Scheduler scheduler;

    @Override
    public void scheduleOnce(String jobId, String taskId, Instant fireAt) throws SchedulerException {
        JobDetail jobDetail = buildJob(jobId, taskId);

        // A firing missed past the misfire threshold runs once, immediately
        Trigger trigger = TriggerBuilder.newTrigger()
                .withIdentity(new TriggerKey(jobId, TRIGGER_GROUP))
                .forJob(jobDetail)
                .startAt(Date.from(fireAt))
                .withSchedule(SimpleScheduleBuilder.simpleSchedule().withMisfireHandlingInstructionFireNow())
                .build();

        replace(jobDetail, trigger);
        log.info("[Quartz] Scheduled {} (task {}) at {}", jobId, taskId, fireAt);
    }

    @Override
    public void scheduleCron(String jobId, String taskId, String quartzCronExpression, ZoneId zone) throws SchedulerException {
        JobDetail jobDetail = buildJob(jobId, taskId);

        // Missed slots collapse into one firing, then the schedule continues
        CronScheduleBuilder cronSchedule = CronScheduleBuilder.cronSchedule(quartzCronExpression)
                .inTimeZone(TimeZone.getTimeZone(zone))
                .withMisfireHandlingInstructionFireAndProceed();

        Trigger trigger = TriggerBuilder.newTrigger()
                .withIdentity(new TriggerKey(jobId, TRIGGER_GROUP))
                .forJob(jobDetail)
                .withSchedule(cronSchedule)
                .build();

        replace(jobDetail, trigger);
        log.info("[Quartz] Scheduled {} (task {}) with cron {} in {}", jobId, taskId, quartzCronExpression, zone);
    }

    @Override
    public boolean unschedule(String jobId) throws SchedulerException {
        JobKey jobKey = new JobKey(jobId, JOB_GROUP);
        TriggerKey triggerKey = new TriggerKey(jobId, TRIGGER_GROUP);
        if (scheduler.checkExists(triggerKey)) {
            scheduler.unscheduleJob(triggerKey);
        }
        if (scheduler.checkExists(jobKey)) {
            scheduler.deleteJob(jobKey);
            log.info("[Quartz] Unscheduled {}", jobId);
            return true;
        }
        return false;
    }

    @Override
    public boolean exists(String jobId) throws SchedulerException {
        return scheduler.checkExists(new JobKey(jobId, JOB_GROUP));
    }

    @Override
    public List<ScheduledJobInfo> listJobs() throws SchedulerException {
        List<ScheduledJobInfo> jobs = new ArrayList<>();
        for (JobKey jobKey : scheduler.getJobKeys(GroupMatcher.jobGroupEquals(JOB_GROUP))) {
            JobDetail detail = scheduler.getJobDetail(jobKey);
            if (detail == null) {
                continue;       // removed concurrently
            }
            String taskId = detail.getJobDataMap().getString(TASK_ID_KEY);
            for (Trigger trigger : scheduler.getTriggersOfJob(jobKey)) {
                Date next = trigger.getNextFireTime();
                jobs.add(new ScheduledJobInfo(jobKey.getName(), taskId,
                        next == null ? null : next.toInstant(), describe(trigger)));
            }
        }
        jobs.sort(Comparator.comparing(ScheduledJobInfo::nextFireTime, Comparator.nullsLast(Comparator.naturalOrder())));
        return jobs;
    }

    @Override
    public boolean isRunning() throws SchedulerException {
        return scheduler.isStarted() && !scheduler.isShutdown() && !scheduler.isInStandbyMode();
    }

    private JobDetail buildJob(String jobId, String taskId) {
        JobDataMap dataMap = new JobDataMap();
        dataMap.put(TASK_ID_KEY, taskId);

        return JobBuilder.newJob(NotifyTaskQuartzJob.class)
                .withIdentity(new JobKey(jobId, JOB_GROUP))
                .usingJobData(dataMap)
                .storeDurably(false)
                .build();
    }

    private void replace(JobDetail jobDetail, Trigger trigger) throws SchedulerException {
        if (scheduler.checkExists(jobDetail.getKey())) {
            log.info("[Quartz] Replacing existing job {}", jobDetail.getKey().getName());
            scheduler.deleteJob(jobDetail.getKey());
        }
        scheduler.scheduleJob(jobDetail, trigger);
    }

    private static String describe(Trigger trigger) {
        if (trigger instanceof CronTrigger cron) {
            return "cron[" + cron.getCronExpression() + ", " + cron.getTimeZone().getID() + "]";
        }
        return "date[" + trigger.getStartTime().toInstant() + "]";
    }
}
