package org.lite.notify.scheduler;

import lombok.extern.slf4j.Slf4j;
import org.lite.notify.service.NotifyQuartzService;
import org.lite.notify.service.TaskExecutionService;
import org.quartz.DisallowConcurrentExecution;
import org.quartz.JobExecutionContext;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.quartz.QuartzJobBean;

/**
 * Quartz job that fires a notification task by taskId.
 */
@Slf4j
@DisallowConcurrentExecution
public class NotifyTaskQuartzJob extends QuartzJobBean {

    @Autowired
    private TaskExecutionService taskExecutionService;

    @Override
    protected void executeInternal(JobExecutionContext context) {
        String taskId = context.getMergedJobDataMap().getString(NotifyQuartzService.TASK_ID_KEY);
        String jobId = context.getJobDetail().getKey().getName();

        log.info("[Quartz] Firing {} for task {} (scheduled {}, actual {})",
                jobId, taskId, context.getScheduledFireTime(), context.getFireTime());

        try {
            taskExecutionService.execute(taskId);
        } catch (Exception e) {
            log.error("[Quartz] Unexpected error executing task {}: {}", taskId, e.getMessage(), e);
        }
    }
}
