package org.lite.notify.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.notify.service.TaskSchedulingService;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Component;

/**
 * Rebuilds the in-memory Quartz registrations from the task store once the
 * application is up.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class QuartzStartupScheduler implements ApplicationListener<ApplicationReadyEvent> {

    private final TaskSchedulingService taskSchedulingService;

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        log.info("[Quartz] Scanning task store for pending tasks...");
        try {
            taskSchedulingService.loadPendingOnStartup();
        } catch (RuntimeException e) {
            log.error("[Quartz] Error loading pending tasks on startup: {}", e.getMessage(), e);
        }
    }
}
