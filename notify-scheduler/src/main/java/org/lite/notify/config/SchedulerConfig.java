package org.lite.notify.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.quartz.SchedulerFactoryBeanCustomizer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(SchedulerProperties.class)
@Slf4j
public class SchedulerConfig {

    @Bean
    public Clock clock(SchedulerProperties properties) {
        return Clock.system(properties.zoneId());
    }

    /**
     * In-flight firings finish before the context closes; registrations are
     * rebuilt from the task store on startup.
     */
    @Bean
    public SchedulerFactoryBeanCustomizer notifySchedulerCustomizer(SchedulerProperties properties) {
        return factory -> {
            factory.setWaitForJobsToCompleteOnShutdown(true);
            factory.setOverwriteExistingJobs(true);
            log.info("[Quartz] Scheduler configured (zone={})", properties.getTimeZone());
        };
    }
}
