package com.talentledger.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Single-thread scheduler for @Scheduled maintenance work (the unpublished activity sweep). Reconciliation itself
 * never runs here; it has its own partition workers.
 */
@Slf4j
@Configuration
@EnableScheduling
public class SchedulerConfig {

    public static final String MAINTENANCE_SCHEDULER = "maintenance-scheduler";

    @Bean(name = MAINTENANCE_SCHEDULER)
    public ThreadPoolTaskScheduler maintenanceScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("maintenance-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(5);
        scheduler.setErrorHandler(t -> log.warn("Scheduled maintenance task failed: {}", t.getMessage(), t));
        scheduler.initialize();
        return scheduler;
    }
}
