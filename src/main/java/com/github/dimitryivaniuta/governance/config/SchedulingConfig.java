package com.github.dimitryivaniuta.governance.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Dedicated pool for maintenance job bodies. Cron triggers fire on the Spring scheduling
 * pool and hand the work over here, so neither shares threads with request handling.
 */
@Configuration
public class SchedulingConfig {

    @Bean(name = "maintenanceExecutor")
    public ThreadPoolTaskExecutor maintenanceExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("maintenance-");
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(16);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
