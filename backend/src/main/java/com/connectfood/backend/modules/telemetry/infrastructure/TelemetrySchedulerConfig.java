package com.connectfood.backend.modules.telemetry.infrastructure;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class TelemetrySchedulerConfig {

    @Bean(name = "telemetryTaskScheduler")
    public ThreadPoolTaskScheduler telemetryTaskScheduler(
            @Value("${connectfood.telemetry.scheduler-pool-size:4}") int poolSize
    ) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix("freshness-feed-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }
}
