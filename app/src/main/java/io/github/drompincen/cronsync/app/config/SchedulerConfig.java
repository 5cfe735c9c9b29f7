package io.github.drompincen.cronsync.app.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class SchedulerConfig {

    /**
     * The sync engine's affinity context. Must stay single-threaded.
     */
    @Bean
    ThreadPoolTaskScheduler cronSyncScheduler() {
        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("cron-sync-");
        scheduler.setRemoveOnCancelPolicy(true);
        // shut down with the bean, after the engine has been stopped
        scheduler.setAcceptTasksAfterContextClose(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        return scheduler;
    }
}
