package com.lpzapper.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Scheduler pool for per-session position watchers.
 */
@Configuration
public class SchedulerConfig {

    public static final String WATCHER_SCHEDULER = "watcher-scheduler";

    @Bean(name = WATCHER_SCHEDULER)
    public ThreadPoolTaskScheduler watcherScheduler() {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(4);
        s.setThreadNamePrefix("watcher-");
        s.setRemoveOnCancelPolicy(true);
        s.initialize();
        return s;
    }
}
