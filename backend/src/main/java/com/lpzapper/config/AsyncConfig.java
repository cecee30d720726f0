package com.lpzapper.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.concurrent.Executor;

/**
 * Single-thread executor for commands that mutate state (zap-in, zap-out, executing flow steps).
 * One thread means the position ledger has exactly one writer.
 */
@Configuration
public class AsyncConfig {

    public static final String COMMAND_EXECUTOR = "command-executor";
    public static final String COMMAND_SCHEDULER = "command-scheduler";

    @Bean(name = COMMAND_EXECUTOR)
    public Executor commandExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(1);
        e.setMaxPoolSize(1);
        e.setThreadNamePrefix("command-");
        e.initialize();
        return e;
    }

    /** Reactor view of the command executor for controllers. */
    @Bean(name = COMMAND_SCHEDULER)
    public Scheduler commandScheduler(@Qualifier(COMMAND_EXECUTOR) Executor commandExecutor) {
        return Schedulers.fromExecutor(commandExecutor);
    }
}
