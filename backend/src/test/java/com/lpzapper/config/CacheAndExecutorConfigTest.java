package com.lpzapper.config;

import com.lpzapper.common.cache.TtlCache;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.cache.CacheManager;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = {
        CaffeineConfig.class,
        AsyncConfig.class,
        SchedulerConfig.class
})
class CacheAndExecutorConfigTest {

    @Autowired
    CacheManager cacheManager;

    @Autowired
    TtlCache ttlCache;

    @Autowired
    @Qualifier(AsyncConfig.COMMAND_EXECUTOR)
    Executor commandExecutor;

    @Autowired
    @Qualifier(AsyncConfig.COMMAND_SCHEDULER)
    Scheduler commandScheduler;

    @Autowired
    @Qualifier(SchedulerConfig.WATCHER_SCHEDULER)
    ThreadPoolTaskScheduler watcherScheduler;

    @Test
    @DisplayName("token metadata cache is created and usable")
    void cachesCreatedAndUsed() {
        assertThat(cacheManager.getCache(CaffeineConfig.TOKEN_META_CACHE)).isNotNull();
        cacheManager.getCache(CaffeineConfig.TOKEN_META_CACHE).put("key1", "value1");
        assertThat(cacheManager.getCache(CaffeineConfig.TOKEN_META_CACHE).get("key1").get()).isEqualTo("value1");

        assertThat(ttlCache.getOrFetch("k", Duration.ofSeconds(1), () -> "v")).isEqualTo("v");
    }

    @Test
    @DisplayName("command executor is single-threaded")
    void commandExecutorSingleThread() {
        assertThat(commandExecutor).isInstanceOf(ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor e = (ThreadPoolTaskExecutor) commandExecutor;
        assertThat(e.getCorePoolSize()).isEqualTo(1);
        assertThat(e.getMaxPoolSize()).isEqualTo(1);

        String thread = Mono.fromCallable(() -> Thread.currentThread().getName())
                .subscribeOn(commandScheduler)
                .block(Duration.ofSeconds(5));
        assertThat(thread).startsWith("command-");
    }

    @Test
    @DisplayName("watcher scheduler is created and configured")
    void watcherSchedulerCreated() {
        assertThat(watcherScheduler.getThreadNamePrefix()).isEqualTo("watcher-");
        assertThat(watcherScheduler.getPoolSize()).isLessThanOrEqualTo(4);
    }
}
