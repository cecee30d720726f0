package com.lpzapper.session.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Position watcher settings.
 */
@ConfigurationProperties(prefix = "lpzapper.watcher")
@NoArgsConstructor
@Getter
@Setter
public class WatcherProperties {

    /** Period between refreshes of a watched position. The first refresh runs immediately. */
    private long refreshIntervalMs = 10_000;

    /**
     * A session's update stream and zap-in state are dropped after this long without use. An abandoned
     * unfinished zap-in is cancelled when dropped.
     */
    private long sessionIdleTimeoutMs = 1_800_000;
}
