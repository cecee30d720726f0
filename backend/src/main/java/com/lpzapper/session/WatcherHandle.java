package com.lpzapper.session;

import java.util.concurrent.ScheduledFuture;

/**
 * A session's live watcher. Cancelling does not interrupt a tick already running.
 */
public record WatcherHandle(String sessionId, int positionIndex, String tokenAddress, PositionWatcher watcher,
                            ScheduledFuture<?> future) {

    public void cancel() {
        future.cancel(false);
    }

    public boolean isCancelled() {
        return future.isCancelled();
    }
}
