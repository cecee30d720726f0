package com.lpzapper.session;

import com.lpzapper.config.SchedulerConfig;
import com.lpzapper.ledger.Position;
import com.lpzapper.ledger.PositionLedger;
import com.lpzapper.session.config.WatcherProperties;
import com.lpzapper.valuation.PositionValuator;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Owns every session's watcher handle and the set of sessions with a flow in flight.
 * At most one watcher per session: starting one cancels and replaces the previous handle.
 */
@Component
@Slf4j
public class SessionCoordinator {

    private final Map<String, WatcherHandle> watchers = new ConcurrentHashMap<>();
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    private final TaskScheduler watcherScheduler;
    private final PositionLedger ledger;
    private final PositionValuator valuator;
    private final PositionUpdateListener listener;
    private final WatcherProperties watcherProperties;
    private final Clock clock;

    public SessionCoordinator(
            @Qualifier(SchedulerConfig.WATCHER_SCHEDULER) TaskScheduler watcherScheduler,
            PositionLedger ledger,
            PositionValuator valuator,
            PositionUpdateListener listener,
            WatcherProperties watcherProperties,
            Clock clock
    ) {
        this.watcherScheduler = watcherScheduler;
        this.ledger = ledger;
        this.valuator = valuator;
        this.listener = listener;
        this.watcherProperties = watcherProperties;
        this.clock = clock;
    }

    /**
     * Starts refreshing the position at {@code positionIndex} (wrapped into range) for the session, replacing any
     * watcher the session already has.
     *
     * @throws NoPositionsException when the ledger is empty
     */
    public WatcherHandle startWatcher(String sessionId, int positionIndex) {
        List<Position> positions = ledger.list();
        if (positions.isEmpty()) {
            throw new NoPositionsException();
        }
        int index = PositionLedger.wrapIndex(positionIndex, positions.size());
        String token = positions.get(index).tokenAddress();
        Duration period = Duration.ofMillis(watcherProperties.getRefreshIntervalMs());
        return watchers.compute(sessionId, (id, previous) -> {
            if (previous != null) {
                previous.cancel();
                log.debug("Replaced watcher of session {} on {}", id, previous.tokenAddress());
            }
            PositionWatcher watcher = new PositionWatcher(id, token, ledger, valuator, listener,
                    this::isInFlight, this::onWatcherClosed, clock);
            ScheduledFuture<?> future = watcherScheduler.scheduleAtFixedRate(watcher, period);
            log.info("Watching position #{} ({}) for session {} every {}ms", index, token, id, period.toMillis());
            return new WatcherHandle(id, index, token, watcher, future);
        });
    }

    /**
     * @return true when a watcher was running
     */
    public boolean stopWatcher(String sessionId) {
        boolean stopped = cancelWatcher(sessionId);
        if (stopped) {
            listener.onWatchEnded(sessionId);
        }
        return stopped;
    }

    public Optional<WatcherHandle> activeWatcher(String sessionId) {
        return Optional.ofNullable(watchers.get(sessionId));
    }

    /**
     * Marks a flow as in flight for the session and stops its watcher.
     *
     * @return false when the session already had a flow in flight
     */
    public boolean beginFlow(String sessionId) {
        cancelWatcher(sessionId);
        return inFlight.add(sessionId);
    }

    public void endFlow(String sessionId) {
        inFlight.remove(sessionId);
    }

    public boolean isInFlight(String sessionId) {
        return inFlight.contains(sessionId);
    }

    private boolean cancelWatcher(String sessionId) {
        WatcherHandle handle = watchers.remove(sessionId);
        if (handle == null) {
            return false;
        }
        handle.cancel();
        log.info("Stopped watcher for session {}", sessionId);
        return true;
    }

    private void onWatcherClosed(PositionWatcher watcher) {
        WatcherHandle handle = watchers.get(watcher.getSessionId());
        if (handle != null && handle.watcher() == watcher && watchers.remove(watcher.getSessionId(), handle)) {
            handle.cancel();
            listener.onWatchEnded(watcher.getSessionId());
        }
    }

    @PreDestroy
    public void shutdown() {
        watchers.values().forEach(WatcherHandle::cancel);
        watchers.clear();
    }
}
