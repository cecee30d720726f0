package com.lpzapper.session;

import com.lpzapper.common.MutableClock;
import com.lpzapper.ledger.Position;
import com.lpzapper.ledger.PositionLedger;
import com.lpzapper.session.config.WatcherProperties;
import com.lpzapper.valuation.PositionValuator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.scheduling.TaskScheduler;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SessionCoordinatorTest {

    private static final String TOKEN_A = "0x6B175474E89094C44Da98b954EedeAC495271d0F";
    private static final String TOKEN_B = "0x1f9840a85d5aF5bf1D1762F925BDADdC4201F984";

    private TaskScheduler scheduler;
    private ScheduledFuture<?> first;
    private ScheduledFuture<?> second;
    private PositionLedger ledger;
    private SessionCoordinator coordinator;

    @BeforeEach
    void setUp() {
        scheduler = mock(TaskScheduler.class);
        first = mock(ScheduledFuture.class);
        second = mock(ScheduledFuture.class);
        doReturn(first, second).when(scheduler).scheduleAtFixedRate(any(Runnable.class), any(Duration.class));
        ledger = mock(PositionLedger.class);
        when(ledger.list()).thenReturn(List.of(
                new Position(TOKEN_A, null, BigDecimal.ONE, BigDecimal.ONE, 1L),
                new Position(TOKEN_B, null, BigDecimal.ONE, BigDecimal.ONE, 2L)));
        coordinator = new SessionCoordinator(scheduler, ledger, mock(PositionValuator.class), update -> { },
                new WatcherProperties(), new MutableClock(Instant.parse("2025-01-01T00:00:00Z")));
    }

    @Test
    @DisplayName("a new watcher replaces the session's previous one")
    void oneWatcherPerSession() {
        coordinator.startWatcher("s1", 0);
        WatcherHandle handle = coordinator.startWatcher("s1", 1);

        verify(first).cancel(false);
        assertThat(handle.tokenAddress()).isEqualTo(TOKEN_B);
        assertThat(coordinator.activeWatcher("s1")).contains(handle);
        verify(scheduler, times(2)).scheduleAtFixedRate(any(Runnable.class), eq(Duration.ofMillis(10_000)));
    }

    @Test
    void indexWrapsAround() {
        assertThat(coordinator.startWatcher("s1", -1).tokenAddress()).isEqualTo(TOKEN_B);
        assertThat(coordinator.startWatcher("s2", 2).positionIndex()).isZero();
    }

    @Test
    void emptyLedgerHasNothingToWatch() {
        when(ledger.list()).thenReturn(List.of());

        assertThatThrownBy(() -> coordinator.startWatcher("s1", 0)).isInstanceOf(NoPositionsException.class);
    }

    @Test
    @DisplayName("beginning a flow stops the watcher and marks the session in flight")
    void flowLifecycle() {
        coordinator.startWatcher("s1", 0);

        assertThat(coordinator.beginFlow("s1")).isTrue();
        assertThat(coordinator.beginFlow("s1")).isFalse();
        assertThat(coordinator.isInFlight("s1")).isTrue();
        assertThat(coordinator.activeWatcher("s1")).isEmpty();
        verify(first).cancel(false);

        coordinator.endFlow("s1");
        assertThat(coordinator.isInFlight("s1")).isFalse();
    }

    @Test
    void stopWatcherReportsWhetherOneWasRunning() {
        assertThat(coordinator.stopWatcher("s1")).isFalse();
        coordinator.startWatcher("s1", 0);
        assertThat(coordinator.stopWatcher("s1")).isTrue();
    }

    @Test
    void sessionsAreIndependent() {
        coordinator.startWatcher("s1", 0);
        coordinator.startWatcher("s2", 1);
        coordinator.beginFlow("s1");

        assertThat(coordinator.activeWatcher("s2")).isPresent();
        assertThat(coordinator.isInFlight("s2")).isFalse();
    }

    @Test
    @DisplayName("the update stream ends when the user stops watching or the position closes, not when a flow starts")
    void watchEndIsReported() {
        PositionUpdateListener listener = mock(PositionUpdateListener.class);
        coordinator = new SessionCoordinator(scheduler, ledger, mock(PositionValuator.class), listener,
                new WatcherProperties(), new MutableClock(Instant.parse("2025-01-01T00:00:00Z")));

        coordinator.startWatcher("s1", 0);
        coordinator.beginFlow("s1");
        verify(listener, never()).onWatchEnded("s1");

        coordinator.endFlow("s1");
        coordinator.startWatcher("s1", 0);
        coordinator.stopWatcher("s1");
        verify(listener, times(1)).onWatchEnded("s1");
    }

    @Test
    void closedPositionEndsTheWatch() {
        PositionUpdateListener listener = mock(PositionUpdateListener.class);
        coordinator = new SessionCoordinator(scheduler, ledger, mock(PositionValuator.class), listener,
                new WatcherProperties(), new MutableClock(Instant.parse("2025-01-01T00:00:00Z")));
        coordinator.startWatcher("s1", 0);
        ArgumentCaptor<Runnable> tick = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).scheduleAtFixedRate(tick.capture(), any(Duration.class));

        when(ledger.list()).thenReturn(List.of(new Position(TOKEN_B, null, BigDecimal.ONE, BigDecimal.ONE, 2L)));
        tick.getValue().run();

        verify(listener).onUpdate(argThat(u -> u.kind() == PositionUpdate.Kind.CLOSED));
        verify(listener).onWatchEnded("s1");
        verify(first).cancel(false);
        assertThat(coordinator.activeWatcher("s1")).isEmpty();
    }
}
