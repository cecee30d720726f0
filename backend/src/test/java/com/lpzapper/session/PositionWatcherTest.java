package com.lpzapper.session;

import com.lpzapper.chain.RpcException;
import com.lpzapper.common.MutableClock;
import com.lpzapper.ledger.Position;
import com.lpzapper.ledger.PositionLedger;
import com.lpzapper.valuation.PositionValuator;
import com.lpzapper.valuation.PositionView;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PositionWatcherTest {

    private static final String TOKEN = "0x6B175474E89094C44Da98b954EedeAC495271d0F";
    private static final String OTHER = "0x1f9840a85d5aF5bf1D1762F925BDADdC4201F984";
    private static final Position POSITION = new Position(TOKEN, null, BigDecimal.ONE, BigDecimal.TEN, 1L);

    private PositionLedger ledger;
    private PositionValuator valuator;
    private List<PositionUpdate> updates;
    private AtomicBoolean inFlight;
    private AtomicInteger closedCallbacks;
    private PositionWatcher watcher;

    @BeforeEach
    void setUp() {
        ledger = mock(PositionLedger.class);
        valuator = mock(PositionValuator.class);
        updates = new ArrayList<>();
        inFlight = new AtomicBoolean();
        closedCallbacks = new AtomicInteger();
        watcher = new PositionWatcher("s1", TOKEN, ledger, valuator, updates::add, id -> inFlight.get(),
                w -> closedCallbacks.incrementAndGet(), new MutableClock(Instant.parse("2025-01-01T00:00:00Z")));
    }

    @Test
    @DisplayName("identical views are emitted once")
    void dedupesUnchangedViews() {
        when(ledger.list()).thenReturn(List.of(new Position(OTHER, null, BigDecimal.ONE, BigDecimal.ONE, 1L), POSITION));
        when(valuator.value(POSITION, 1, 2)).thenReturn(view("0.2"), view("0.2"), view("0.3"));

        watcher.run();
        watcher.run();
        watcher.run();

        assertThat(updates).hasSize(2);
        assertThat(updates).allSatisfy(u -> {
            assertThat(u.kind()).isEqualTo(PositionUpdate.Kind.UPDATED);
            assertThat(u.positionIndex()).isEqualTo(1);
        });
        assertThat(updates.get(1).view().positionValueEth()).isEqualByComparingTo("0.3");
    }

    @Test
    @DisplayName("ticks are skipped while a flow is in flight")
    void skipsWhileInFlight() {
        inFlight.set(true);

        watcher.run();

        verify(ledger, never()).list();
        assertThat(updates).isEmpty();
    }

    @Test
    @DisplayName("a removed position emits CLOSED once and stops the watcher")
    void closesWhenPositionGone() {
        when(ledger.list()).thenReturn(List.of());

        watcher.run();
        watcher.run();

        assertThat(updates).singleElement().satisfies(u -> {
            assertThat(u.kind()).isEqualTo(PositionUpdate.Kind.CLOSED);
            assertThat(u.view()).isNull();
        });
        assertThat(closedCallbacks.get()).isEqualTo(1);
    }

    @Test
    void failingTickIsRetriedNextTime() {
        when(ledger.list()).thenReturn(List.of(POSITION));
        when(valuator.value(any(), anyInt(), anyInt())).thenThrow(new RpcException("node down")).thenReturn(view("0.2"));

        watcher.run();
        assertThat(updates).isEmpty();

        watcher.run();
        assertThat(updates).hasSize(1);
    }

    static PositionView view(String valueEth) {
        BigDecimal v = new BigDecimal(valueEth);
        return new PositionView(0, 1, TOKEN, null, "Dai", "DAI", BigDecimal.ONE, BigDecimal.ONE, v, v,
                BigDecimal.ONE, BigDecimal.TEN, BigDecimal.TEN, BigDecimal.TEN, BigDecimal.TEN, BigDecimal.ZERO,
                BigDecimal.ONE, BigDecimal.ONE, BigDecimal.ONE);
    }
}
