package com.lpzapper.session;

import com.lpzapper.common.Addresses;
import com.lpzapper.ledger.Position;
import com.lpzapper.ledger.PositionLedger;
import com.lpzapper.valuation.PositionValuator;
import com.lpzapper.valuation.PositionView;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * One refresh loop for one session and position. Each tick re-reads the ledger: the position being gone emits
 * CLOSED and ends the loop, otherwise a fresh view is emitted when it differs from the previous one. Ticks are
 * skipped while the session has a flow in flight. A failing tick is logged and the next one runs as scheduled.
 */
@Slf4j
public class PositionWatcher implements Runnable {

    private final String sessionId;
    private final String tokenAddress;
    private final PositionLedger ledger;
    private final PositionValuator valuator;
    private final PositionUpdateListener listener;
    private final Predicate<String> inFlight;
    private final Consumer<PositionWatcher> onClosed;
    private final Clock clock;

    private PositionView lastView;
    private boolean closed;

    public PositionWatcher(String sessionId, String tokenAddress, PositionLedger ledger, PositionValuator valuator,
                           PositionUpdateListener listener, Predicate<String> inFlight,
                           Consumer<PositionWatcher> onClosed, Clock clock) {
        this.sessionId = sessionId;
        this.tokenAddress = tokenAddress;
        this.ledger = ledger;
        this.valuator = valuator;
        this.listener = listener;
        this.inFlight = inFlight;
        this.onClosed = onClosed;
        this.clock = clock;
    }

    @Override
    public synchronized void run() {
        if (closed) {
            return;
        }
        if (inFlight.test(sessionId)) {
            log.debug("Session {} has a flow in flight, skipping refresh", sessionId);
            return;
        }
        try {
            tick();
        } catch (RuntimeException e) {
            log.warn("Refresh of {} for session {} failed: {}", tokenAddress, sessionId, e.getMessage());
        }
    }

    private void tick() {
        List<Position> positions = ledger.list();
        int index = indexOf(positions);
        if (index < 0) {
            closed = true;
            log.info("Position {} closed, stopping watcher for session {}", tokenAddress, sessionId);
            listener.onUpdate(new PositionUpdate(sessionId, -1, tokenAddress, PositionUpdate.Kind.CLOSED, null, clock.instant()));
            onClosed.accept(this);
            return;
        }
        PositionView view = valuator.value(positions.get(index), index, positions.size());
        if (view.equals(lastView)) {
            return;
        }
        lastView = view;
        listener.onUpdate(new PositionUpdate(sessionId, index, tokenAddress, PositionUpdate.Kind.UPDATED, view, clock.instant()));
    }

    private int indexOf(List<Position> positions) {
        for (int i = 0; i < positions.size(); i++) {
            if (Addresses.same(positions.get(i).tokenAddress(), tokenAddress)) {
                return i;
            }
        }
        return -1;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getTokenAddress() {
        return tokenAddress;
    }
}
