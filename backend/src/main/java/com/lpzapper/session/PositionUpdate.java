package com.lpzapper.session;

import com.lpzapper.valuation.PositionView;

import java.time.Instant;

/**
 * Emitted by a watcher. {@code view} is null for {@link Kind#CLOSED}.
 */
public record PositionUpdate(String sessionId, int positionIndex, String tokenAddress, Kind kind, PositionView view,
                             Instant emittedAt) {

    public enum Kind {
        UPDATED,
        CLOSED
    }
}
