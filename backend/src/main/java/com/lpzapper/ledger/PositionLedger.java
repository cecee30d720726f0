package com.lpzapper.ledger;

import com.lpzapper.common.Addresses;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Open positions keyed by checksummed token address, in insertion order.
 * <p>
 * Each mutation loads the full collection and saves it whole. There is no locking: callers run mutations on the
 * single command executor, so there is one writer. Readers (watchers) may see the state before or after a write.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PositionLedger {

    public static final int FULL_EXIT_BPS = 10_000;

    private final PositionStore store;
    private final Clock clock;

    /**
     * Creates the token's position or merges into the existing one.
     *
     * @return index of the position in {@link #list()}
     */
    public int recordEntry(String tokenAddress, String pairAddress, BigDecimal baseAmount, BigDecimal marketCap) {
        if (baseAmount == null || baseAmount.signum() <= 0) {
            throw new IllegalArgumentException("baseAmount must be positive");
        }
        if (marketCap == null || marketCap.signum() < 0) {
            throw new IllegalArgumentException("marketCap must be non-negative");
        }
        String token = Addresses.checksum(tokenAddress);
        String pair = pairAddress != null ? Addresses.checksum(pairAddress) : null;
        long now = clock.millis();

        List<Position> positions = new ArrayList<>(store.load());
        int index = indexOf(positions, token);
        if (index >= 0) {
            Position merged = positions.get(index).merge(pair, baseAmount, marketCap, now);
            positions.set(index, merged);
            store.save(positions);
            log.info("Merged entry into position {}: base {} ETH, avg market cap {} ETH",
                    token, merged.initialBaseValue().toPlainString(), merged.initialMarketCap().toPlainString());
            return index;
        }
        positions.add(new Position(token, pair, baseAmount, marketCap, now));
        store.save(positions);
        log.info("Created position {} (pair {}): base {} ETH, market cap {} ETH",
                token, pair, baseAmount.toPlainString(), marketCap.toPlainString());
        return positions.size() - 1;
    }

    /**
     * Records an exit of {@code exitFractionBps / 10000} of the position. A full exit removes the position, any
     * partial exit leaves its cost basis unchanged.
     *
     * @return true when the position was removed
     */
    public boolean recordExit(String tokenAddress, int exitFractionBps) {
        if (exitFractionBps <= 0 || exitFractionBps > FULL_EXIT_BPS) {
            throw new IllegalArgumentException("exitFractionBps must be in (0, 10000]: " + exitFractionBps);
        }
        if (exitFractionBps < FULL_EXIT_BPS) {
            log.info("Partial exit of {} bps from {}, position kept", exitFractionBps, tokenAddress);
            return false;
        }
        String token = Addresses.checksum(tokenAddress);
        List<Position> positions = new ArrayList<>(store.load());
        int index = indexOf(positions, token);
        if (index < 0) {
            log.warn("Full exit for {} but no position is recorded", token);
            return false;
        }
        positions.remove(index);
        store.save(positions);
        log.info("Removed position {} after full exit", token);
        return true;
    }

    public List<Position> list() {
        return List.copyOf(store.load());
    }

    public Optional<Position> find(int index) {
        List<Position> positions = store.load();
        if (index < 0 || index >= positions.size()) {
            return Optional.empty();
        }
        return Optional.of(positions.get(index));
    }

    public int indexOf(String tokenAddress) {
        if (!Addresses.isValid(tokenAddress)) {
            return -1;
        }
        return indexOf(store.load(), tokenAddress);
    }

    /**
     * Wraps a navigation index into {@code [0, size)}, so -1 is the last position and {@code size} the first.
     */
    public static int wrapIndex(int index, int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("Cannot navigate an empty ledger");
        }
        return Math.floorMod(index, size);
    }

    private static int indexOf(List<Position> positions, String tokenAddress) {
        for (int i = 0; i < positions.size(); i++) {
            if (Addresses.same(positions.get(i).tokenAddress(), tokenAddress)) {
                return i;
            }
        }
        return -1;
    }
}
