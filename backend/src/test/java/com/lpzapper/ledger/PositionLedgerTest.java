package com.lpzapper.ledger;

import com.lpzapper.common.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PositionLedgerTest {

    private static final String TOKEN_A = "0x6B175474E89094C44Da98b954EedeAC495271d0F";
    private static final String TOKEN_B = "0x1f9840a85d5aF5bf1D1762F925BDADdC4201F984";
    private static final String PAIR_A = "0xA478c2975Ab1Ea89e8196811F51A7B7Ade33eB11";

    private InMemoryStore store;
    private MutableClock clock;
    private PositionLedger ledger;

    @BeforeEach
    void setUp() {
        store = new InMemoryStore();
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        ledger = new PositionLedger(store, clock);
    }

    @Test
    @DisplayName("first entry creates the position with checksummed addresses")
    void createsPosition() {
        int index = ledger.recordEntry(TOKEN_A.toLowerCase(), PAIR_A.toLowerCase(), new BigDecimal("0.01"), new BigDecimal("100"));

        assertThat(index).isZero();
        Position p = ledger.list().get(0);
        assertThat(p.tokenAddress()).isEqualTo(TOKEN_A);
        assertThat(p.pairAddress()).isEqualTo(PAIR_A);
        assertThat(p.initialBaseValue()).isEqualByComparingTo("0.01");
        assertThat(p.timestamp()).isEqualTo(clock.millis());
    }

    @Test
    @DisplayName("second entry for the same token merges in place")
    void mergesSameToken() {
        ledger.recordEntry(TOKEN_A, PAIR_A, new BigDecimal("0.01"), new BigDecimal("100"));
        ledger.recordEntry(TOKEN_B, null, new BigDecimal("0.02"), new BigDecimal("50"));
        clock.advance(Duration.ofMinutes(1));

        int index = ledger.recordEntry(TOKEN_A.toLowerCase(), PAIR_A, new BigDecimal("0.03"), new BigDecimal("200"));

        assertThat(index).isZero();
        assertThat(ledger.list()).hasSize(2);
        Position merged = ledger.list().get(0);
        assertThat(merged.initialBaseValue()).isEqualByComparingTo("0.04");
        assertThat(merged.initialMarketCap()).isEqualByComparingTo("175");
        assertThat(merged.timestamp()).isEqualTo(clock.millis());
    }

    @Test
    void rejectsNonPositiveEntry() {
        assertThatThrownBy(() -> ledger.recordEntry(TOKEN_A, PAIR_A, BigDecimal.ZERO, BigDecimal.ONE))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ledger.recordEntry("0x123", PAIR_A, BigDecimal.ONE, BigDecimal.ONE))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(store.saves).isZero();
    }

    @Test
    @DisplayName("full exit removes the position, partial exit keeps it untouched")
    void exits() {
        ledger.recordEntry(TOKEN_A, PAIR_A, new BigDecimal("0.01"), new BigDecimal("100"));
        ledger.recordEntry(TOKEN_B, null, new BigDecimal("0.02"), new BigDecimal("50"));
        int savesBefore = store.saves;

        assertThat(ledger.recordExit(TOKEN_A, 5_000)).isFalse();
        assertThat(store.saves).isEqualTo(savesBefore);
        assertThat(ledger.list()).hasSize(2);

        assertThat(ledger.recordExit(TOKEN_A, PositionLedger.FULL_EXIT_BPS)).isTrue();
        assertThat(ledger.list()).extracting(Position::tokenAddress).containsExactly(TOKEN_B);
        assertThat(ledger.indexOf(TOKEN_B)).isZero();
    }

    @Test
    void exitOfUnknownTokenIsANoOp() {
        assertThat(ledger.recordExit(TOKEN_A, PositionLedger.FULL_EXIT_BPS)).isFalse();
        assertThat(store.saves).isZero();
        assertThatThrownBy(() -> ledger.recordExit(TOKEN_A, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void findAndIndexOf() {
        ledger.recordEntry(TOKEN_A, PAIR_A, new BigDecimal("0.01"), new BigDecimal("100"));

        assertThat(ledger.find(0)).isPresent();
        assertThat(ledger.find(1)).isEmpty();
        assertThat(ledger.find(-1)).isEmpty();
        assertThat(ledger.indexOf(TOKEN_B)).isEqualTo(-1);
        assertThat(ledger.indexOf("garbage")).isEqualTo(-1);
    }

    @Test
    @DisplayName("navigation wraps around both ends")
    void wrapIndex() {
        assertThat(PositionLedger.wrapIndex(-1, 3)).isEqualTo(2);
        assertThat(PositionLedger.wrapIndex(3, 3)).isZero();
        assertThat(PositionLedger.wrapIndex(7, 3)).isEqualTo(1);
        assertThatThrownBy(() -> PositionLedger.wrapIndex(0, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void storeFailurePropagates() {
        store.failWrites = true;

        assertThatThrownBy(() -> ledger.recordEntry(TOKEN_A, PAIR_A, BigDecimal.ONE, BigDecimal.ONE))
                .isInstanceOf(LedgerPersistenceException.class);
    }

    private static class InMemoryStore implements PositionStore {

        private List<Position> positions = List.of();
        private int saves;
        private boolean failWrites;

        @Override
        public List<Position> load() {
            return positions;
        }

        @Override
        public void save(List<Position> positions) {
            if (failWrites) {
                throw new LedgerPersistenceException("disk full", null);
            }
            this.positions = List.copyOf(new ArrayList<>(positions));
            saves++;
        }
    }
}
