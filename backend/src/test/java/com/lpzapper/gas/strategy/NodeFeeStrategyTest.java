package com.lpzapper.gas.strategy;

import com.lpzapper.chain.ChainGateway;
import com.lpzapper.chain.FeeSuggestion;
import com.lpzapper.chain.RpcException;
import com.lpzapper.gas.GasQuote;
import com.lpzapper.gas.GasQuoteSource;
import com.lpzapper.gas.config.GasProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class NodeFeeStrategyTest {

    private static final BigInteger GWEI = BigInteger.TEN.pow(9);

    private ChainGateway chainGateway;
    private NodeFeeStrategy strategy;

    @BeforeEach
    void setUp() {
        chainGateway = mock(ChainGateway.class);
        strategy = new NodeFeeStrategy(chainGateway, new GasProperties());
    }

    @Test
    void eip1559MaxFeeIsTwiceBasePlusTip() {
        when(chainGateway.getFeeSuggestion()).thenReturn(new FeeSuggestion(
                GWEI.multiply(BigInteger.valueOf(20)), GWEI.multiply(BigInteger.TWO), GWEI.multiply(BigInteger.valueOf(22))));

        GasQuote quote = strategy.attempt().orElseThrow();

        assertThat(quote.source()).isEqualTo(GasQuoteSource.NODE_FALLBACK);
        assertThat(quote.maxFee()).isEqualTo(GWEI.multiply(BigInteger.valueOf(42)));
        assertThat(quote.priorityFee()).isEqualTo(GWEI.multiply(BigInteger.TWO));
    }

    @Test
    void legacyNodePaysWholePriceAsTip() {
        when(chainGateway.getFeeSuggestion()).thenReturn(new FeeSuggestion(null, null, GWEI.multiply(BigInteger.valueOf(15))));

        GasQuote quote = strategy.attempt().orElseThrow();

        assertThat(quote.baseFee()).isZero();
        assertThat(quote.priorityFee()).isEqualTo(quote.maxFee()).isEqualTo(GWEI.multiply(BigInteger.valueOf(15)));
    }

    @Test
    void nodeErrorIsReportedAsFailure() {
        when(chainGateway.getFeeSuggestion()).thenThrow(new RpcException("all endpoints down"));

        assertThat(strategy.attempt().isSuccess()).isFalse();
        assertThat(strategy.attempt().getReason()).contains("all endpoints down");
    }
}
