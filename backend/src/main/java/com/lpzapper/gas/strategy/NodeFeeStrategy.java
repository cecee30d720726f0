package com.lpzapper.gas.strategy;

import com.lpzapper.chain.ChainGateway;
import com.lpzapper.chain.FeeSuggestion;
import com.lpzapper.common.EthUnits;
import com.lpzapper.gas.GasQuote;
import com.lpzapper.gas.GasQuoteResult;
import com.lpzapper.gas.GasQuoteSource;
import com.lpzapper.gas.GasQuoteStrategy;
import com.lpzapper.gas.config.GasProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Second tier: fee data from the execution node. EIP-1559 nodes give
 * {@code maxFee = 2 × baseFee + priority}; older nodes give a single gas price.
 */
@Component
@Order(2)
@RequiredArgsConstructor
public class NodeFeeStrategy implements GasQuoteStrategy {

    private static final BigInteger TWO = BigInteger.valueOf(2);

    private final ChainGateway chainGateway;
    private final GasProperties gasProperties;

    @Override
    public GasQuoteSource source() {
        return GasQuoteSource.NODE_FALLBACK;
    }

    @Override
    public GasQuoteResult attempt() {
        FeeSuggestion fees;
        try {
            fees = chainGateway.getFeeSuggestion();
        } catch (RuntimeException e) {
            return GasQuoteResult.failure("node fee data unavailable: " + e.getMessage(), e);
        }
        BigInteger minPriority = EthUnits.gweiToWei(gasProperties.getMinPriorityFeeGwei());
        BigInteger ceiling = EthUnits.gweiToWei(gasProperties.getCeilingGwei());
        if (fees.supportsEip1559()) {
            BigInteger priority = fees.priorityFee().max(minPriority);
            BigInteger maxFee = fees.baseFee().multiply(TWO).add(priority);
            return GasQuoteResult.success(GasQuote.capped(fees.baseFee(), priority, maxFee, ceiling,
                    gasProperties.getSpeedTier(), GasQuoteSource.NODE_FALLBACK));
        }
        if (fees.gasPrice() == null || fees.gasPrice().signum() <= 0) {
            return GasQuoteResult.failure("node returned no gas price", null);
        }
        // Legacy price: the whole price is paid as tip
        BigInteger gasPrice = fees.gasPrice().max(minPriority);
        return GasQuoteResult.success(GasQuote.capped(BigInteger.ZERO, gasPrice, gasPrice, ceiling,
                gasProperties.getSpeedTier(), GasQuoteSource.NODE_FALLBACK));
    }
}
