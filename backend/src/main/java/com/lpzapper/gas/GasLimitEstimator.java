package com.lpzapper.gas;

import com.lpzapper.chain.ChainGateway;
import com.lpzapper.common.cache.TtlCache;
import com.lpzapper.gas.config.GasProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Duration;

/**
 * Gas limit for an exact call: eth_estimateGas times the configured safety factor, rounded up.
 * Cached per (to, value, calldata) for the quote TTL. A revert surfaces as the gateway's
 * {@link com.lpzapper.chain.JsonRpcErrorException} carrying the node's reason, even when an earlier estimate of the
 * same call is cached.
 */
@Component
@RequiredArgsConstructor
public class GasLimitEstimator {

    private final ChainGateway chainGateway;
    private final TtlCache ttlCache;
    private final GasProperties gasProperties;

    public BigInteger estimate(String to, BigInteger value, String data) {
        String key = "gas-limit:" + to.toLowerCase() + ":" + value + ":" + data;
        BigInteger raw = ttlCache.getOrFetch(key, Duration.ofMillis(gasProperties.getQuoteTtlMs()),
                () -> chainGateway.estimateGas(chainGateway.accountAddress(), to, value, data), false);
        return applySafetyFactor(raw, gasProperties.getGasLimitMultiplier());
    }

    static BigInteger applySafetyFactor(BigInteger estimate, BigDecimal multiplier) {
        return new BigDecimal(estimate).multiply(multiplier).setScale(0, RoundingMode.CEILING).toBigIntegerExact();
    }
}
