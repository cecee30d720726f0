package com.lpzapper.zap;

import com.lpzapper.chain.TokenMeta;
import com.lpzapper.gas.GasQuote;
import com.lpzapper.market.PairInfo;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

/**
 * What the user sees after entering a token: pool state, current gas, a rough fee, and suggested amounts.
 */
public record ZapInPreview(
        String tokenAddress,
        TokenMeta token,
        PairInfo pair,
        BigDecimal ethUsd,
        GasQuote gasQuote,
        BigInteger estimatedGasLimit,
        BigDecimal estimatedFeeEth,
        BigDecimal estimatedFeeUsd,
        List<BigDecimal> presetAmountsEth
) {
}
