package com.lpzapper.market;

import com.lpzapper.chain.ChainGateway;
import com.lpzapper.chain.PairReserves;
import com.lpzapper.common.EthUnits;
import com.lpzapper.market.config.MarketProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Token/WETH pair lookup and pool-derived price and market cap.
 */
@Component
@RequiredArgsConstructor
public class PairInfoService {

    private final ChainGateway chainGateway;
    private final TokenMetaResolver tokenMetaResolver;
    private final MarketProperties marketProperties;

    public Optional<String> findPair(String tokenAddress) {
        return chainGateway.getPair(marketProperties.getFactoryAddress(), marketProperties.getWethAddress(), tokenAddress);
    }

    /**
     * @throws PairNotFoundException when the token has no WETH pair
     */
    public PairInfo getPairInfo(String tokenAddress) {
        String pair = findPair(tokenAddress).orElseThrow(() -> new PairNotFoundException(tokenAddress));
        return getPairInfo(tokenAddress, pair);
    }

    public PairInfo getPairInfo(String tokenAddress, String pairAddress) {
        PairReserves reserves = chainGateway.getReserves(pairAddress, marketProperties.getWethAddress());
        if (reserves.isEmpty()) {
            return new PairInfo(reserves.pairAddress(), BigDecimal.ZERO, BigDecimal.ZERO, reserves);
        }
        BigInteger totalSupply = chainGateway.getTotalSupply(tokenAddress);
        int decimals = tokenMetaResolver.getTokenMeta(tokenAddress).decimals();
        return new PairInfo(reserves.pairAddress(), priceEth(reserves, decimals), marketCapEth(reserves, totalSupply), reserves);
    }

    static BigDecimal marketCapEth(PairReserves reserves, BigInteger tokenTotalSupply) {
        if (reserves.isEmpty()) {
            return BigDecimal.ZERO;
        }
        BigInteger capWei = reserves.reserveBase().multiply(tokenTotalSupply).divide(reserves.reserveToken());
        return EthUnits.weiToEth(capWei);
    }

    static BigDecimal priceEth(PairReserves reserves, int decimals) {
        if (reserves.isEmpty()) {
            return BigDecimal.ZERO;
        }
        BigDecimal oneToken = BigDecimal.TEN.pow(decimals);
        return new BigDecimal(reserves.reserveBase())
                .multiply(oneToken)
                .divide(new BigDecimal(reserves.reserveToken()), 0, RoundingMode.DOWN)
                .divide(EthUnits.WEI_PER_ETH, EthUnits.SCALE, RoundingMode.HALF_UP);
    }
}
