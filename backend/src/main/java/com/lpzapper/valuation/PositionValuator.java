package com.lpzapper.valuation;

import com.lpzapper.chain.ChainGateway;
import com.lpzapper.chain.PairReserves;
import com.lpzapper.chain.TokenMeta;
import com.lpzapper.common.EthUnits;
import com.lpzapper.gas.GasPriceResolver;
import com.lpzapper.gas.GasQuote;
import com.lpzapper.ledger.Position;
import com.lpzapper.market.EthUsdPriceResolver;
import com.lpzapper.market.PairInfo;
import com.lpzapper.market.PairInfoService;
import com.lpzapper.market.PairNotFoundException;
import com.lpzapper.market.TokenMetaResolver;
import com.lpzapper.zap.config.ZapProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * Computes {@link PositionView} from the pool, the account's LP balance, ETH/USD and the current gas quote.
 * Position value is {@code 2 × reserveWETH × lp / lpSupply}, i.e. both sides valued in ETH at pool price.
 */
@Component
@RequiredArgsConstructor
public class PositionValuator {

    private static final int PCT_SCALE = 4;
    private static final int USD_SCALE = 2;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final ChainGateway chainGateway;
    private final PairInfoService pairInfoService;
    private final TokenMetaResolver tokenMetaResolver;
    private final EthUsdPriceResolver ethUsdPriceResolver;
    private final GasPriceResolver gasPriceResolver;
    private final ZapProperties zapProperties;

    public PositionView value(Position position, int index, int total) {
        String token = position.tokenAddress();
        String pair = position.pairAddress() != null
                ? position.pairAddress()
                : pairInfoService.findPair(token).orElseThrow(() -> new PairNotFoundException(token));
        PairInfo info = pairInfoService.getPairInfo(token, pair);
        PairReserves reserves = info.reserves();
        TokenMeta meta = tokenMetaResolver.getTokenMeta(token);
        BigInteger lp = chainGateway.getTokenBalance(pair, chainGateway.accountAddress());
        BigDecimal ethUsd = ethUsdPriceResolver.getEthUsd();

        BigDecimal sharePct = BigDecimal.ZERO;
        BigDecimal valueEth = BigDecimal.ZERO;
        if (reserves.lpTotalSupply().signum() > 0) {
            sharePct = new BigDecimal(lp).multiply(HUNDRED)
                    .divide(new BigDecimal(reserves.lpTotalSupply()), PCT_SCALE, RoundingMode.HALF_UP);
            BigInteger valueWei = reserves.reserveBase().multiply(BigInteger.TWO).multiply(lp).divide(reserves.lpTotalSupply());
            valueEth = EthUnits.weiToEth(valueWei);
        }

        GasQuote gas = gasPriceResolver.resolve();
        BigDecimal feeEth = EthUnits.weiToEth(gas.feeFor(BigInteger.valueOf(zapProperties.getZapOutGasEstimate())));

        return new PositionView(
                index,
                total,
                token,
                pair,
                meta.name(),
                meta.symbol(),
                EthUnits.weiToEth(lp),
                sharePct,
                valueEth,
                usd(valueEth, ethUsd),
                position.initialBaseValue(),
                position.initialMarketCap(),
                usd(position.initialMarketCap(), ethUsd),
                info.marketCapEth(),
                usd(info.marketCapEth(), ethUsd),
                pnlPct(position.initialMarketCap(), info.marketCapEth()),
                EthUnits.weiToGwei(gas.maxFee()),
                feeEth,
                feeEth.multiply(ethUsd).setScale(4, RoundingMode.HALF_UP));
    }

    /** Market-cap change since entry in percent; zero when the entry cap is unknown. */
    static BigDecimal pnlPct(BigDecimal initialCap, BigDecimal currentCap) {
        if (initialCap == null || initialCap.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return currentCap.subtract(initialCap).multiply(HUNDRED).divide(initialCap, PCT_SCALE, RoundingMode.HALF_UP);
    }

    private static BigDecimal usd(BigDecimal eth, BigDecimal ethUsd) {
        return eth.multiply(ethUsd).setScale(USD_SCALE, RoundingMode.HALF_UP);
    }
}
