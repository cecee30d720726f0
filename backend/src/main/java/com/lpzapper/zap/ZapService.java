package com.lpzapper.zap;

import com.lpzapper.balance.BalanceCheck;
import com.lpzapper.balance.BalanceValidator;
import com.lpzapper.chain.ChainGateway;
import com.lpzapper.chain.JsonRpcErrorException;
import com.lpzapper.chain.PairReserves;
import com.lpzapper.chain.RpcException;
import com.lpzapper.chain.TransactionRequest;
import com.lpzapper.chain.TxReceipt;
import com.lpzapper.chain.config.ChainProperties;
import com.lpzapper.common.Addresses;
import com.lpzapper.common.EthUnits;
import com.lpzapper.gas.GasLimitEstimator;
import com.lpzapper.gas.GasPriceResolver;
import com.lpzapper.gas.GasQuote;
import com.lpzapper.ledger.LedgerPersistenceException;
import com.lpzapper.ledger.Position;
import com.lpzapper.ledger.PositionLedger;
import com.lpzapper.market.EthUsdPriceResolver;
import com.lpzapper.market.PairInfo;
import com.lpzapper.market.PairInfoService;
import com.lpzapper.market.PairNotFoundException;
import com.lpzapper.market.TokenMetaResolver;
import com.lpzapper.market.config.MarketProperties;
import com.lpzapper.slippage.SlippageEngine;
import com.lpzapper.slippage.SlippagePolicy;
import com.lpzapper.zap.config.ZapProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Zap-in and zap-out orchestration: reserves → slippage bounds → gas quote → gas limit → balance check →
 * sign and submit → confirmation → ledger. Nothing is written to the ledger unless the zap transaction
 * was mined successfully.
 * <p>
 * {@link #zapIn} and {@link #zapOut} block on confirmation and must run on the command executor.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ZapService {

    private static final BigInteger TWO = BigInteger.valueOf(2);
    private static final BigInteger HUNDRED = BigInteger.valueOf(100);

    private final ChainGateway chainGateway;
    private final PairInfoService pairInfoService;
    private final TokenMetaResolver tokenMetaResolver;
    private final EthUsdPriceResolver ethUsdPriceResolver;
    private final SlippageEngine slippageEngine;
    private final GasPriceResolver gasPriceResolver;
    private final GasLimitEstimator gasLimitEstimator;
    private final BalanceValidator balanceValidator;
    private final PositionLedger positionLedger;
    private final ZapProperties zapProperties;
    private final MarketProperties marketProperties;
    private final ChainProperties chainProperties;
    private final Clock clock;

    public ZapInPreview previewZapIn(String tokenAddress) {
        String token = Addresses.checksum(tokenAddress);
        PairInfo pair = pairInfo(token);
        GasQuote quote = gasPriceResolver.resolve();
        BigDecimal ethUsd = ethUsdPriceResolver.getEthUsd();
        BigInteger gasLimit = BigInteger.valueOf(zapProperties.getZapInGasEstimate());
        BigDecimal feeEth = EthUnits.weiToEth(quote.feeFor(gasLimit));
        return new ZapInPreview(token, tokenMetaResolver.getTokenMeta(token), pair, ethUsd, quote, gasLimit,
                feeEth, feeEth.multiply(ethUsd), List.copyOf(zapProperties.getPresetAmountsEth()));
    }

    /**
     * Prepares a zap-in of {@code amountEth}: half the ETH is swapped for the token, so bounds and tolerance are
     * computed for a swap of {@code amount / 2}.
     *
     * @throws com.lpzapper.balance.InsufficientFundsException when the account cannot pay amount plus fee
     * @throws ZapExecutionException when there is no pair or the call would revert
     */
    public ZapInQuote quoteZapIn(String tokenAddress, BigDecimal amountEth) {
        if (amountEth == null || amountEth.signum() <= 0) {
            throw new IllegalArgumentException("amountEth must be positive");
        }
        String token = Addresses.checksum(tokenAddress);
        BigInteger amountWei = EthUnits.ethToWei(amountEth);
        if (amountWei.signum() <= 0) {
            throw new IllegalArgumentException("amountEth is below 1 wei");
        }
        PairInfo pair = pairInfo(token);
        PairReserves reserves = pair.reserves();
        if (reserves.isEmpty()) {
            throw new ZapExecutionException("Pool " + pair.pairAddress() + " has no liquidity");
        }

        BigInteger half = amountWei.divide(TWO);
        SlippagePolicy slippage = slippageEngine.evaluate(half, reserves.reserveBase(), reserves.reserveToken());
        BigInteger projectedTokenOut = SlippageEngine.computeAmountOut(half, reserves.reserveBase(), reserves.reserveToken());
        BigInteger amountBMin = SlippageEngine.minAmountOut(projectedTokenOut, slippage.toleranceBps());
        BigInteger amountAMin = SlippageEngine.minAmountOut(half, slippage.toleranceBps());
        long deadline = deadline();
        String account = chainGateway.accountAddress();
        String calldata = ZapperCalls.zapInEth(token, amountAMin, amountBMin, account, deadline, slippage.toleranceBps());

        GasQuote gasQuote = gasPriceResolver.resolve();
        BigInteger gasLimit = estimateGas(zapProperties.getZapperAddress(), amountWei, calldata);
        BalanceCheck balance = balanceValidator.check(amountWei, gasLimit, gasQuote);

        BigDecimal feeEth = EthUnits.weiToEth(balance.estimatedFee());
        BigDecimal feeUsd = feeEth.multiply(ethUsdPriceResolver.getEthUsd());
        log.info("Zap-in quote {} ETH into {}: tolerance {} bps (impact {}%), amountAMin {}, amountBMin {}, gasLimit {}",
                amountEth.toPlainString(), token, slippage.toleranceBps(), slippage.priceImpactPct().toPlainString(),
                amountAMin, amountBMin, gasLimit);
        return new ZapInQuote(token, pair.pairAddress(), amountEth, amountWei, slippage, amountAMin, amountBMin,
                deadline, calldata, gasLimit, gasQuote, balance, feeEth, feeUsd, pair.marketCapEth());
    }

    /**
     * Quotes, submits and confirms a zap-in, then records the entry in the ledger.
     */
    public ZapResult zapIn(String tokenAddress, BigDecimal amountEth) {
        ZapInQuote quote = quoteZapIn(tokenAddress, amountEth);
        TxReceipt receipt = submitAndConfirm(new TransactionRequest(
                zapProperties.getZapperAddress(),
                quote.amountWei(),
                quote.calldata(),
                quote.gasLimit(),
                quote.gasQuote().priorityFee(),
                quote.gasQuote().maxFee()), "zap-in");

        BigDecimal marketCap = entryMarketCap(quote);
        int index;
        try {
            index = positionLedger.recordEntry(quote.tokenAddress(), quote.pairAddress(), amountEth, marketCap);
        } catch (LedgerPersistenceException e) {
            log.error("Zap-in {} confirmed but the ledger write failed for {}", receipt.txHash(), quote.tokenAddress(), e);
            throw e;
        }
        log.info("Zap-in {} confirmed: {} ETH into {}, position #{}",
                receipt.txHash(), amountEth.toPlainString(), quote.tokenAddress(), index);
        return new ZapResult(receipt.txHash(), quote.tokenAddress(), amountEth, marketCap, index,
                receipt.blockNumber(), receipt.gasUsed());
    }

    /**
     * Removes {@code percent}% of the LP tokens held for the position at {@code positionIndex} back to ETH.
     * The zapper is approved for exactly the liquidity being removed.
     */
    public ZapOutResult zapOut(int positionIndex, int percent) {
        if (percent < 1 || percent > 100) {
            throw new IllegalArgumentException("percent must be between 1 and 100");
        }
        Position position = positionLedger.find(positionIndex)
                .orElseThrow(() -> new ZapExecutionException("Position not found. It may have been removed."));
        String token = position.tokenAddress();
        String pairAddress = position.pairAddress();
        if (pairAddress == null) {
            pairAddress = pairInfoService.findPair(token).orElseThrow(() -> new ZapExecutionException("No WETH pair found for token " + token));
        }
        String account = chainGateway.accountAddress();
        BigInteger lpBalance = chainGateway.getTokenBalance(pairAddress, account);
        if (lpBalance.signum() == 0) {
            throw new ZapExecutionException("You have no LP tokens to zap out.");
        }
        BigInteger liquidity = lpBalance.multiply(BigInteger.valueOf(percent)).divide(HUNDRED);
        if (liquidity.signum() == 0) {
            throw new ZapExecutionException("LP balance too small to remove " + percent + "%");
        }

        String approveData = ZapperCalls.approve(zapProperties.getZapperAddress(), liquidity);
        GasQuote approveGas = gasPriceResolver.resolve();
        BigInteger approveLimit = estimateGas(pairAddress, BigInteger.ZERO, approveData);
        balanceValidator.check(BigInteger.ZERO, approveLimit, approveGas);
        log.info("Approving {} LP tokens of {} for the zapper", liquidity, pairAddress);
        TxReceipt approveReceipt = submitAndConfirm(new TransactionRequest(pairAddress, BigInteger.ZERO, approveData,
                approveLimit, approveGas.priorityFee(), approveGas.maxFee()), "approve");

        PairReserves reserves = chainGateway.getReserves(pairAddress, marketProperties.getWethAddress());
        ZapOutBounds bounds = ZapOutBounds.of(reserves, liquidity, slippageEngine);
        long deadline = deadline();
        String weth = marketProperties.getWethAddress();
        String calldata = ZapperCalls.zapOut(weth, token, liquidity, weth, bounds.amountOutMin(), bounds.amountAMin(),
                bounds.amountBMin(), account, deadline, bounds.toleranceBps());

        GasQuote gasQuote = gasPriceResolver.resolve();
        BigInteger gasLimit = estimateGas(zapProperties.getZapperAddress(), BigInteger.ZERO, calldata);
        balanceValidator.check(BigInteger.ZERO, gasLimit, gasQuote);
        log.info("Zap-out {}% of {}: liquidity {}, tolerance {} bps, amountOutMin {}", percent, token, liquidity,
                bounds.toleranceBps(), bounds.amountOutMin());
        TxReceipt receipt = submitAndConfirm(new TransactionRequest(zapProperties.getZapperAddress(), BigInteger.ZERO,
                calldata, gasLimit, gasQuote.priorityFee(), gasQuote.maxFee()), "zap-out");

        boolean closed;
        try {
            closed = positionLedger.recordExit(token, percent * 100);
        } catch (LedgerPersistenceException e) {
            log.error("Zap-out {} confirmed but the ledger write failed for {}", receipt.txHash(), token, e);
            throw e;
        }
        log.info("Zap-out {} confirmed: {}% of {}{}", receipt.txHash(), percent, token, closed ? ", position closed" : "");
        return new ZapOutResult(receipt.txHash(), approveReceipt.txHash(), token, percent, liquidity, closed,
                receipt.blockNumber(), receipt.gasUsed());
    }

    private PairInfo pairInfo(String token) {
        try {
            return pairInfoService.getPairInfo(token);
        } catch (PairNotFoundException e) {
            throw new ZapExecutionException(e.getMessage(), null, e);
        }
    }

    private BigInteger estimateGas(String to, BigInteger value, String calldata) {
        try {
            return gasLimitEstimator.estimate(to, value, calldata);
        } catch (JsonRpcErrorException e) {
            throw new ZapExecutionException("Transaction would fail: " + e.getRpcMessage(), null, e);
        }
    }

    private TxReceipt submitAndConfirm(TransactionRequest request, String label) {
        String txHash;
        try {
            txHash = chainGateway.submitTransaction(request);
        } catch (JsonRpcErrorException e) {
            throw new ZapExecutionException(label + " rejected by node: " + e.getRpcMessage(), null, e);
        } catch (IllegalStateException e) {
            throw new ZapExecutionException(label + " not sent: " + e.getMessage(), null, e);
        }
        TxReceipt receipt;
        try {
            receipt = chainGateway.waitForConfirmation(txHash, Duration.ofSeconds(chainProperties.getConfirmationTimeoutSeconds()));
        } catch (RpcException e) {
            log.error("{} {} not confirmed: {}", label, txHash, e.getMessage());
            throw new ZapExecutionException(label + " transaction " + txHash + " was not confirmed: " + e.getMessage(), txHash, e);
        }
        if (!receipt.success()) {
            log.error("{} {} reverted in block {}", label, txHash, receipt.blockNumber());
            throw new ZapExecutionException(label + " transaction " + txHash + " reverted", txHash, null);
        }
        return receipt;
    }

    private BigDecimal entryMarketCap(ZapInQuote quote) {
        try {
            return pairInfoService.getPairInfo(quote.tokenAddress(), quote.pairAddress()).marketCapEth();
        } catch (RpcException e) {
            log.warn("Could not re-read pool after zap-in, using quoted market cap: {}", e.getMessage());
            return quote.marketCapEth();
        }
    }

    private long deadline() {
        return clock.instant().getEpochSecond() + zapProperties.getDeadlineMinutes() * 60L;
    }
}
