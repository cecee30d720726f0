package com.lpzapper.chain;

import java.math.BigInteger;
import java.time.Duration;
import java.util.Optional;

/**
 * Capability interface over the execution node: reads keyed by address, plus transaction submission
 * for the custodial account.
 */
public interface ChainGateway {

    /** Checksummed address of the custodial account. */
    String accountAddress();

    /** Native balance in wei. */
    BigInteger getBalance(String address);

    /**
     * Pair address from a Uniswap V2 factory, or empty when the pair does not exist.
     */
    Optional<String> getPair(String factoryAddress, String tokenA, String tokenB);

    /**
     * Reserves of {@code pairAddress} oriented so that the {@code baseToken} side comes first.
     */
    PairReserves getReserves(String pairAddress, String baseToken);

    BigInteger getTotalSupply(String tokenAddress);

    BigInteger getTokenBalance(String tokenAddress, String owner);

    TokenMeta getTokenMeta(String tokenAddress);

    FeeSuggestion getFeeSuggestion();

    /**
     * eth_estimateGas for the exact call. A revert surfaces as {@link JsonRpcErrorException}.
     */
    BigInteger estimateGas(String from, String to, BigInteger value, String data);

    /**
     * Signs and broadcasts the transaction from the custodial account.
     *
     * @return transaction hash
     */
    String submitTransaction(TransactionRequest request);

    /**
     * Polls for the receipt until it appears or {@code timeout} elapses (then throws {@link RpcException}).
     */
    TxReceipt waitForConfirmation(String txHash, Duration timeout);
}
