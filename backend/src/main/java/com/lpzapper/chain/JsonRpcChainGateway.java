package com.lpzapper.chain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lpzapper.chain.config.ChainProperties;
import com.lpzapper.common.Addresses;
import com.lpzapper.common.EthUnits;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;

import java.math.BigInteger;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link ChainGateway} over plain JSON-RPC: round-robin endpoints with exponential backoff between attempts
 * and a shared request budget. JSON-RPC {@code error} answers are returned to the caller immediately since
 * another endpoint would give the same answer. Raw transactions are broadcast exactly once.
 */
@Slf4j
@Component
public class JsonRpcChainGateway implements ChainGateway {

    private final EvmRpcClient rpcClient;
    private final RpcEndpointRotator rotator;
    private final RateLimiter evmRpcRateLimiter;
    private final ObjectMapper objectMapper;
    private final TransactionSigner signer;
    private final ChainProperties properties;

    private volatile Long chainId;

    public JsonRpcChainGateway(
            EvmRpcClient rpcClient,
            RpcEndpointRotator rotator,
            @Qualifier("evmRpcRateLimiter") RateLimiter evmRpcRateLimiter,
            ObjectMapper objectMapper,
            TransactionSigner signer,
            ChainProperties properties
    ) {
        this.rpcClient = rpcClient;
        this.rotator = rotator;
        this.evmRpcRateLimiter = evmRpcRateLimiter;
        this.objectMapper = objectMapper;
        this.signer = signer;
        this.properties = properties;
        this.chainId = properties.getChainId();
    }

    @Override
    public String accountAddress() {
        return signer.address();
    }

    @Override
    public BigInteger getBalance(String address) {
        JsonNode result = callWithRetry("eth_getBalance", List.of(address, "latest"));
        return EthUnits.hexToBigInteger(result.asText(null));
    }

    @Override
    public Optional<String> getPair(String factoryAddress, String tokenA, String tokenB) {
        List<Type> out = ethCall(factoryAddress, ContractCalls.getPair(tokenA, tokenB));
        String pair = out.get(0).toString();
        if (Addresses.isZero(pair)) {
            return Optional.empty();
        }
        return Optional.of(Addresses.checksum(pair));
    }

    @Override
    public PairReserves getReserves(String pairAddress, String baseToken) {
        String token0 = ethCall(pairAddress, ContractCalls.token0()).get(0).toString();
        List<Type> reserves = ethCall(pairAddress, ContractCalls.getReserves());
        BigInteger reserve0 = (BigInteger) reserves.get(0).getValue();
        BigInteger reserve1 = (BigInteger) reserves.get(1).getValue();
        BigInteger lpSupply = (BigInteger) ethCall(pairAddress, ContractCalls.totalSupply()).get(0).getValue();
        boolean baseIsToken0 = Addresses.same(token0, baseToken);
        return new PairReserves(
                Addresses.checksum(pairAddress),
                baseIsToken0 ? reserve0 : reserve1,
                baseIsToken0 ? reserve1 : reserve0,
                lpSupply);
    }

    @Override
    public BigInteger getTotalSupply(String tokenAddress) {
        return (BigInteger) ethCall(tokenAddress, ContractCalls.totalSupply()).get(0).getValue();
    }

    @Override
    public BigInteger getTokenBalance(String tokenAddress, String owner) {
        return (BigInteger) ethCall(tokenAddress, ContractCalls.balanceOf(owner)).get(0).getValue();
    }

    @Override
    public TokenMeta getTokenMeta(String tokenAddress) {
        String name = (String) ethCall(tokenAddress, ContractCalls.name()).get(0).getValue();
        String symbol = (String) ethCall(tokenAddress, ContractCalls.symbol()).get(0).getValue();
        int decimals = ((BigInteger) ethCall(tokenAddress, ContractCalls.decimals()).get(0).getValue()).intValue();
        return new TokenMeta(name, symbol, decimals);
    }

    @Override
    public FeeSuggestion getFeeSuggestion() {
        BigInteger gasPrice = EthUnits.hexToBigInteger(callWithRetry("eth_gasPrice", List.of()).asText(null));
        JsonNode block = callWithRetry("eth_getBlockByNumber", List.of("latest", false));
        String baseFeeHex = block.path("baseFeePerGas").asText(null);
        if (baseFeeHex == null) {
            return new FeeSuggestion(null, null, gasPrice);
        }
        BigInteger priority;
        try {
            priority = EthUnits.hexToBigInteger(callWithRetry("eth_maxPriorityFeePerGas", List.of()).asText(null));
        } catch (JsonRpcErrorException e) {
            log.debug("eth_maxPriorityFeePerGas unsupported, using gasPrice - baseFee: {}", e.getRpcMessage());
            priority = gasPrice.subtract(EthUnits.hexToBigInteger(baseFeeHex)).max(BigInteger.ZERO);
        }
        return new FeeSuggestion(EthUnits.hexToBigInteger(baseFeeHex), priority, gasPrice);
    }

    @Override
    public BigInteger estimateGas(String from, String to, BigInteger value, String data) {
        Map<String, Object> tx = new LinkedHashMap<>();
        tx.put("from", from);
        tx.put("to", to);
        tx.put("value", EthUnits.toHexQuantity(value));
        tx.put("data", data);
        return EthUnits.hexToBigInteger(callWithRetry("eth_estimateGas", List.of(tx)).asText(null));
    }

    @Override
    public String submitTransaction(TransactionRequest request) {
        if (!signer.canSign()) {
            throw new IllegalStateException("Cannot submit transaction: no private key configured");
        }
        BigInteger nonce = EthUnits.hexToBigInteger(
                callWithRetry("eth_getTransactionCount", List.of(signer.address(), "pending")).asText(null));
        String signed = signer.sign(resolveChainId(), nonce, request);
        String endpoint = rotator.getNextEndpoint();
        String txHash = callOnce(endpoint, "eth_sendRawTransaction", List.of(signed)).asText(null);
        if (txHash == null || txHash.isBlank()) {
            throw new RpcException("eth_sendRawTransaction returned no hash");
        }
        log.info("Submitted tx {} to {} (nonce {}, gasLimit {})", txHash, request.to(), nonce, request.gasLimit());
        return txHash;
    }

    @Override
    public TxReceipt waitForConfirmation(String txHash, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        long pollMs = Math.max(1L, properties.getReceiptPollIntervalMs());
        while (true) {
            try {
                JsonNode receipt = callWithRetry("eth_getTransactionReceipt", List.of(txHash));
                if (receipt != null && !receipt.isNull() && !receipt.isMissingNode()) {
                    return toReceipt(txHash, receipt);
                }
            } catch (JsonRpcErrorException e) {
                throw e;
            } catch (RpcException e) {
                log.warn("Receipt poll for {} failed, will retry: {}", txHash, e.getMessage());
            }
            if (System.nanoTime() - deadline >= 0) {
                throw new RpcException("No receipt for " + txHash + " after " + timeout.toSeconds() + "s");
            }
            sleep(pollMs);
        }
    }

    private TxReceipt toReceipt(String txHash, JsonNode receipt) {
        return new TxReceipt(
                txHash,
                EthUnits.hexToBigInteger(receipt.path("blockNumber").asText(null)),
                EthUnits.hexToBigInteger(receipt.path("gasUsed").asText(null)),
                EthUnits.hexToBigInteger(receipt.path("effectiveGasPrice").asText(null)),
                "0x1".equals(receipt.path("status").asText(null)));
    }

    private long resolveChainId() {
        Long cached = chainId;
        if (cached != null) {
            return cached;
        }
        long id = EthUnits.hexToBigInteger(callWithRetry("eth_chainId", List.of()).asText(null)).longValueExact();
        chainId = id;
        return id;
    }

    private List<Type> ethCall(String to, Function function) {
        Map<String, Object> call = Map.of("to", to, "data", ContractCalls.encode(function));
        JsonNode result = callWithRetry("eth_call", List.of(call, "latest"));
        return ContractCalls.decode(result.asText(null), function);
    }

    JsonNode callWithRetry(String method, Object params) {
        RpcException lastException = null;
        for (int attempt = 0; attempt < rotator.getMaxAttempts(); attempt++) {
            if (attempt > 0) {
                sleep(rotator.retryDelayMs(attempt - 1));
            }
            String endpoint = rotator.getNextEndpoint();
            try {
                return callOnce(endpoint, method, params);
            } catch (JsonRpcErrorException e) {
                throw e;
            } catch (RpcException e) {
                lastException = e;
                log.warn("{} failed on {} (attempt {}/{}): {}",
                        method, endpoint, attempt + 1, rotator.getMaxAttempts(), e.getMessage());
            }
        }
        String msg = method + " failed after " + rotator.getMaxAttempts() + " attempts";
        if (lastException != null && lastException.getMessage() != null) {
            msg += ": " + lastException.getMessage();
        }
        throw new RpcException(msg, lastException);
    }

    private JsonNode callOnce(String endpoint, String method, Object params) {
        if (!evmRpcRateLimiter.acquirePermission()) {
            throw new RpcException("Local limiter timeout before " + method + " on " + endpoint);
        }
        String json = rpcClient.call(endpoint, method, params).block();
        if (json == null) {
            throw new RpcException(method + " returned an empty body from " + endpoint);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RpcException(method + " returned malformed JSON from " + endpoint, e);
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new JsonRpcErrorException(method, error.path("code").asInt(), error.path("message").asText("unknown error"));
        }
        return root.path("result");
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RpcException("Interrupted while waiting", e);
        }
    }
}
