package com.lpzapper.chain;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lpzapper.chain.config.ChainProperties;
import com.lpzapper.common.RetryPolicy;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint112;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint32;
import reactor.core.publisher.Mono;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JsonRpcChainGatewayTest {

    private static final String WETH = "0xC02aaA39b223FE8D0A0e5C4F27eAD9083C756Cc2";
    private static final String TOKEN = "0x6B175474E89094C44Da98b954EedeAC495271d0F";
    private static final String PAIR = "0xA478c2975Ab1Ea89e8196811F51A7B7Ade33eB11";
    private static final String FACTORY = "0x5C69bEe701ef814a2B6a3EDD4B1652CB9cc5aA6f";
    private static final String ACCOUNT = "0x2c7536E3605D9C16a7a3D7b1898e529396a65c23";

    private FakeNode node;
    private TransactionSigner signer;
    private ChainProperties properties;
    private JsonRpcChainGateway gateway;

    @BeforeEach
    void setUp() {
        node = new FakeNode();
        signer = mock(TransactionSigner.class);
        when(signer.address()).thenReturn(ACCOUNT);
        properties = new ChainProperties();
        properties.setReceiptPollIntervalMs(1);
        properties.setChainId(1L);
        RateLimiter limiter = RateLimiter.of("test", RateLimiterConfig.custom()
                .limitForPeriod(10_000)
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .timeoutDuration(Duration.ZERO)
                .build());
        gateway = new JsonRpcChainGateway(node,
                new RpcEndpointRotator(List.of("https://a", "https://b"), new RetryPolicy(0, 0, 0, 3)),
                limiter, new ObjectMapper(), signer, properties);
    }

    @Test
    @DisplayName("reserves are oriented to the base token whichever side it is")
    void reservesOrientation() {
        node.onCall(ContractCalls.getReserves(), encode(new Uint112(BigInteger.valueOf(5)), new Uint112(BigInteger.valueOf(7)),
                new Uint32(BigInteger.ONE)));
        node.onCall(ContractCalls.totalSupply(), encode(new Uint256(BigInteger.valueOf(100))));

        node.onCall(ContractCalls.token0(), encode(new Address(WETH)));
        PairReserves wethFirst = gateway.getReserves(PAIR, WETH);
        assertThat(wethFirst.reserveBase()).isEqualTo(BigInteger.valueOf(5));
        assertThat(wethFirst.reserveToken()).isEqualTo(BigInteger.valueOf(7));
        assertThat(wethFirst.lpTotalSupply()).isEqualTo(BigInteger.valueOf(100));

        node.onCall(ContractCalls.token0(), encode(new Address(TOKEN)));
        PairReserves wethSecond = gateway.getReserves(PAIR, WETH);
        assertThat(wethSecond.reserveBase()).isEqualTo(BigInteger.valueOf(7));
        assertThat(wethSecond.reserveToken()).isEqualTo(BigInteger.valueOf(5));
    }

    @Test
    void missingPairIsEmpty() {
        node.onCall(ContractCalls.getPair(TOKEN, WETH), encode(new Address("0x0000000000000000000000000000000000000000")));
        assertThat(gateway.getPair(FACTORY, TOKEN, WETH)).isEmpty();

        node.onCall(ContractCalls.getPair(TOKEN, WETH), encode(new Address(PAIR.toLowerCase())));
        assertThat(gateway.getPair(FACTORY, TOKEN, WETH)).contains(PAIR);
    }

    @Test
    @DisplayName("transport failures rotate to the next endpoint")
    void retriesOnNextEndpoint() {
        node.failingEndpoints.add("https://a");
        node.results.put("eth_getBalance", "\"0xde0b6b3a7640000\"");

        assertThat(gateway.getBalance(ACCOUNT)).isEqualTo(BigInteger.TEN.pow(18));
        assertThat(node.endpointsUsed).containsExactly("https://a", "https://b");
    }

    @Test
    void givesUpAfterMaxAttempts() {
        node.failingEndpoints.addAll(List.of("https://a", "https://b"));

        assertThatThrownBy(() -> gateway.getBalance(ACCOUNT))
                .isInstanceOf(RpcException.class)
                .hasMessageContaining("after 3 attempts");
        assertThat(node.endpointsUsed).hasSize(3);
    }

    @Test
    @DisplayName("JSON-RPC errors are returned without retrying")
    void rpcErrorsNotRetried() {
        node.errors.put("eth_estimateGas", "{\"code\":3,\"message\":\"execution reverted: EXPIRED\"}");

        assertThatThrownBy(() -> gateway.estimateGas(ACCOUNT, PAIR, BigInteger.ONE, "0x"))
                .isInstanceOf(JsonRpcErrorException.class)
                .hasMessageContaining("execution reverted: EXPIRED");
        assertThat(node.endpointsUsed).hasSize(1);
    }

    @Test
    void legacyNodeFeeSuggestion() {
        node.results.put("eth_gasPrice", "\"0x3b9aca00\"");
        node.results.put("eth_getBlockByNumber", "{\"number\":\"0x1\"}");

        FeeSuggestion fees = gateway.getFeeSuggestion();

        assertThat(fees.supportsEip1559()).isFalse();
        assertThat(fees.gasPrice()).isEqualTo(BigInteger.valueOf(1_000_000_000L));
    }

    @Test
    void eip1559FeeSuggestionFallsBackWhenTipMethodMissing() {
        node.results.put("eth_gasPrice", "\"0x77359400\"");
        node.results.put("eth_getBlockByNumber", "{\"baseFeePerGas\":\"0x3b9aca00\"}");
        node.errors.put("eth_maxPriorityFeePerGas", "{\"code\":-32601,\"message\":\"method not found\"}");

        FeeSuggestion fees = gateway.getFeeSuggestion();

        assertThat(fees.baseFee()).isEqualTo(BigInteger.valueOf(1_000_000_000L));
        assertThat(fees.priorityFee()).isEqualTo(BigInteger.valueOf(1_000_000_000L));
    }

    @Test
    @DisplayName("signed transactions are broadcast once with the pending nonce")
    void submitsOnce() {
        when(signer.canSign()).thenReturn(true);
        when(signer.sign(eq(1L), eq(BigInteger.valueOf(5)), any())).thenReturn("0x02abcd");
        node.results.put("eth_getTransactionCount", "\"0x5\"");
        node.results.put("eth_sendRawTransaction", "\"0xhash\"");
        TransactionRequest tx = new TransactionRequest(PAIR, BigInteger.ONE, "0x", BigInteger.valueOf(21_000),
                BigInteger.ONE, BigInteger.TWO);

        assertThat(gateway.submitTransaction(tx)).isEqualTo("0xhash");
        assertThat(node.methods).containsExactly("eth_getTransactionCount", "eth_sendRawTransaction");
        verify(signer).sign(eq(1L), eq(BigInteger.valueOf(5)), eq(tx));
    }

    @Test
    void watchOnlyCannotSubmit() {
        when(signer.canSign()).thenReturn(false);

        assertThatThrownBy(() -> gateway.submitTransaction(new TransactionRequest(PAIR, BigInteger.ONE, "0x",
                BigInteger.ONE, BigInteger.ONE, BigInteger.ONE)))
                .isInstanceOf(IllegalStateException.class);
        assertThat(node.methods).isEmpty();
    }

    @Test
    void waitsForReceipt() {
        node.sequence("eth_getTransactionReceipt", List.of("null", "null",
                "{\"blockNumber\":\"0x10\",\"gasUsed\":\"0x5208\",\"effectiveGasPrice\":\"0x1\",\"status\":\"0x1\"}"));

        TxReceipt receipt = gateway.waitForConfirmation("0xhash", Duration.ofSeconds(5));

        assertThat(receipt.success()).isTrue();
        assertThat(receipt.blockNumber()).isEqualTo(BigInteger.valueOf(16));
        assertThat(receipt.gasUsed()).isEqualTo(BigInteger.valueOf(21_000));
    }

    @Test
    void receiptTimeout() {
        node.results.put("eth_getTransactionReceipt", "null");

        assertThatThrownBy(() -> gateway.waitForConfirmation("0xhash", Duration.ofMillis(20)))
                .isInstanceOf(RpcException.class)
                .hasMessageContaining("No receipt for 0xhash");
    }

    private static String encode(Type<?>... values) {
        return "0x" + FunctionEncoder.encodeConstructor(List.<Type>of(values));
    }

    /**
     * Scripted node: fixed results per method, per eth_call calldata, or a sequence consumed in order.
     */
    private static class FakeNode implements EvmRpcClient {

        final Map<String, String> results = new HashMap<>();
        final Map<String, String> errors = new HashMap<>();
        final Map<String, String> calls = new HashMap<>();
        final Map<String, List<String>> sequences = new HashMap<>();
        final List<String> failingEndpoints = new ArrayList<>();
        final List<String> endpointsUsed = new ArrayList<>();
        final List<String> methods = new ArrayList<>();

        void onCall(org.web3j.abi.datatypes.Function function, String resultHex) {
            calls.put(ContractCalls.encode(function), resultHex);
        }

        void sequence(String method, List<String> answers) {
            sequences.put(method, new ArrayList<>(answers));
        }

        @Override
        @SuppressWarnings("unchecked")
        public Mono<String> call(String endpointUrl, String method, Object params) {
            endpointsUsed.add(endpointUrl);
            methods.add(method);
            if (failingEndpoints.contains(endpointUrl)) {
                return Mono.error(new RpcException(method + " request failed: connection refused"));
            }
            if (errors.containsKey(method)) {
                return Mono.just("{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":" + errors.get(method) + "}");
            }
            Function<String, Mono<String>> wrap = result -> Mono.just("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":" + result + "}");
            if ("eth_call".equals(method)) {
                Map<String, Object> call = (Map<String, Object>) ((List<Object>) params).get(0);
                String result = calls.get((String) call.get("data"));
                return result == null ? wrap.apply("\"0x\"") : wrap.apply("\"" + result + "\"");
            }
            List<String> sequence = sequences.get(method);
            if (sequence != null && !sequence.isEmpty()) {
                return wrap.apply(sequence.size() > 1 ? sequence.remove(0) : sequence.get(0));
            }
            return wrap.apply(results.getOrDefault(method, "null"));
        }
    }
}
