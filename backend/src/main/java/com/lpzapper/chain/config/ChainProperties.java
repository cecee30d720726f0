package com.lpzapper.chain.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Ethereum node access and custodial account settings.
 */
@ConfigurationProperties(prefix = "lpzapper.chain")
@NoArgsConstructor
@Getter
@Setter
public class ChainProperties {

    /** JSON-RPC endpoints, used round-robin. */
    private List<String> rpcUrls = new ArrayList<>(List.of("https://eth.llamarpc.com"));

    /** Hex private key of the custodial account. Empty means watch-only. */
    private String privateKey = "";

    /** Account address used in watch-only mode. Ignored when a private key is set. */
    private String accountAddress = "";

    /** Chain id for signing. When null it is read once from eth_chainId. */
    private Long chainId;

    /** Global RPC budget (requests per second) for this instance. */
    private int maxRequestsPerSecond = 25;

    /** How long the local limiter may wait for a permit before failing the call. */
    private long localLimiterTimeoutMs = 2_000;

    /** Per-request HTTP timeout. */
    private long requestTimeoutMs = 10_000;

    /** Interval between eth_getTransactionReceipt polls. */
    private long receiptPollIntervalMs = 2_000;

    /** How long to wait for a receipt before giving up. */
    private long confirmationTimeoutSeconds = 180;

    private Retry retry = new Retry();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Retry {

        private long baseDelayMs = 300;

        private long maxDelayMs = 5_000;

        /** Random ± fraction applied to each delay. */
        private double jitterFactor = 0.2;

        private int maxAttempts = 3;
    }
}
