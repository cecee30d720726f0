package com.lpzapper.chain.config;

import com.lpzapper.chain.CredentialsTransactionSigner;
import com.lpzapper.chain.EvmRpcClient;
import com.lpzapper.chain.RpcEndpointRotator;
import com.lpzapper.chain.TransactionSigner;
import com.lpzapper.chain.WebClientEvmRpcClient;
import com.lpzapper.common.RetryPolicy;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;

/**
 * RPC transport, endpoint rotation, request budget and the account signer.
 */
@Configuration
@EnableConfigurationProperties(ChainProperties.class)
public class ChainConfig {

    /** Used when lpzapper.chain.rpc-urls is empty so the gateway still starts. */
    private static final List<String> DEFAULT_FALLBACK_URLS = List.of("https://eth.llamarpc.com");

    @Bean
    public RpcEndpointRotator rpcEndpointRotator(ChainProperties properties) {
        ChainProperties.Retry retry = properties.getRetry();
        RetryPolicy policy = new RetryPolicy(
                retry.getBaseDelayMs(),
                retry.getMaxDelayMs(),
                retry.getJitterFactor(),
                retry.getMaxAttempts());
        List<String> urls = properties.getRpcUrls() == null || properties.getRpcUrls().isEmpty()
                ? DEFAULT_FALLBACK_URLS
                : properties.getRpcUrls();
        return new RpcEndpointRotator(urls, policy);
    }

    @Bean
    public EvmRpcClient evmRpcClient(WebClient.Builder webClientBuilder, ChainProperties properties) {
        return new WebClientEvmRpcClient(webClientBuilder, Duration.ofMillis(properties.getRequestTimeoutMs()));
    }

    @Bean(name = "evmRpcRateLimiter")
    public RateLimiter evmRpcRateLimiter(ChainProperties properties) {
        int rps = Math.max(1, properties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLocalLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("evm-rpc", config);
    }

    @Bean
    public TransactionSigner transactionSigner(ChainProperties properties) {
        return new CredentialsTransactionSigner(properties.getPrivateKey(), properties.getAccountAddress());
    }
}
