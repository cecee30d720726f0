package com.lpzapper.chain;

import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * JSON-RPC over HTTP using WebClient.
 */
public class WebClientEvmRpcClient implements EvmRpcClient {

    private final WebClient webClient;
    private final Duration requestTimeout;
    private final AtomicLong ids = new AtomicLong();

    public WebClientEvmRpcClient(WebClient.Builder builder, Duration requestTimeout) {
        this.webClient = builder.build();
        this.requestTimeout = requestTimeout;
    }

    @Override
    public Mono<String> call(String endpointUrl, String method, Object params) {
        Map<String, Object> body = Map.of(
                "jsonrpc", "2.0",
                "id", ids.incrementAndGet(),
                "method", method,
                "params", params != null ? params : new Object[]{}
        );
        return webClient.post()
                .uri(endpointUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(requestTimeout)
                .onErrorMap(WebClientResponseException.class,
                        e -> new RpcException(method + " HTTP " + e.getStatusCode().value() + ": " + e.getMessage(), e))
                .onErrorMap(WebClientRequestException.class,
                        e -> new RpcException(method + " request failed: " + e.getMessage(), e))
                .onErrorMap(TimeoutException.class,
                        e -> new RpcException(method + " timed out after " + requestTimeout.toMillis() + "ms", e));
    }
}
