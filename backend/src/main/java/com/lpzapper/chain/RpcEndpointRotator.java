package com.lpzapper.chain;

import com.lpzapper.common.RetryPolicy;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Round-robin RPC endpoint selection with the retry schedule used between attempts.
 */
public class RpcEndpointRotator {

    private final List<String> endpoints;
    private final AtomicInteger index = new AtomicInteger(0);
    private final RetryPolicy retryPolicy;

    public RpcEndpointRotator(List<String> endpoints, RetryPolicy retryPolicy) {
        if (endpoints == null || endpoints.isEmpty()) {
            throw new IllegalArgumentException("At least one RPC endpoint required");
        }
        this.endpoints = List.copyOf(endpoints);
        this.retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.defaultPolicy();
    }

    public String getNextEndpoint() {
        return endpoints.get(Math.floorMod(index.getAndIncrement(), endpoints.size()));
    }

    public long retryDelayMs(int attempt) {
        return retryPolicy.delayMs(attempt);
    }

    public int getMaxAttempts() {
        return retryPolicy.getMaxAttempts();
    }

    public List<String> getEndpoints() {
        return endpoints;
    }
}
