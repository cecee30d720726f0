package com.lpzapper.chain;

import reactor.core.publisher.Mono;

/**
 * Raw Ethereum JSON-RPC transport. Retries, endpoint rotation and result parsing live in {@link JsonRpcChainGateway}.
 */
public interface EvmRpcClient {

    /**
     * Perform a single JSON-RPC call.
     *
     * @param endpointUrl RPC endpoint URL
     * @param method      e.g. "eth_call"
     * @param params      positional params
     * @return response body (JSON); errors with {@link RpcException} on HTTP failure
     */
    Mono<String> call(String endpointUrl, String method, Object params);
}
