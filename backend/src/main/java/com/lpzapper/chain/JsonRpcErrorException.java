package com.lpzapper.chain;

import lombok.Getter;

/**
 * The node answered with a JSON-RPC {@code error} object (e.g. "execution reverted: ..."). The node's answer is
 * deterministic for the request, so these are never retried.
 */
@Getter
public class JsonRpcErrorException extends RpcException {

    private final int code;
    private final String rpcMessage;

    public JsonRpcErrorException(String method, int code, String rpcMessage) {
        super(method + " failed: " + rpcMessage + " (code " + code + ")");
        this.code = code;
        this.rpcMessage = rpcMessage;
    }
}
