package com.susuchain.infrastructure.chain;

/**
 * The node answered with a JSON-RPC error object (for example an execution revert).
 *
 * The node itself is healthy, so this is excluded from the chainRpc circuit breaker.
 */
public class JsonRpcException extends RuntimeException {

    private final String method;
    private final Integer code;

    public JsonRpcException(String method, Integer code, String message) {
        super(String.format("%s failed (code=%s): %s", method, code, message));
        this.method = method;
        this.code = code;
    }

    public String getMethod() {
        return method;
    }

    public Integer getCode() {
        return code;
    }
}
