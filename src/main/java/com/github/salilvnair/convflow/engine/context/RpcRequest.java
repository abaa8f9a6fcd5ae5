package com.github.salilvnair.convflow.engine.context;

import java.util.Map;

/**
 * Out-of-band request processed by the dialog instead of a user message.
 */
public record RpcRequest(
        String method,
        Map<String, Object> params
) {

    public RpcRequest {
        params = params == null ? Map.of() : Map.copyOf(params);
    }

    public RpcRequest(String method) {
        this(method, Map.of());
    }
}
