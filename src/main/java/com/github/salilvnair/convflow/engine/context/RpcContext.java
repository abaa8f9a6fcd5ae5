package com.github.salilvnair.convflow.engine.context;

import java.util.Map;
import java.util.Optional;

/**
 * The RPC side of a turn. Empty for turns driven by a user message.
 */
public final class RpcContext {

    private static final RpcContext EMPTY = new RpcContext(null);

    private final RpcRequest request;

    private RpcContext(RpcRequest request) {
        this.request = request;
    }

    public static RpcContext empty() {
        return EMPTY;
    }

    public static RpcContext of(RpcRequest request) {
        return request == null ? EMPTY : new RpcContext(request);
    }

    public boolean isPresent() {
        return request != null;
    }

    public RpcRequest getRequest() {
        return request;
    }

    public String getMethod() {
        return request == null ? null : request.method();
    }

    public Map<String, Object> getParams() {
        return request == null ? Map.of() : request.params();
    }

    /**
     * The request, if the given method is the one being called.
     */
    public Optional<RpcRequest> get(String method) {
        if (request != null && request.method().equals(method)) {
            return Optional.of(request);
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "RpcContext(method=" + getMethod() + ", params=" + getParams() + ")";
    }
}
