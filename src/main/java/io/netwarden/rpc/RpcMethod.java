package io.netwarden.rpc;

import java.util.Objects;

public record RpcMethod<Req, Resp>(
        String name,
        Kind kind,
        Class<Req> requestType,
        Class<Resp> responseType
) {
    public RpcMethod {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("rpc method name cannot be empty");
        }
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(requestType, "requestType");
        Objects.requireNonNull(responseType, "responseType");
    }

    public static <Req, Resp> RpcMethod<Req, Resp> unary(String name, Class<Req> request, Class<Resp> response) {
        return new RpcMethod<>(name, Kind.UNARY, request, response);
    }

    public static <Req, Resp> RpcMethod<Req, Resp> clientStreaming(String name, Class<Req> request, Class<Resp> response) {
        return new RpcMethod<>(name, Kind.CLIENT_STREAMING, request, response);
    }

    public static <Req, Resp> RpcMethod<Req, Resp> bidiStreaming(String name, Class<Req> request, Class<Resp> response) {
        return new RpcMethod<>(name, Kind.BIDI_STREAMING, request, response);
    }

    public enum Kind {
        UNARY,
        CLIENT_STREAMING,
        BIDI_STREAMING
    }
}
