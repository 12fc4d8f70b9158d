package io.netwarden.rpc;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

@JsonInclude(JsonInclude.Include.NON_NULL)
record RpcFrame(
        Kind kind,
        String method,
        JsonNode payload,
        String code,
        String message
) {
    static final String OK = "OK";

    static RpcFrame call(String method) {
        return new RpcFrame(Kind.CALL, method, null, null, null);
    }

    static RpcFrame message(JsonNode payload) {
        return new RpcFrame(Kind.MESSAGE, null, payload, null, null);
    }

    static RpcFrame halfClose() {
        return new RpcFrame(Kind.HALF_CLOSE, null, null, null, null);
    }

    static RpcFrame ok() {
        return new RpcFrame(Kind.STATUS, null, null, OK, null);
    }

    static RpcFrame error(RpcException.Code code, String message) {
        return new RpcFrame(Kind.STATUS, null, null, code.name(), message);
    }

    @JsonIgnore
    boolean isOk() {
        return kind == Kind.STATUS && OK.equals(code);
    }

    enum Kind {
        CALL,
        MESSAGE,
        HALF_CLOSE,
        STATUS
    }
}
