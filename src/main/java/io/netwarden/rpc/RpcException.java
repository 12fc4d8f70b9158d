package io.netwarden.rpc;

import java.io.IOException;

public class RpcException extends IOException {
    private final Code code;

    public RpcException(Code code, String message) {
        super(message);
        this.code = code;
    }

    public RpcException(Code code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public Code code() {
        return code;
    }

    public enum Code {
        CANCELLED,
        UNKNOWN,
        INVALID_ARGUMENT,
        DEADLINE_EXCEEDED,
        UNIMPLEMENTED,
        INTERNAL,
        UNAVAILABLE;

        static Code parse(String raw) {
            if (raw == null || raw.isBlank()) {
                return UNKNOWN;
            }
            try {
                return Code.valueOf(raw.trim());
            } catch (IllegalArgumentException e) {
                return UNKNOWN;
            }
        }
    }
}
