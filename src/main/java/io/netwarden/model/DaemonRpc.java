package io.netwarden.model;

import io.netwarden.rpc.RpcMethod;

public final class DaemonRpc {
    public static final RpcMethod<Empty, VersionResponse> VERSION =
            RpcMethod.unary("Daemon/Version", Empty.class, VersionResponse.class);
    public static final RpcMethod<Empty, DaemonStatusResponse> STATUS =
            RpcMethod.unary("Daemon/Status", Empty.class, DaemonStatusResponse.class);
    public static final RpcMethod<Empty, PauseResponse> PAUSE =
            RpcMethod.unary("Daemon/Pause", Empty.class, PauseResponse.class);
    public static final RpcMethod<Empty, ResumeResponse> RESUME =
            RpcMethod.unary("Daemon/Resume", Empty.class, ResumeResponse.class);
    public static final RpcMethod<Empty, Empty> QUIT =
            RpcMethod.unary("Daemon/Quit", Empty.class, Empty.class);
    public static final RpcMethod<LogMessage, Empty> LOGGER =
            RpcMethod.clientStreaming("Daemon/Logger", LogMessage.class, Empty.class);

    private DaemonRpc() {
    }
}
