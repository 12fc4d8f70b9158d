package io.netwarden.model;

import io.netwarden.rpc.RpcMethod;

public final class ConnectorRpc {
    public static final RpcMethod<Empty, Empty> QUIT =
            RpcMethod.unary("Connector/Quit", Empty.class, Empty.class);
    public static final RpcMethod<RunCommandRequest, RunCommandResponse> RUN_COMMAND =
            RpcMethod.bidiStreaming("Connector/RunCommand", RunCommandRequest.class, RunCommandResponse.class);

    private ConnectorRpc() {
    }
}
