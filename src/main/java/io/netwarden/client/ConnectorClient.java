package io.netwarden.client;

import io.netwarden.model.ConnectorRpc;
import io.netwarden.model.Empty;
import io.netwarden.model.RunCommandRequest;
import io.netwarden.model.RunCommandResponse;
import io.netwarden.rpc.ClientStream;
import io.netwarden.rpc.RpcClient;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

public final class ConnectorClient {
    private final RpcClient rpc;

    private ConnectorClient(RpcClient rpc) {
        this.rpc = rpc;
    }

    public static ConnectorClient forSocket(Path socketPath) {
        return new ConnectorClient(RpcClient.forSocket(socketPath));
    }

    public void quit(Duration timeout) throws IOException {
        rpc.unary(ConnectorRpc.QUIT, Empty.INSTANCE, timeout);
    }

    public ClientStream<RunCommandRequest, RunCommandResponse> runCommand() throws IOException {
        return rpc.bidiStreaming(ConnectorRpc.RUN_COMMAND);
    }
}
