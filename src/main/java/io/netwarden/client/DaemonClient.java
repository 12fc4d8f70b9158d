package io.netwarden.client;

import io.netwarden.model.DaemonRpc;
import io.netwarden.model.DaemonStatusResponse;
import io.netwarden.model.Empty;
import io.netwarden.model.LogMessage;
import io.netwarden.model.PauseResponse;
import io.netwarden.model.ResumeResponse;
import io.netwarden.model.VersionResponse;
import io.netwarden.rpc.ClientStreamingCall;
import io.netwarden.rpc.RpcClient;

import java.io.IOException;
import java.nio.file.Path;

public final class DaemonClient {
    private final RpcClient rpc;

    private DaemonClient(RpcClient rpc) {
        this.rpc = rpc;
    }

    public static DaemonClient forSocket(Path socketPath) {
        return new DaemonClient(RpcClient.forSocket(socketPath));
    }

    public VersionResponse version() throws IOException {
        return rpc.unary(DaemonRpc.VERSION, Empty.INSTANCE);
    }

    public DaemonStatusResponse status() throws IOException {
        return rpc.unary(DaemonRpc.STATUS, Empty.INSTANCE);
    }

    public PauseResponse pause() throws IOException {
        return rpc.unary(DaemonRpc.PAUSE, Empty.INSTANCE);
    }

    public ResumeResponse resume() throws IOException {
        return rpc.unary(DaemonRpc.RESUME, Empty.INSTANCE);
    }

    public void quit() throws IOException {
        rpc.unary(DaemonRpc.QUIT, Empty.INSTANCE);
    }

    public ClientStreamingCall<LogMessage, Empty> logger() throws IOException {
        return rpc.clientStreaming(DaemonRpc.LOGGER);
    }
}
