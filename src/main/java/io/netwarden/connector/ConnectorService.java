package io.netwarden.connector;

import io.netwarden.config.DaemonSettings;
import io.netwarden.daemon.ShutdownCoordinator;
import io.netwarden.model.ConnectorRpc;
import io.netwarden.model.Empty;
import io.netwarden.model.RunCommandRequest;
import io.netwarden.model.RunCommandResponse;
import io.netwarden.rpc.LocalSocketServer;
import io.netwarden.rpc.MessageReader;
import io.netwarden.rpc.MessageWriter;
import io.netwarden.signal.SignalHub;
import io.netwarden.supervisor.WorkerProcess;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;

public final class ConnectorService {
    static final Set<PosixFilePermission> SOCKET_PERMISSIONS = PosixFilePermissions.fromString("rw-rw----");

    private final Path socketPath;
    private final DaemonSettings settings;
    private final SignalHub signals;
    private final LocalSocketServer server;
    private volatile WorkerProcess process;

    public ConnectorService(Path socketPath, DaemonSettings settings, SignalHub signals) {
        this.socketPath = socketPath;
        this.settings = settings;
        this.signals = signals;
        this.server = new LocalSocketServer(socketPath);
    }

    public Empty quit() {
        WorkerProcess p = process;
        if (p != null) {
            p.log("Quit requested");
            p.supervisor().shutdown();
        }
        return Empty.INSTANCE;
    }

    public void runCommand(
            MessageReader<RunCommandRequest> requests,
            MessageWriter<RunCommandResponse> responses
    ) throws IOException {
        new CommandExecution(requests, responses).execute();
    }

    void serveRpc(WorkerProcess p) throws Exception {
        process = p;
        try {
            server.bind(SOCKET_PERMISSIONS);
        } catch (IOException e) {
            throw new IOException("connector socket " + socketPath + ": " + e.getMessage(), e);
        }
        server.addUnary(ConnectorRpc.QUIT, request -> quit())
                .addBidiStreaming(ConnectorRpc.RUN_COMMAND, this::runCommand);

        ShutdownCoordinator coordinator = new ShutdownCoordinator(
                server,
                signals,
                null,
                settings.gracefulStopTimeout(),
                settings.cascadeQuitTimeout()
        );
        Thread coordinatorThread = coordinator.start(p);

        p.ready();
        IOException failure = null;
        try {
            server.serve();
        } catch (IOException e) {
            failure = e;
            p.supervisor().shutdown();
        }
        coordinatorThread.join();
        if (failure != null) {
            throw new IOException("connector rpc server: " + failure.getMessage(), failure);
        }
    }
}
