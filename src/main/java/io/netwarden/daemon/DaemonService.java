package io.netwarden.daemon;

import io.netwarden.config.DaemonSettings;
import io.netwarden.config.NetWardenConfig;
import io.netwarden.model.DaemonRpc;
import io.netwarden.model.DaemonStatus;
import io.netwarden.model.DaemonStatusResponse;
import io.netwarden.model.Empty;
import io.netwarden.model.LogMessage;
import io.netwarden.model.NetWardenVersion;
import io.netwarden.model.PauseError;
import io.netwarden.model.PauseResponse;
import io.netwarden.model.ResumeError;
import io.netwarden.model.ResumeResponse;
import io.netwarden.model.VersionResponse;
import io.netwarden.network.NetworkOverride;
import io.netwarden.network.NetworkOverrideInstaller;
import io.netwarden.rpc.LocalSocketServer;
import io.netwarden.rpc.MessageReader;
import io.netwarden.rpc.SocketFiles;
import io.netwarden.signal.SignalHub;
import io.netwarden.supervisor.WorkerProcess;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;

public final class DaemonService {
    private static final Logger log = LoggerFactory.getLogger(DaemonService.class);
    private static final Logger clientLog = LoggerFactory.getLogger("netwarden.client");

    // Any local user may connect to the daemon.
    static final Set<PosixFilePermission> SOCKET_PERMISSIONS = PosixFilePermissions.fromString("rwxrwxrwx");

    private final NetWardenConfig config;
    private final DaemonSettings settings;
    private final NetworkOverrideInstaller installer;
    private final SignalHub signals;
    private final LocalSocketServer server;
    private final Object overrideLock;
    private NetworkOverride network;
    private volatile WorkerProcess process;

    public DaemonService(
            NetWardenConfig config,
            DaemonSettings settings,
            NetworkOverrideInstaller installer,
            SignalHub signals
    ) {
        this.config = config;
        this.settings = settings;
        this.installer = installer;
        this.signals = signals;
        this.server = new LocalSocketServer(config.daemonSocket());
        this.overrideLock = new Object();
    }

    public VersionResponse version() {
        return new VersionResponse(NetWardenVersion.API_VERSION, NetWardenVersion.version());
    }

    public DaemonStatusResponse status() {
        synchronized (overrideLock) {
            if (network == null) {
                return new DaemonStatusResponse(DaemonStatus.PAUSED);
            }
            if (!network.isOkay()) {
                return new DaemonStatusResponse(DaemonStatus.NO_NETWORK);
            }
            return new DaemonStatusResponse(DaemonStatus.OK);
        }
    }

    // The override reference is cleared even when closing it fails.
    public PauseResponse pause() {
        synchronized (overrideLock) {
            // A running connector blocks pause whether or not an override is held.
            if (SocketFiles.exists(config.connectorSocket())) {
                return PauseResponse.rejected(PauseError.CONNECTED_TO_CLUSTER);
            }
            if (network == null) {
                return PauseResponse.rejected(PauseError.ALREADY_PAUSED);
            }
            PauseResponse response = PauseResponse.ok();
            try {
                network.close();
            } catch (IOException e) {
                log.warn("pause: {}", e.getMessage());
                response = PauseResponse.failed(e.getMessage());
            }
            network = null;
            return response;
        }
    }

    public ResumeResponse resume() {
        synchronized (overrideLock) {
            if (network != null) {
                return ResumeResponse.rejected(network.isOkay() ? ResumeError.NOT_PAUSED : ResumeError.RE_ESTABLISHING);
            }
            try {
                network = installer.install();
            } catch (IOException e) {
                log.warn("resume: {}", e.getMessage());
                return ResumeResponse.failed(e.getMessage());
            }
            return ResumeResponse.ok();
        }
    }

    public Empty quit() {
        WorkerProcess p = process;
        if (p != null) {
            p.log("Quit requested");
            p.supervisor().shutdown();
        }
        return Empty.INSTANCE;
    }

    public Empty logger(MessageReader<LogMessage> messages) throws IOException {
        LogMessage message;
        while ((message = messages.receive()) != null) {
            clientLog.info("{}", message.text());
        }
        return Empty.INSTANCE;
    }

    boolean hasNetworkOverride() {
        synchronized (overrideLock) {
            return network != null;
        }
    }

    void serveRpc(WorkerProcess p) throws Exception {
        process = p;
        try {
            server.bind(SOCKET_PERMISSIONS);
        } catch (IOException e) {
            throw new IOException("daemon socket " + config.daemonSocket() + ": " + e.getMessage(), e);
        }
        server.addUnary(DaemonRpc.VERSION, request -> version())
                .addUnary(DaemonRpc.STATUS, request -> status())
                .addUnary(DaemonRpc.PAUSE, request -> pause())
                .addUnary(DaemonRpc.RESUME, request -> resume())
                .addUnary(DaemonRpc.QUIT, request -> quit())
                .addClientStreaming(DaemonRpc.LOGGER, this::logger);

        ShutdownCoordinator coordinator = new ShutdownCoordinator(
                server,
                signals,
                config.connectorSocket(),
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
            throw new IOException("daemon rpc server: " + failure.getMessage(), failure);
        }
    }

    void installInitialOverride(WorkerProcess p, boolean skip) throws IOException {
        if (skip) {
            p.log("network override skipped; daemon starts paused");
            p.ready();
            return;
        }
        synchronized (overrideLock) {
            if (network == null) {
                network = installer.install();
            }
        }
        p.log("network override installed");
        p.ready();
    }

    void releaseOnExit() {
        synchronized (overrideLock) {
            if (network == null) {
                return;
            }
            try {
                network.close();
            } catch (IOException e) {
                log.warn("release network override on exit: {}", e.getMessage());
            }
            network = null;
        }
    }
}
