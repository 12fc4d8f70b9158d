package io.netwarden.daemon;

import io.netwarden.client.ConnectorClient;
import io.netwarden.rpc.LocalSocketServer;
import io.netwarden.rpc.SocketFiles;
import io.netwarden.signal.SignalHub;
import io.netwarden.signal.SignalNames;
import io.netwarden.supervisor.WorkerProcess;
import io.netwarden.util.Cancellation;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

public final class ShutdownCoordinator {
    private final LocalSocketServer server;
    private final SignalHub signals;
    // null when nothing sits downstream.
    private final Path downstreamSocket;
    private final Duration gracefulStopTimeout;
    private final Duration cascadeTimeout;

    public ShutdownCoordinator(
            LocalSocketServer server,
            SignalHub signals,
            Path downstreamSocket,
            Duration gracefulStopTimeout,
            Duration cascadeTimeout
    ) {
        this.server = server;
        this.signals = signals;
        this.downstreamSocket = downstreamSocket;
        this.gracefulStopTimeout = gracefulStopTimeout;
        this.cascadeTimeout = cascadeTimeout;
    }

    public Thread start(WorkerProcess process) {
        Thread thread = new Thread(() -> run(process), "netwarden-shutdown-" + process.name());
        thread.start();
        return thread;
    }

    void run(WorkerProcess process) {
        Cancellation wake = process.shutdownSignal().child();
        AtomicReference<String> received = new AtomicReference<>();
        try (SignalHub.Subscription ignored = signals.subscribe(SignalNames.SHUTDOWN, signal -> {
            received.compareAndSet(null, signal);
            wake.cancel("signal " + signal);
        })) {
            wake.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        String signal = received.get();
        if (signal != null) {
            process.log("Received signal SIG{}", signal);
        } else {
            process.log("Shutting down");
        }
        process.supervisor().shutdown();
        server.gracefulStop(gracefulStopTimeout);
        cascadeQuit(process);
    }

    private void cascadeQuit(WorkerProcess process) {
        if (downstreamSocket == null || !SocketFiles.exists(downstreamSocket)) {
            return;
        }
        try {
            ConnectorClient.forSocket(downstreamSocket).quit(cascadeTimeout);
            process.log("asked downstream daemon at {} to quit", downstreamSocket);
        } catch (IOException e) {
            process.log("downstream daemon at {} did not take quit: {}", downstreamSocket, e.getMessage());
        }
    }
}
