package io.netwarden.daemon;

import io.netwarden.config.DaemonSettings;
import io.netwarden.config.NetWardenConfig;
import io.netwarden.model.DaemonStatus;
import io.netwarden.model.LogMessage;
import io.netwarden.model.PauseError;
import io.netwarden.model.PauseResponse;
import io.netwarden.model.ResumeError;
import io.netwarden.model.ResumeResponse;
import io.netwarden.rpc.MessageReader;
import io.netwarden.rpc.RpcException;
import io.netwarden.signal.ManualSignalHub;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.ServerSocketChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

final class DaemonServiceTest {

    @Test
    void pauseAndResumeWalkTheStateMachine() throws Exception {
        Path root = Files.createTempDirectory("netwarden-daemon-");
        try {
            FakeNetwork network = new FakeNetwork();
            DaemonService service = newService(root, network);

            Assertions.assertEquals(DaemonStatus.PAUSED, service.status().status());
            Assertions.assertEquals(PauseError.ALREADY_PAUSED, service.pause().error());

            Assertions.assertEquals(ResumeResponse.ok(), service.resume());
            Assertions.assertEquals(DaemonStatus.OK, service.status().status());
            Assertions.assertEquals(ResumeError.NOT_PAUSED, service.resume().error());
            Assertions.assertEquals(1, network.installs.get());

            Assertions.assertEquals(PauseResponse.ok(), service.pause());
            Assertions.assertEquals(DaemonStatus.PAUSED, service.status().status());
            Assertions.assertEquals(1, network.closes.get());
            Assertions.assertFalse(service.hasNetworkOverride());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unhealthyOverrideReportsNoNetworkAndReEstablishing() throws Exception {
        Path root = Files.createTempDirectory("netwarden-daemon-");
        try {
            FakeNetwork network = new FakeNetwork();
            DaemonService service = newService(root, network);
            service.resume();
            network.okay = false;

            Assertions.assertEquals(DaemonStatus.NO_NETWORK, service.status().status());
            Assertions.assertEquals(ResumeError.RE_ESTABLISHING, service.resume().error());
            Assertions.assertEquals(1, network.installs.get());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void pauseIsRefusedWhileConnectorSocketExists() throws Exception {
        Path root = Files.createTempDirectory("netwarden-daemon-");
        try {
            FakeNetwork network = new FakeNetwork();
            DaemonService service = newService(root, network);
            service.resume();

            try (ServerSocketChannel connector = ServerSocketChannel.open(StandardProtocolFamily.UNIX)) {
                connector.bind(UnixDomainSocketAddress.of(root.resolve(NetWardenConfig.CONNECTOR_SOCKET_NAME)));

                Assertions.assertEquals(PauseError.CONNECTED_TO_CLUSTER, service.pause().error());
                Assertions.assertTrue(service.hasNetworkOverride());
                Assertions.assertEquals(0, network.closes.get());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void connectorSocketWinsOverAlreadyPaused() throws Exception {
        Path root = Files.createTempDirectory("netwarden-daemon-");
        try {
            FakeNetwork network = new FakeNetwork();
            DaemonService service = newService(root, network);

            try (ServerSocketChannel connector = ServerSocketChannel.open(StandardProtocolFamily.UNIX)) {
                connector.bind(UnixDomainSocketAddress.of(root.resolve(NetWardenConfig.CONNECTOR_SOCKET_NAME)));

                Assertions.assertEquals(PauseError.CONNECTED_TO_CLUSTER, service.pause().error());
                Assertions.assertFalse(service.hasNetworkOverride());
                Assertions.assertEquals(DaemonStatus.PAUSED, service.status().status());
            }
            Files.delete(root.resolve(NetWardenConfig.CONNECTOR_SOCKET_NAME));
            Assertions.assertEquals(PauseError.ALREADY_PAUSED, service.pause().error());
            Assertions.assertEquals(0, network.closes.get());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void droppedLoggerStreamIsReportedAfterKeepingEarlierLines() throws Exception {
        Path root = Files.createTempDirectory("netwarden-daemon-");
        try (ClientLogCapture captured = new ClientLogCapture()) {
            DaemonService service = newService(root, new FakeNetwork());
            Iterator<LogMessage> lines = List.of(new LogMessage("before the drop")).iterator();
            MessageReader<LogMessage> dropping = () -> {
                if (lines.hasNext()) {
                    return lines.next();
                }
                throw new RpcException(RpcException.Code.CANCELLED, "client closed the connection");
            };

            RpcException error = Assertions.assertThrows(RpcException.class, () -> service.logger(dropping));

            Assertions.assertEquals(RpcException.Code.CANCELLED, error.code());
            Assertions.assertEquals(List.of("before the drop"), captured.lines());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void regularFileAtConnectorPathDoesNotBlockPause() throws Exception {
        Path root = Files.createTempDirectory("netwarden-daemon-");
        try {
            DaemonService service = newService(root, new FakeNetwork());
            service.resume();
            Files.writeString(root.resolve(NetWardenConfig.CONNECTOR_SOCKET_NAME), "leftover");

            Assertions.assertEquals(PauseError.NONE, service.pause().error());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failedCloseStillClearsTheOverride() throws Exception {
        Path root = Files.createTempDirectory("netwarden-daemon-");
        try {
            FakeNetwork network = new FakeNetwork();
            DaemonService service = newService(root, network);
            service.resume();
            network.closeFailure = "resolver busy";

            PauseResponse response = service.pause();

            Assertions.assertEquals(PauseError.UNEXPECTED_PAUSE_ERROR, response.error());
            Assertions.assertEquals("resolver busy", response.errorText());
            Assertions.assertFalse(service.hasNetworkOverride());
            Assertions.assertEquals(DaemonStatus.PAUSED, service.status().status());
            Assertions.assertEquals(ResumeResponse.ok(), service.resume());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failedInstallLeavesDaemonPaused() throws Exception {
        Path root = Files.createTempDirectory("netwarden-daemon-");
        try {
            FakeNetwork network = new FakeNetwork();
            network.installFailure = "no resolver";
            DaemonService service = newService(root, network);

            ResumeResponse response = service.resume();

            Assertions.assertEquals(ResumeError.UNEXPECTED_RESUME_ERROR, response.error());
            Assertions.assertEquals("no resolver", response.errorText());
            Assertions.assertEquals(DaemonStatus.PAUSED, service.status().status());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void releaseOnExitClosesTheOverrideOnce() throws Exception {
        Path root = Files.createTempDirectory("netwarden-daemon-");
        try {
            FakeNetwork network = new FakeNetwork();
            DaemonService service = newService(root, network);
            service.resume();

            service.releaseOnExit();
            service.releaseOnExit();

            Assertions.assertEquals(1, network.closes.get());
            Assertions.assertFalse(service.hasNetworkOverride());
        } finally {
            deleteRecursively(root);
        }
    }

    private static DaemonService newService(Path root, FakeNetwork network) {
        return new DaemonService(new NetWardenConfig(root), DaemonSettings.defaults(), network, new ManualSignalHub());
    }

    static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
