package io.netwarden.rpc;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.ServerSocketChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

final class LocalSocketServerTest {
    private static final RpcMethod<Text, Text> ECHO = RpcMethod.unary("Test/Echo", Text.class, Text.class);
    private static final RpcMethod<Text, Text> SLOW = RpcMethod.unary("Test/Slow", Text.class, Text.class);
    private static final RpcMethod<Text, Text> REJECT = RpcMethod.unary("Test/Reject", Text.class, Text.class);
    private static final RpcMethod<Text, Text> MISSING = RpcMethod.unary("Test/Missing", Text.class, Text.class);
    private static final RpcMethod<Text, Text> JOIN = RpcMethod.clientStreaming("Test/Join", Text.class, Text.class);
    private static final RpcMethod<Text, Text> SHOUT = RpcMethod.bidiStreaming("Test/Shout", Text.class, Text.class);

    @Test
    void unaryCallsReachTheirHandler() throws Exception {
        Path root = Files.createTempDirectory("netwarden-rpc-");
        LocalSocketServer server = startServer(root);
        try {
            RpcClient client = RpcClient.forSocket(server.socketPath());
            Assertions.assertEquals(new Text("hello"), client.unary(ECHO, new Text("hello")));

            RpcException unknown = Assertions.assertThrows(RpcException.class,
                    () -> client.unary(MISSING, new Text("x")));
            Assertions.assertEquals(RpcException.Code.UNIMPLEMENTED, unknown.code());

            RpcException rejected = Assertions.assertThrows(RpcException.class,
                    () -> client.unary(REJECT, new Text("x")));
            Assertions.assertEquals(RpcException.Code.INVALID_ARGUMENT, rejected.code());
            Assertions.assertTrue(rejected.getMessage().contains("rejected x"));
        } finally {
            server.stop();
            deleteRecursively(root);
        }
    }

    @Test
    void backToBackUnaryCallsNeverLoseTheirAnswer() throws Exception {
        Path root = Files.createTempDirectory("netwarden-rpc-");
        LocalSocketServer server = startServer(root);
        try {
            RpcClient client = RpcClient.forSocket(server.socketPath());
            for (int i = 0; i < 1_000; i++) {
                Assertions.assertEquals(new Text("call-" + i), client.unary(ECHO, new Text("call-" + i)));
            }
            for (int i = 0; i < 200; i++) {
                RpcException unknown = Assertions.assertThrows(RpcException.class,
                        () -> client.unary(MISSING, new Text("x")));
                Assertions.assertEquals(RpcException.Code.UNIMPLEMENTED, unknown.code());
                RpcException rejected = Assertions.assertThrows(RpcException.class,
                        () -> client.unary(REJECT, new Text("x")));
                Assertions.assertEquals(RpcException.Code.INVALID_ARGUMENT, rejected.code());
            }
        } finally {
            server.stop();
            deleteRecursively(root);
        }
    }

    @Test
    void socketFileCarriesRequestedPermissionsAndIsRemovedOnStop() throws Exception {
        Path root = Files.createTempDirectory("netwarden-rpc-");
        LocalSocketServer server = startServer(root);
        try {
            Set<PosixFilePermission> mode = Files.getPosixFilePermissions(server.socketPath());
            Assertions.assertEquals(PosixFilePermissions.fromString("rwx------"), mode);
            Assertions.assertTrue(SocketFiles.exists(server.socketPath()));
        } finally {
            server.stop();
        }
        try {
            Assertions.assertFalse(Files.exists(server.socketPath()));
            Assertions.assertFalse(SocketFiles.exists(server.socketPath()));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void clientStreamingCollectsEveryMessage() throws Exception {
        Path root = Files.createTempDirectory("netwarden-rpc-");
        LocalSocketServer server = startServer(root);
        try {
            ClientStreamingCall<Text, Text> call = RpcClient.forSocket(server.socketPath()).clientStreaming(JOIN);
            call.send(new Text("a"));
            call.send(new Text("b"));
            call.send(new Text("c"));
            Assertions.assertEquals(new Text("a,b,c"), call.closeAndReceive());
        } finally {
            server.stop();
            deleteRecursively(root);
        }
    }

    @Test
    void droppedClientStreamReachesTheHandlerAsCancelled() throws Exception {
        Path root = Files.createTempDirectory("netwarden-rpc-");
        RpcMethod<Text, Text> collect = RpcMethod.clientStreaming("Test/Collect", Text.class, Text.class);
        List<String> seen = new CopyOnWriteArrayList<>();
        CompletableFuture<IOException> failure = new CompletableFuture<>();
        LocalSocketServer server = new LocalSocketServer(root.resolve("collect.socket"))
                .addClientStreaming(collect, requests -> {
                    try {
                        Text next;
                        while ((next = requests.receive()) != null) {
                            seen.add(next.value());
                        }
                        return new Text("complete");
                    } catch (IOException e) {
                        failure.complete(e);
                        throw e;
                    }
                });
        server.bind(null);
        serveInBackground(server);
        try {
            ClientStreamingCall<Text, Text> call = RpcClient.forSocket(server.socketPath()).clientStreaming(collect);
            call.send(new Text("first"));
            call.cancel();

            IOException error = failure.get(5, TimeUnit.SECONDS);
            Assertions.assertTrue(error instanceof RpcException, error.toString());
            Assertions.assertEquals(RpcException.Code.CANCELLED, ((RpcException) error).code());
            Assertions.assertEquals(List.of("first"), seen);
        } finally {
            server.stop();
            deleteRecursively(root);
        }
    }

    @Test
    void bidiStreamingAnswersEachMessageUntilHalfClose() throws Exception {
        Path root = Files.createTempDirectory("netwarden-rpc-");
        LocalSocketServer server = startServer(root);
        try {
            ClientStream<Text, Text> stream = RpcClient.forSocket(server.socketPath()).bidiStreaming(SHOUT);
            stream.send(new Text("one"));
            Assertions.assertEquals(new Text("ONE"), stream.receive());
            stream.send(new Text("two"));
            Assertions.assertEquals(new Text("TWO"), stream.receive());
            stream.closeSend();
            stream.closeSend();
            Assertions.assertEquals(new Text("done"), stream.receive());
            Assertions.assertNull(stream.receive());
            Assertions.assertThrows(IllegalStateException.class, () -> stream.send(new Text("late")));
        } finally {
            server.stop();
            deleteRecursively(root);
        }
    }

    @Test
    void unaryTimeoutReportsDeadlineExceeded() throws Exception {
        Path root = Files.createTempDirectory("netwarden-rpc-");
        LocalSocketServer server = startServer(root);
        try {
            RpcException error = Assertions.assertThrows(RpcException.class,
                    () -> RpcClient.forSocket(server.socketPath()).unary(SLOW, new Text("x"), Duration.ofMillis(100)));
            Assertions.assertEquals(RpcException.Code.DEADLINE_EXCEEDED, error.code());
        } finally {
            server.stop();
            deleteRecursively(root);
        }
    }

    @Test
    void dialingAMissingSocketIsUnavailable() throws Exception {
        Path root = Files.createTempDirectory("netwarden-rpc-");
        try {
            RpcException error = Assertions.assertThrows(RpcException.class,
                    () -> RpcClient.forSocket(root.resolve("none.socket")).unary(ECHO, new Text("x")));
            Assertions.assertEquals(RpcException.Code.UNAVAILABLE, error.code());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void staleSocketFileIsReplacedButLiveOneIsNot() throws Exception {
        Path root = Files.createTempDirectory("netwarden-rpc-");
        Path socket = root.resolve("test.socket");
        try {
            ServerSocketChannel abandoned = ServerSocketChannel.open(StandardProtocolFamily.UNIX);
            abandoned.bind(UnixDomainSocketAddress.of(socket));
            abandoned.close();
            Assertions.assertTrue(Files.exists(socket));

            LocalSocketServer server = new LocalSocketServer(socket).addUnary(ECHO, request -> request);
            server.bind(null);
            Thread serving = serveInBackground(server);
            try {
                Assertions.assertEquals(new Text("alive"), RpcClient.forSocket(socket).unary(ECHO, new Text("alive")));
                IOException busy = Assertions.assertThrows(IOException.class,
                        () -> new LocalSocketServer(socket).bind(null));
                Assertions.assertTrue(busy.getMessage().contains("already listening"));
            } finally {
                server.stop();
                serving.join(5_000L);
            }

            Files.writeString(socket, "not a socket");
            IOException notSocket = Assertions.assertThrows(IOException.class,
                    () -> new LocalSocketServer(socket).bind(null));
            Assertions.assertTrue(notSocket.getMessage().contains("not a socket"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void gracefulStopLetsInFlightCallFinishAndDeliverItsFrames() throws Exception {
        Path root = Files.createTempDirectory("netwarden-rpc-");
        CountDownLatch handlerStarted = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        RpcMethod<Text, Text> drain = RpcMethod.bidiStreaming("Test/Drain", Text.class, Text.class);
        LocalSocketServer server = new LocalSocketServer(root.resolve("drain.socket"))
                .addBidiStreaming(drain, (requests, responses) -> {
                    handlerStarted.countDown();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    for (int i = 0; i < 3; i++) {
                        responses.send(new Text("chunk-" + i));
                    }
                });
        server.bind(null);
        Thread serving = serveInBackground(server);
        try {
            ClientStream<Text, Text> stream = RpcClient.forSocket(server.socketPath()).bidiStreaming(drain);
            Assertions.assertTrue(handlerStarted.await(5, TimeUnit.SECONDS));

            Thread stopper = new Thread(() -> server.gracefulStop(Duration.ofSeconds(5)));
            stopper.start();
            Thread.sleep(100L);
            Assertions.assertTrue(server.isStopped());
            Assertions.assertFalse(Files.exists(server.socketPath()));
            release.countDown();

            List<Text> received = new ArrayList<>();
            Text next;
            while ((next = stream.receive()) != null) {
                received.add(next);
            }
            stopper.join(5_000L);
            serving.join(5_000L);

            Assertions.assertEquals(List.of(new Text("chunk-0"), new Text("chunk-1"), new Text("chunk-2")), received);
            Assertions.assertFalse(serving.isAlive());
        } finally {
            release.countDown();
            server.stop();
            deleteRecursively(root);
        }
    }

    private static LocalSocketServer startServer(Path root) throws IOException {
        LocalSocketServer server = new LocalSocketServer(root.resolve("test.socket"))
                .addUnary(ECHO, request -> request)
                .addUnary(SLOW, request -> {
                    try {
                        Thread.sleep(2_000L);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return request;
                })
                .addUnary(REJECT, request -> {
                    throw new RpcException(RpcException.Code.INVALID_ARGUMENT, "rejected " + request.value());
                })
                .addClientStreaming(JOIN, requests -> {
                    List<String> parts = new ArrayList<>();
                    Text next;
                    while ((next = requests.receive()) != null) {
                        parts.add(next.value());
                    }
                    return new Text(String.join(",", parts));
                })
                .addBidiStreaming(SHOUT, (requests, responses) -> {
                    Text next;
                    while ((next = requests.receive()) != null) {
                        responses.send(new Text(next.value().toUpperCase(Locale.ROOT)));
                    }
                    responses.send(new Text("done"));
                });
        server.bind(PosixFilePermissions.fromString("rwx------"));
        serveInBackground(server);
        return server;
    }

    private static Thread serveInBackground(LocalSocketServer server) {
        Thread thread = new Thread(() -> {
            try {
                server.serve();
            } catch (IOException e) {
                throw new IllegalStateException(e);
            }
        }, "test-rpc-serve");
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }

    record Text(String value) {
    }
}
