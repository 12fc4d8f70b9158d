package io.netwarden.rpc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

public final class LocalSocketServer {
    private static final Logger log = LoggerFactory.getLogger(LocalSocketServer.class);
    private static final AtomicInteger SERVER_SEQ = new AtomicInteger();

    private final Path socketPath;
    private final Map<String, Registration<?, ?>> methods;
    private final Set<RpcConnection> active;
    private final Object activeLock;
    private final AtomicBoolean stopping;
    private final ExecutorService callExecutor;
    private volatile ServerSocketChannel listener;

    public LocalSocketServer(Path socketPath) {
        this.socketPath = socketPath.toAbsolutePath();
        this.methods = new ConcurrentHashMap<>();
        this.active = ConcurrentHashMap.newKeySet();
        this.activeLock = new Object();
        this.stopping = new AtomicBoolean(false);
        int serverId = SERVER_SEQ.incrementAndGet();
        AtomicInteger callSeq = new AtomicInteger();
        this.callExecutor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "netwarden-rpc-" + serverId + "-" + callSeq.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public Path socketPath() {
        return socketPath;
    }

    public <Req, Resp> LocalSocketServer addUnary(RpcMethod<Req, Resp> method, ServerCalls.Unary<Req, Resp> handler) {
        requireKind(method, RpcMethod.Kind.UNARY);
        methods.put(method.name(), new Registration<>(method, handler));
        return this;
    }

    public <Req, Resp> LocalSocketServer addClientStreaming(
            RpcMethod<Req, Resp> method,
            ServerCalls.ClientStreaming<Req, Resp> handler
    ) {
        requireKind(method, RpcMethod.Kind.CLIENT_STREAMING);
        methods.put(method.name(), new Registration<>(method, handler));
        return this;
    }

    public <Req, Resp> LocalSocketServer addBidiStreaming(
            RpcMethod<Req, Resp> method,
            ServerCalls.BidiStreaming<Req, Resp> handler
    ) {
        requireKind(method, RpcMethod.Kind.BIDI_STREAMING);
        methods.put(method.name(), new Registration<>(method, handler));
        return this;
    }

    public void bind(Set<PosixFilePermission> permissions) throws IOException {
        if (listener != null) {
            throw new IllegalStateException("server already bound to " + socketPath);
        }
        SocketFiles.removeStale(socketPath);
        Path parent = socketPath.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        ServerSocketChannel channel = ServerSocketChannel.open(StandardProtocolFamily.UNIX);
        try {
            channel.bind(UnixDomainSocketAddress.of(socketPath));
        } catch (IOException e) {
            channel.close();
            throw new IOException("listen on " + socketPath + ": " + e.getMessage(), e);
        }
        if (permissions != null) {
            try {
                Files.setPosixFilePermissions(socketPath, permissions);
            } catch (IOException | UnsupportedOperationException e) {
                channel.close();
                Files.deleteIfExists(socketPath);
                throw new IOException("chmod " + socketPath + ": " + e.getMessage(), e);
            }
        }
        listener = channel;
        log.debug("rpc server bound to {}", socketPath);
    }

    public void serve() throws IOException {
        ServerSocketChannel channel = listener;
        if (channel == null) {
            throw new IllegalStateException("serve() called before bind()");
        }
        try {
            while (!stopping.get()) {
                SocketChannel accepted;
                try {
                    accepted = channel.accept();
                } catch (ClosedChannelException e) {
                    if (stopping.get()) {
                        break;
                    }
                    throw e;
                }
                RpcConnection connection = new RpcConnection(accepted);
                synchronized (activeLock) {
                    if (stopping.get()) {
                        connection.close();
                        break;
                    }
                    active.add(connection);
                }
                callExecutor.execute(() -> handle(connection));
            }
        } finally {
            closeListener();
        }
    }

    public void gracefulStop(Duration timeout) {
        if (!stopping.compareAndSet(false, true)) {
            return;
        }
        closeListener();
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (activeLock) {
            while (!active.isEmpty()) {
                long left = deadline - System.nanoTime();
                if (left <= 0L) {
                    log.warn("rpc server {}: {} call(s) still running after {}, closing them",
                            socketPath, active.size(), timeout);
                    break;
                }
                try {
                    TimeUnit.NANOSECONDS.timedWait(activeLock, left);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        forceClose();
    }

    public void stop() {
        if (stopping.compareAndSet(false, true)) {
            closeListener();
        }
        forceClose();
    }

    public boolean isStopped() {
        return stopping.get();
    }

    private void forceClose() {
        for (RpcConnection connection : active) {
            connection.close();
        }
        callExecutor.shutdown();
    }

    private void closeListener() {
        ServerSocketChannel channel = listener;
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("closing listener {}: {}", socketPath, e.getMessage());
        }
        try {
            Files.deleteIfExists(socketPath);
        } catch (IOException e) {
            log.warn("cannot remove socket file {}: {}", socketPath, e.getMessage());
        }
    }

    private void handle(RpcConnection connection) {
        String methodName = null;
        ServerReader<?> reader = null;
        try {
            RpcFrame first = connection.receive();
            if (first == null) {
                return;
            }
            if (first.kind() != RpcFrame.Kind.CALL) {
                connection.send(RpcFrame.error(RpcException.Code.INVALID_ARGUMENT, "expected CALL frame"));
                return;
            }
            methodName = first.method();
            Registration<?, ?> registration = methodName == null ? null : methods.get(methodName);
            if (registration == null) {
                connection.send(RpcFrame.error(RpcException.Code.UNIMPLEMENTED, "unknown method " + methodName));
                return;
            }
            reader = registration.reader(connection);
            registration.dispatch(connection, reader);
            connection.send(RpcFrame.ok());
        } catch (RpcException e) {
            log.debug("rpc {} failed: {}", methodName, e.getMessage());
            sendQuietly(connection, RpcFrame.error(e.code(), e.getMessage()));
        } catch (IOException e) {
            if (!connection.isClosed()) {
                log.debug("rpc {} transport error: {}", methodName, e.getMessage());
            }
        } catch (RuntimeException e) {
            log.warn("rpc {} handler error", methodName, e);
            sendQuietly(connection, RpcFrame.error(RpcException.Code.INTERNAL, String.valueOf(e.getMessage())));
        } finally {
            if (reader == null || !reader.halfClosed) {
                drainUntilHalfClose(connection);
            }
            connection.close();
            synchronized (activeLock) {
                active.remove(connection);
                activeLock.notifyAll();
            }
        }
    }

    // Closing while the client is still writing makes its writes fail with a broken pipe.
    private static void drainUntilHalfClose(RpcConnection connection) {
        if (connection.isClosed()) {
            return;
        }
        try {
            RpcFrame frame;
            while ((frame = connection.receive()) != null) {
                if (frame.kind() == RpcFrame.Kind.HALF_CLOSE) {
                    return;
                }
            }
        } catch (IOException e) {
            log.trace("draining call frames: {}", e.getMessage());
        }
    }

    private static void sendQuietly(RpcConnection connection, RpcFrame frame) {
        try {
            connection.send(frame);
        } catch (IOException e) {
            log.debug("cannot send status frame: {}", e.getMessage());
        }
    }

    private static void requireKind(RpcMethod<?, ?> method, RpcMethod.Kind kind) {
        if (method.kind() != kind) {
            throw new IllegalArgumentException("method " + method.name() + " is " + method.kind() + ", not " + kind);
        }
    }

    private record Registration<Req, Resp>(RpcMethod<Req, Resp> method, Object handler) {

        ServerReader<Req> reader(RpcConnection connection) {
            return new ServerReader<>(connection, method.requestType());
        }

        @SuppressWarnings("unchecked")
        void dispatch(RpcConnection connection, ServerReader<?> rawReader) throws IOException {
            ServerReader<Req> reader = (ServerReader<Req>) rawReader;
            MessageWriter<Resp> writer = response -> connection.send(RpcFrame.message(RpcConnection.encode(response)));
            switch (method.kind()) {
                case UNARY -> {
                    Req request = reader.receive();
                    if (request == null) {
                        throw new RpcException(RpcException.Code.INVALID_ARGUMENT,
                                method.name() + ": missing request message");
                    }
                    // The client half-closes right after its request; take that before answering.
                    if (reader.receive() != null) {
                        throw new RpcException(RpcException.Code.INVALID_ARGUMENT,
                                method.name() + ": more than one request message");
                    }
                    writer.send(((ServerCalls.Unary<Req, Resp>) handler).invoke(request));
                }
                case CLIENT_STREAMING -> writer.send(((ServerCalls.ClientStreaming<Req, Resp>) handler).invoke(reader));
                case BIDI_STREAMING -> ((ServerCalls.BidiStreaming<Req, Resp>) handler).invoke(reader, writer);
                default -> throw new RpcException(RpcException.Code.UNIMPLEMENTED, "unsupported kind " + method.kind());
            }
        }
    }

    private static final class ServerReader<T> implements MessageReader<T> {
        private final RpcConnection connection;
        private final Class<T> type;
        private volatile boolean halfClosed;

        private ServerReader(RpcConnection connection, Class<T> type) {
            this.connection = connection;
            this.type = type;
        }

        @Override
        public T receive() throws IOException {
            if (halfClosed) {
                return null;
            }
            RpcFrame frame = connection.receive();
            if (frame == null) {
                throw new RpcException(RpcException.Code.CANCELLED, "client closed the connection");
            }
            if (frame.kind() == RpcFrame.Kind.HALF_CLOSE) {
                halfClosed = true;
                return null;
            }
            if (frame.kind() != RpcFrame.Kind.MESSAGE) {
                throw new RpcException(RpcException.Code.INVALID_ARGUMENT, "unexpected " + frame.kind() + " frame");
            }
            return RpcConnection.decode(frame.payload(), type);
        }
    }
}
