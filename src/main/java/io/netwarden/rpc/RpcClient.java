package io.netwarden.rpc;

import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.SocketChannel;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

public final class RpcClient {
    private static final ScheduledExecutorService DEADLINES = Executors.newSingleThreadScheduledExecutor(runnable -> {
        Thread thread = new Thread(runnable, "netwarden-rpc-deadline");
        thread.setDaemon(true);
        return thread;
    });

    private final Path socketPath;

    private RpcClient(Path socketPath) {
        this.socketPath = socketPath;
    }

    public static RpcClient forSocket(Path socketPath) {
        return new RpcClient(socketPath.toAbsolutePath());
    }

    public Path socketPath() {
        return socketPath;
    }

    public <Req, Resp> Resp unary(RpcMethod<Req, Resp> method, Req request) throws IOException {
        return unary(method, request, null);
    }

    public <Req, Resp> Resp unary(RpcMethod<Req, Resp> method, Req request, Duration timeout) throws IOException {
        requireKind(method, RpcMethod.Kind.UNARY);
        SocketClientCall<Req, Resp> call = open(method);
        ScheduledFuture<?> deadline = timeout == null ? null : scheduleDeadline(call, timeout);
        try {
            call.send(request);
            return call.closeAndReceive();
        } catch (IOException e) {
            if (call.deadlineExceeded()) {
                throw new RpcException(RpcException.Code.DEADLINE_EXCEEDED,
                        method.name() + ": no answer within " + timeout, e);
            }
            throw e;
        } finally {
            if (deadline != null) {
                deadline.cancel(false);
            }
            call.cancel();
        }
    }

    public <Req, Resp> ClientStreamingCall<Req, Resp> clientStreaming(RpcMethod<Req, Resp> method) throws IOException {
        requireKind(method, RpcMethod.Kind.CLIENT_STREAMING);
        return open(method);
    }

    public <Req, Resp> ClientStream<Req, Resp> bidiStreaming(RpcMethod<Req, Resp> method) throws IOException {
        requireKind(method, RpcMethod.Kind.BIDI_STREAMING);
        return open(method);
    }

    private <Req, Resp> SocketClientCall<Req, Resp> open(RpcMethod<Req, Resp> method) throws IOException {
        SocketChannel channel;
        try {
            channel = SocketChannel.open(StandardProtocolFamily.UNIX);
        } catch (IOException e) {
            throw new RpcException(RpcException.Code.UNAVAILABLE, "open socket: " + e.getMessage(), e);
        }
        try {
            channel.connect(UnixDomainSocketAddress.of(socketPath));
        } catch (IOException e) {
            channel.close();
            throw new RpcException(RpcException.Code.UNAVAILABLE, "dial " + socketPath + ": " + e.getMessage(), e);
        }
        RpcConnection connection = new RpcConnection(channel);
        try {
            connection.send(RpcFrame.call(method.name()));
        } catch (IOException e) {
            connection.close();
            throw new RpcException(RpcException.Code.UNAVAILABLE, method.name() + ": " + e.getMessage(), e);
        }
        return new SocketClientCall<>(method, connection);
    }

    private static ScheduledFuture<?> scheduleDeadline(SocketClientCall<?, ?> call, Duration timeout) {
        return DEADLINES.schedule(call::expire, timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    private static void requireKind(RpcMethod<?, ?> method, RpcMethod.Kind kind) {
        if (method.kind() != kind) {
            throw new IllegalArgumentException("method " + method.name() + " is " + method.kind() + ", not " + kind);
        }
    }
}
