package io.netwarden.rpc;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;

final class SocketClientCall<Req, Resp> implements ClientStream<Req, Resp>, ClientStreamingCall<Req, Resp> {
    private final RpcMethod<Req, Resp> method;
    private final RpcConnection connection;
    private final AtomicBoolean sendClosed = new AtomicBoolean(false);
    private final AtomicBoolean expired = new AtomicBoolean(false);
    private volatile boolean finished;

    SocketClientCall(RpcMethod<Req, Resp> method, RpcConnection connection) {
        this.method = method;
        this.connection = connection;
    }

    @Override
    public void send(Req message) throws IOException {
        if (sendClosed.get()) {
            throw new IllegalStateException(method.name() + ": send after closeSend");
        }
        connection.send(RpcFrame.message(RpcConnection.encode(message)));
    }

    @Override
    public void closeSend() throws IOException {
        if (sendClosed.compareAndSet(false, true)) {
            connection.send(RpcFrame.halfClose());
        }
    }

    @Override
    public Resp receive() throws IOException {
        if (finished) {
            return null;
        }
        RpcFrame frame = connection.receive();
        if (frame == null) {
            throw new RpcException(RpcException.Code.UNAVAILABLE, method.name() + ": server closed the connection");
        }
        switch (frame.kind()) {
            case MESSAGE -> {
                return RpcConnection.decode(frame.payload(), method.responseType());
            }
            case STATUS -> {
                finished = true;
                connection.close();
                if (frame.isOk()) {
                    return null;
                }
                throw new RpcException(RpcException.Code.parse(frame.code()), method.name() + ": " + frame.message());
            }
            default -> throw new RpcException(RpcException.Code.INTERNAL,
                    method.name() + ": unexpected " + frame.kind() + " frame from server");
        }
    }

    @Override
    public Resp closeAndReceive() throws IOException {
        closeSend();
        Resp response = receive();
        if (response == null) {
            throw new RpcException(RpcException.Code.INTERNAL, method.name() + ": call ended without a response");
        }
        // Drain the trailing status so server-side failures after the response still surface.
        Resp extra = receive();
        if (extra != null) {
            throw new RpcException(RpcException.Code.INTERNAL, method.name() + ": more than one response");
        }
        return response;
    }

    @Override
    public void cancel() {
        connection.close();
    }

    void expire() {
        expired.set(true);
        connection.close();
    }

    boolean deadlineExceeded() {
        return expired.get();
    }
}
