package io.netwarden.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import io.netwarden.util.Jsons;

import java.io.IOException;
import java.nio.channels.SocketChannel;
import java.util.concurrent.atomic.AtomicBoolean;

final class RpcConnection implements AutoCloseable {
    private final SocketChannel channel;
    private final Object writeLock = new Object();
    private final Object readLock = new Object();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    RpcConnection(SocketChannel channel) {
        this.channel = channel;
    }

    void send(RpcFrame frame) throws IOException {
        synchronized (writeLock) {
            FrameCodec.write(channel, frame);
        }
    }

    RpcFrame receive() throws IOException {
        synchronized (readLock) {
            return FrameCodec.read(channel);
        }
    }

    boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            try {
                channel.close();
            } catch (IOException ignored) {
                // Nothing left to release.
            }
        }
    }

    static JsonNode encode(Object message) {
        return message == null ? null : Jsons.compactMapper().valueToTree(message);
    }

    static <T> T decode(JsonNode payload, Class<T> type) throws RpcException {
        if (payload == null || payload.isNull()) {
            return null;
        }
        try {
            return Jsons.compactMapper().treeToValue(payload, type);
        } catch (IOException e) {
            throw new RpcException(RpcException.Code.INTERNAL,
                    "cannot decode " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }
}
