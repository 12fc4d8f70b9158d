package io.netwarden.rpc;

import io.netwarden.util.Jsons;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ReadableByteChannel;
import java.nio.channels.WritableByteChannel;

final class FrameCodec {
    static final int MAX_FRAME_BYTES = 8 * 1024 * 1024;

    private FrameCodec() {
    }

    static void write(WritableByteChannel channel, RpcFrame frame) throws IOException {
        byte[] body = Jsons.compactMapper().writeValueAsBytes(frame);
        if (body.length > MAX_FRAME_BYTES) {
            throw new RpcException(RpcException.Code.INVALID_ARGUMENT,
                    "frame of " + body.length + " bytes exceeds limit " + MAX_FRAME_BYTES);
        }
        ByteBuffer buffer = ByteBuffer.allocate(4 + body.length);
        buffer.putInt(body.length);
        buffer.put(body);
        buffer.flip();
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
    }

    static RpcFrame read(ReadableByteChannel channel) throws IOException {
        ByteBuffer header = ByteBuffer.allocate(4);
        if (!readFully(channel, header, true)) {
            return null;
        }
        header.flip();
        int length = header.getInt();
        if (length < 0 || length > MAX_FRAME_BYTES) {
            throw new RpcException(RpcException.Code.INTERNAL, "invalid frame length " + length);
        }
        ByteBuffer body = ByteBuffer.allocate(length);
        readFully(channel, body, false);
        return Jsons.compactMapper().readValue(body.array(), RpcFrame.class);
    }

    private static boolean readFully(ReadableByteChannel channel, ByteBuffer buffer, boolean eofAllowed)
            throws IOException {
        while (buffer.hasRemaining()) {
            int n = channel.read(buffer);
            if (n < 0) {
                if (eofAllowed && buffer.position() == 0) {
                    return false;
                }
                throw new EOFException("connection closed inside a frame");
            }
        }
        return true;
    }
}
