package io.netwarden.rpc;

import java.io.IOException;

public final class ServerCalls {
    private ServerCalls() {
    }

    @FunctionalInterface
    public interface Unary<Req, Resp> {
        Resp invoke(Req request) throws IOException;
    }

    @FunctionalInterface
    public interface ClientStreaming<Req, Resp> {
        Resp invoke(MessageReader<Req> requests) throws IOException;
    }

    @FunctionalInterface
    public interface BidiStreaming<Req, Resp> {
        void invoke(MessageReader<Req> requests, MessageWriter<Resp> responses) throws IOException;
    }
}
