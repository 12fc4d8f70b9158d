package io.netwarden.rpc;

import java.io.IOException;

@FunctionalInterface
public interface MessageWriter<T> {
    void send(T message) throws IOException;
}
