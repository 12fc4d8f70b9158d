package io.netwarden.rpc;

import java.io.IOException;

@FunctionalInterface
public interface MessageReader<T> {
    // null once the sender has half-closed its side.
    T receive() throws IOException;
}
