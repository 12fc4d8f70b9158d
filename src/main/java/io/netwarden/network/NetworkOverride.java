package io.netwarden.network;

import java.io.Closeable;
import java.io.IOException;

public interface NetworkOverride extends Closeable {

    boolean isOkay();

    @Override
    void close() throws IOException;
}
