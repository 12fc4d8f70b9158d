package io.netwarden.rpc;

import java.io.IOException;

public interface ClientStream<Req, Resp> extends MessageReader<Resp>, MessageWriter<Req> {

    void closeSend() throws IOException;

    void cancel();
}
