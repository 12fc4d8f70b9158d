package io.netwarden.rpc;

import java.io.IOException;

public interface ClientStreamingCall<Req, Resp> extends MessageWriter<Req> {

    Resp closeAndReceive() throws IOException;

    void cancel();
}
