package io.netwarden.signal;

import java.util.Collection;
import java.util.function.Consumer;

public interface SignalHub {

    Subscription subscribe(Collection<String> signals, Consumer<String> listener);

    @FunctionalInterface
    interface Subscription extends AutoCloseable {
        @Override
        void close();
    }
}
