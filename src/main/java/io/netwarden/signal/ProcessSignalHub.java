package io.netwarden.signal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sun.misc.Signal;
import sun.misc.SignalHandler;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

public final class ProcessSignalHub implements SignalHub {
    private static final Logger log = LoggerFactory.getLogger(ProcessSignalHub.class);
    private static final ProcessSignalHub INSTANCE = new ProcessSignalHub();

    private final Map<String, Installed> installed = new HashMap<>();

    private ProcessSignalHub() {
    }

    public static ProcessSignalHub instance() {
        return INSTANCE;
    }

    @Override
    public synchronized Subscription subscribe(Collection<String> signals, Consumer<String> listener) {
        Set<String> names = new LinkedHashSet<>();
        for (String raw : signals) {
            names.add(SignalNames.normalize(raw));
        }
        for (String name : names) {
            Installed slot = installed.get(name);
            if (slot == null) {
                Installed fresh = new Installed();
                try {
                    fresh.previous = Signal.handle(new Signal(name), signal -> dispatch(fresh, name));
                } catch (IllegalArgumentException e) {
                    log.warn("cannot handle signal {}: {}", name, e.getMessage());
                    continue;
                }
                installed.put(name, fresh);
                slot = fresh;
            }
            slot.listeners.add(listener);
        }
        return () -> unsubscribe(names, listener);
    }

    private synchronized void unsubscribe(Set<String> names, Consumer<String> listener) {
        for (String name : names) {
            Installed slot = installed.get(name);
            if (slot == null || !slot.listeners.remove(listener) || !slot.listeners.isEmpty()) {
                continue;
            }
            installed.remove(name);
            try {
                Signal.handle(new Signal(name), slot.previous);
            } catch (IllegalArgumentException e) {
                log.debug("cannot restore handler for {}: {}", name, e.getMessage());
            }
        }
    }

    private static void dispatch(Installed slot, String name) {
        List<Consumer<String>> snapshot = List.copyOf(slot.listeners);
        for (Consumer<String> listener : snapshot) {
            try {
                listener.accept(name);
            } catch (RuntimeException e) {
                log.warn("signal {} listener failed", name, e);
            }
        }
    }

    private static final class Installed {
        private final List<Consumer<String>> listeners = new CopyOnWriteArrayList<>();
        private SignalHandler previous;
    }
}
