package io.netwarden.supervisor;

import io.netwarden.util.Cancellation;
import org.slf4j.Logger;

import java.time.Duration;

public final class WorkerProcess {
    private final Supervisor supervisor;
    private final String name;
    private final Runnable onReady;

    WorkerProcess(Supervisor supervisor, String name, Runnable onReady) {
        this.supervisor = supervisor;
        this.name = name;
        this.onReady = onReady;
    }

    public String name() {
        return name;
    }

    public Supervisor supervisor() {
        return supervisor;
    }

    public void ready() {
        onReady.run();
    }

    public Cancellation shutdownSignal() {
        return supervisor.shutdownSignal();
    }

    public void awaitShutdown() throws InterruptedException {
        supervisor.shutdownSignal().await();
    }

    public boolean awaitShutdown(Duration timeout) throws InterruptedException {
        return supervisor.shutdownSignal().await(timeout);
    }

    public void log(String format, Object... args) {
        Logger logger = supervisor.logger();
        if (logger.isInfoEnabled()) {
            logger.info(name + ": " + format, args);
        }
    }
}
