package io.netwarden.daemon;

import io.netwarden.config.DaemonSettings;
import io.netwarden.config.NetWardenConfig;
import io.netwarden.model.NetWardenVersion;
import io.netwarden.network.CommandNetworkOverrideInstaller;
import io.netwarden.network.NetworkOverrideInstaller;
import io.netwarden.signal.ProcessSignalHub;
import io.netwarden.signal.SignalHub;
import io.netwarden.supervisor.Supervisor;
import io.netwarden.supervisor.Worker;
import io.netwarden.supervisor.WorkerException;
import io.netwarden.supervisor.WorkerHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.BooleanSupplier;

public final class DaemonRunner {
    private static final Logger log = LoggerFactory.getLogger(DaemonRunner.class);

    private final DaemonService service;
    private final boolean skipOverride;
    private final BooleanSupplier privileged;

    DaemonRunner(DaemonService service, boolean skipOverride, BooleanSupplier privileged) {
        this.service = service;
        this.skipOverride = skipOverride;
        this.privileged = privileged;
    }

    public static DaemonRunner create(
            NetWardenConfig config,
            DaemonSettings settings,
            String dns,
            String fallback,
            boolean skipOverride
    ) {
        return create(config, settings, new CommandNetworkOverrideInstaller(settings, dns, fallback),
                ProcessSignalHub.instance(), skipOverride, PrivilegeCheck::isRoot);
    }

    static DaemonRunner create(
            NetWardenConfig config,
            DaemonSettings settings,
            NetworkOverrideInstaller installer,
            SignalHub signals,
            boolean skipOverride,
            BooleanSupplier privileged
    ) {
        return new DaemonRunner(new DaemonService(config, settings, installer, signals), skipOverride, privileged);
    }

    DaemonService service() {
        return service;
    }

    public void run() throws DaemonStartupException, DaemonExitedException {
        List<WorkerException> errors = runSupervised();
        throw new DaemonExitedException("netwarden daemon", errors);
    }

    List<WorkerException> runSupervised() throws DaemonStartupException {
        if (!privileged.getAsBoolean()) {
            throw new DaemonStartupException("netwarden daemon must run as root");
        }
        log.info("---");
        log.info("netwarden daemon {} starting...", NetWardenVersion.display());
        log.info("PID is {}", ProcessHandle.current().pid());

        Supervisor supervisor = new Supervisor(log);
        WorkerHandle daemon = supervisor.supervise(Worker.of("daemon", service::serveRpc));
        supervisor.supervise(Worker.of("setup", p -> service.installInitialOverride(p, skipOverride)).requires(daemon));

        List<WorkerException> errors;
        try {
            errors = supervisor.run();
        } finally {
            service.releaseOnExit();
        }
        for (WorkerException error : errors) {
            log.error("{}", error.getMessage());
        }
        log.info("netwarden daemon is done.");
        return errors;
    }
}
