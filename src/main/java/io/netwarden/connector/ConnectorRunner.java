package io.netwarden.connector;

import io.netwarden.config.DaemonSettings;
import io.netwarden.config.NetWardenConfig;
import io.netwarden.daemon.DaemonExitedException;
import io.netwarden.model.NetWardenVersion;
import io.netwarden.signal.ProcessSignalHub;
import io.netwarden.signal.SignalHub;
import io.netwarden.supervisor.Supervisor;
import io.netwarden.supervisor.Worker;
import io.netwarden.supervisor.WorkerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

public final class ConnectorRunner {
    private static final Logger log = LoggerFactory.getLogger(ConnectorRunner.class);

    private final ConnectorService service;

    ConnectorRunner(ConnectorService service) {
        this.service = service;
    }

    public static ConnectorRunner create(NetWardenConfig config, DaemonSettings settings) {
        return create(config, settings, ProcessSignalHub.instance());
    }

    static ConnectorRunner create(NetWardenConfig config, DaemonSettings settings, SignalHub signals) {
        return new ConnectorRunner(new ConnectorService(config.connectorSocket(), settings, signals));
    }

    public void run() throws DaemonExitedException {
        throw new DaemonExitedException("netwarden connector", runSupervised());
    }

    List<WorkerException> runSupervised() {
        log.info("---");
        log.info("netwarden connector {} starting...", NetWardenVersion.display());
        log.info("PID is {}", ProcessHandle.current().pid());

        Supervisor supervisor = new Supervisor(log);
        supervisor.supervise(Worker.of("connector", service::serveRpc));
        List<WorkerException> errors = supervisor.run();
        for (WorkerException error : errors) {
            log.error("{}", error.getMessage());
        }
        log.info("netwarden connector is done.");
        return errors;
    }
}
