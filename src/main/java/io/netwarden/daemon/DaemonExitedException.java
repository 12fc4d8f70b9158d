package io.netwarden.daemon;

import io.netwarden.supervisor.WorkerException;

import java.util.List;

public final class DaemonExitedException extends Exception {
    private final List<WorkerException> errors;

    public DaemonExitedException(String daemonName, List<WorkerException> errors) {
        super(daemonName + " has exited" + (errors.isEmpty() ? "" : " after " + errors.size() + " worker error(s)"));
        this.errors = List.copyOf(errors);
    }

    public List<WorkerException> errors() {
        return errors;
    }
}
