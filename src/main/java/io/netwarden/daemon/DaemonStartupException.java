package io.netwarden.daemon;

public final class DaemonStartupException extends Exception {
    public DaemonStartupException(String message) {
        super(message);
    }
}
