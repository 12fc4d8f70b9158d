package io.netwarden.supervisor;

public final class SupervisorException extends IllegalStateException {
    public SupervisorException(String message) {
        super(message);
    }
}
