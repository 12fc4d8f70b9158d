package io.netwarden.supervisor;

public final class WorkerException extends Exception {
    private final String workerName;

    public WorkerException(String workerName, Throwable cause) {
        super("worker " + workerName + ": " + describe(cause), cause);
        this.workerName = workerName;
    }

    public String workerName() {
        return workerName;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }
}
