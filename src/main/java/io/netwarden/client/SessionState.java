package io.netwarden.client;

public enum SessionState {
    RUNNING,
    SOFT_CANCEL_REQUESTED,
    COMPLETED,
    HARD_CANCELLED,
    FAILED
}
