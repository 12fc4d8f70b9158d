package io.netwarden.model;

public enum PauseError {
    NONE,
    ALREADY_PAUSED,
    CONNECTED_TO_CLUSTER,
    UNEXPECTED_PAUSE_ERROR
}
