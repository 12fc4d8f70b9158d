package io.netwarden.model;

public enum DaemonStatus {
    OK,
    PAUSED,
    NO_NETWORK
}
