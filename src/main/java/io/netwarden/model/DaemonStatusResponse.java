package io.netwarden.model;

public record DaemonStatusResponse(DaemonStatus status) {
}
