package io.netwarden.model;

public record VersionResponse(
        int apiVersion,
        String version
) {
}
