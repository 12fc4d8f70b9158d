package io.netwarden.model;

public record LogMessage(String text) {
}
