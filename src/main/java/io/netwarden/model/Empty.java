package io.netwarden.model;

public record Empty() {
    public static final Empty INSTANCE = new Empty();
}
