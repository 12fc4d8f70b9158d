package io.netwarden.supervisor;

public record WorkerHandle(String name) {
}
