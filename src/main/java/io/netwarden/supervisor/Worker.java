package io.netwarden.supervisor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

public record Worker(
        String name,
        List<String> requires,
        Work work
) {
    public Worker {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("worker name cannot be empty");
        }
        Objects.requireNonNull(work, "work");
        requires = requires == null ? List.of() : List.copyOf(requires);
    }

    public static Worker of(String name, Work work) {
        return new Worker(name, List.of(), work);
    }

    public Worker requires(String... prerequisites) {
        List<String> merged = new ArrayList<>(requires);
        merged.addAll(Arrays.asList(prerequisites));
        return new Worker(name, merged, work);
    }

    public Worker requires(WorkerHandle... prerequisites) {
        String[] names = new String[prerequisites.length];
        for (int i = 0; i < prerequisites.length; i++) {
            names[i] = prerequisites[i].name();
        }
        return requires(names);
    }

    @FunctionalInterface
    public interface Work {
        void run(WorkerProcess process) throws Exception;
    }
}
