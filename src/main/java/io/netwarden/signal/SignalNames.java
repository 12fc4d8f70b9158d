package io.netwarden.signal;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public final class SignalNames {
    public static final List<String> SHUTDOWN = List.of("INT", "TERM");

    public static final List<String> FORWARDED = List.of("INT", "TERM");

    // Cannot be caught, so they can never be forwarded.
    private static final Set<String> UNCATCHABLE = Set.of("KILL", "STOP");

    private SignalNames() {
    }

    public static String normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("signal name cannot be empty");
        }
        String name = raw.trim().toUpperCase(Locale.ROOT);
        return name.startsWith("SIG") ? name.substring(3) : name;
    }

    public static List<String> forwardable(Collection<String> raw) {
        List<String> out = new ArrayList<>();
        if (raw == null) {
            return out;
        }
        for (String entry : raw) {
            if (entry == null || entry.isBlank()) {
                continue;
            }
            String name = normalize(entry);
            if (!UNCATCHABLE.contains(name) && !out.contains(name)) {
                out.add(name);
            }
        }
        return out;
    }
}
