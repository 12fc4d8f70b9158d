package io.netwarden.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.netwarden.signal.SignalNames;
import io.netwarden.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

public record DaemonSettings(
        long softCancelGraceMs,
        long gracefulStopTimeoutMs,
        long cascadeQuitTimeoutMs,
        List<String> forwardSignals,
        List<String> overrideInstallCommand,
        List<String> overrideRemoveCommand,
        List<String> overrideCheckCommand,
        long overrideCommandTimeoutMs
) {
    public static final long DEFAULT_SOFT_CANCEL_GRACE_MS = 5_000L;
    public static final long DEFAULT_GRACEFUL_STOP_TIMEOUT_MS = 15_000L;
    public static final long DEFAULT_CASCADE_QUIT_TIMEOUT_MS = 2_000L;
    public static final long DEFAULT_OVERRIDE_COMMAND_TIMEOUT_MS = 10_000L;

    public DaemonSettings {
        forwardSignals = forwardSignals == null ? List.of() : List.copyOf(forwardSignals);
        overrideInstallCommand = overrideInstallCommand == null ? List.of() : List.copyOf(overrideInstallCommand);
        overrideRemoveCommand = overrideRemoveCommand == null ? List.of() : List.copyOf(overrideRemoveCommand);
        overrideCheckCommand = overrideCheckCommand == null ? List.of() : List.copyOf(overrideCheckCommand);
    }

    public static DaemonSettings defaults() {
        return new DaemonSettings(
                DEFAULT_SOFT_CANCEL_GRACE_MS,
                DEFAULT_GRACEFUL_STOP_TIMEOUT_MS,
                DEFAULT_CASCADE_QUIT_TIMEOUT_MS,
                SignalNames.FORWARDED,
                List.of(),
                List.of(),
                List.of(),
                DEFAULT_OVERRIDE_COMMAND_TIMEOUT_MS
        );
    }

    public static DaemonSettings load(Path file) throws IOException {
        if (file == null || !Files.exists(file)) {
            return defaults();
        }
        SettingsFile raw;
        try {
            raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
        } catch (IOException e) {
            throw new IOException("Failed to read settings file " + file + ": " + e.getMessage(), e);
        }
        return fromFile(raw, defaults());
    }

    static DaemonSettings fromFile(SettingsFile file, DaemonSettings defaults) {
        if (file == null) {
            return defaults;
        }
        List<String> signals = file.forwardSignals() == null
                ? defaults.forwardSignals()
                : SignalNames.forwardable(file.forwardSignals());
        return new DaemonSettings(
                sanitizeLong(file.softCancelGraceMs(), defaults.softCancelGraceMs(), 1L),
                sanitizeLong(file.gracefulStopTimeoutMs(), defaults.gracefulStopTimeoutMs(), 0L),
                sanitizeLong(file.cascadeQuitTimeoutMs(), defaults.cascadeQuitTimeoutMs(), 1L),
                signals,
                sanitizeCommand(file.overrideInstallCommand(), defaults.overrideInstallCommand()),
                sanitizeCommand(file.overrideRemoveCommand(), defaults.overrideRemoveCommand()),
                sanitizeCommand(file.overrideCheckCommand(), defaults.overrideCheckCommand()),
                sanitizeLong(file.overrideCommandTimeoutMs(), defaults.overrideCommandTimeoutMs(), 100L)
        );
    }

    @JsonIgnore
    public Duration softCancelGrace() {
        return Duration.ofMillis(softCancelGraceMs);
    }

    @JsonIgnore
    public Duration gracefulStopTimeout() {
        return Duration.ofMillis(gracefulStopTimeoutMs);
    }

    @JsonIgnore
    public Duration cascadeQuitTimeout() {
        return Duration.ofMillis(cascadeQuitTimeoutMs);
    }

    @JsonIgnore
    public Duration overrideCommandTimeout() {
        return Duration.ofMillis(overrideCommandTimeoutMs);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null || raw < min) {
            return fallback;
        }
        return raw;
    }

    private static List<String> sanitizeCommand(List<String> raw, List<String> fallback) {
        if (raw == null) {
            return fallback;
        }
        List<String> out = new ArrayList<>();
        for (String token : raw) {
            if (token != null && !token.isBlank()) {
                out.add(token);
            }
        }
        return out;
    }

    record SettingsFile(
            Long softCancelGraceMs,
            Long gracefulStopTimeoutMs,
            Long cascadeQuitTimeoutMs,
            List<String> forwardSignals,
            List<String> overrideInstallCommand,
            List<String> overrideRemoveCommand,
            List<String> overrideCheckCommand,
            Long overrideCommandTimeoutMs
    ) {
    }
}
