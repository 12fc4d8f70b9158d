package io.netwarden.network;

import io.netwarden.config.DaemonSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

public final class CommandNetworkOverrideInstaller implements NetworkOverrideInstaller {
    private static final Logger log = LoggerFactory.getLogger(CommandNetworkOverrideInstaller.class);
    private static final int MAX_ERROR_CHARS = 512;

    private final List<String> installCommand;
    private final List<String> removeCommand;
    private final List<String> checkCommand;
    private final Duration timeout;
    private final Map<String, String> environment;

    public CommandNetworkOverrideInstaller(DaemonSettings settings, String dns, String fallback) {
        this.installCommand = settings.overrideInstallCommand();
        this.removeCommand = settings.overrideRemoveCommand();
        this.checkCommand = settings.overrideCheckCommand();
        this.timeout = settings.overrideCommandTimeout();
        Map<String, String> env = new LinkedHashMap<>();
        env.put("NETWARDEN_DNS", dns == null ? "" : dns);
        env.put("NETWARDEN_FALLBACK", fallback == null ? "" : fallback);
        this.environment = Map.copyOf(env);
    }

    public boolean isConfigured() {
        return !installCommand.isEmpty();
    }

    @Override
    public NetworkOverride install() throws IOException {
        if (!isConfigured()) {
            throw new IOException("no network override install command configured");
        }
        CommandOutcome outcome = runCommand(installCommand);
        if (!outcome.success()) {
            throw new IOException("network override install failed: " + outcome.detail());
        }
        log.info("network override installed");
        return new CommandNetworkOverride();
    }

    private CommandOutcome runCommand(List<String> command) {
        Path output;
        try {
            output = Files.createTempFile("netwarden-override-", ".out");
        } catch (IOException e) {
            return CommandOutcome.fail(command.get(0) + ": cannot capture output: " + e.getMessage());
        }
        try {
            return runCommand(command, output);
        } finally {
            try {
                Files.deleteIfExists(output);
            } catch (IOException e) {
                log.debug("cannot remove {}: {}", output, e.getMessage());
            }
        }
    }

    // Output goes to a file, so a chatty command cannot block on a full pipe.
    private CommandOutcome runCommand(List<String> command, Path output) {
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        pb.redirectErrorStream(true);
        pb.redirectOutput(ProcessBuilder.Redirect.to(output.toFile()));
        pb.redirectInput(ProcessBuilder.Redirect.from(new File("/dev/null")));
        pb.environment().putAll(environment);
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            return CommandOutcome.fail("spawn " + command.get(0) + " failed: " + e.getMessage());
        }
        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                return CommandOutcome.fail(command.get(0) + " timeout after " + timeout);
            }
            if (process.exitValue() == 0) {
                return CommandOutcome.ok();
            }
            String combined = Files.readString(output, StandardCharsets.UTF_8);
            return CommandOutcome.fail(command.get(0) + " exit=" + process.exitValue() + " output=" + truncate(combined));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return CommandOutcome.fail(command.get(0) + " interrupted");
        } catch (IOException e) {
            return CommandOutcome.fail(command.get(0) + " exit=" + process.exitValue() + " output unreadable: " + e.getMessage());
        }
    }

    private static String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }

    private record CommandOutcome(boolean success, String detail) {
        static CommandOutcome ok() {
            return new CommandOutcome(true, null);
        }

        static CommandOutcome fail(String detail) {
            return new CommandOutcome(false, detail);
        }
    }

    private final class CommandNetworkOverride implements NetworkOverride {
        private volatile boolean closed;

        @Override
        public boolean isOkay() {
            if (closed) {
                return false;
            }
            if (checkCommand.isEmpty()) {
                return true;
            }
            CommandOutcome outcome = runCommand(checkCommand);
            if (!outcome.success()) {
                log.debug("network override check failed: {}", outcome.detail());
            }
            return outcome.success();
        }

        @Override
        public void close() throws IOException {
            if (closed) {
                return;
            }
            closed = true;
            if (removeCommand.isEmpty()) {
                return;
            }
            CommandOutcome outcome = runCommand(removeCommand);
            if (!outcome.success()) {
                throw new IOException("network override removal failed: " + outcome.detail());
            }
            log.info("network override removed");
        }
    }
}
