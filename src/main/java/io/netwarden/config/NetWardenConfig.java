package io.netwarden.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class NetWardenConfig {
    public static final String DEFAULT_RUN_DIR = "/var/run/netwarden";
    public static final String DAEMON_SOCKET_NAME = "daemon.socket";
    public static final String CONNECTOR_SOCKET_NAME = "connector.socket";
    public static final String SETTINGS_FILE_NAME = "netwarden-settings.json";

    private final Path runDir;

    public NetWardenConfig(Path runDir) {
        this.runDir = runDir;
    }

    public static NetWardenConfig fromRunDir(String runDir) {
        Path resolved = runDir == null || runDir.isBlank()
                ? Paths.get(DEFAULT_RUN_DIR)
                : Paths.get(runDir);
        return new NetWardenConfig(resolved.toAbsolutePath().normalize());
    }

    public Path runDir() {
        return runDir;
    }

    public Path daemonSocket() {
        return runDir.resolve(DAEMON_SOCKET_NAME);
    }

    public Path connectorSocket() {
        return runDir.resolve(CONNECTOR_SOCKET_NAME);
    }

    public Path settingsFile() {
        return runDir.resolve(SETTINGS_FILE_NAME);
    }

    public Path logDir() {
        return runDir.resolve("logs");
    }
}
