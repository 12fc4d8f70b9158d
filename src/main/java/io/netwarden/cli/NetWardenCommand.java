package io.netwarden.cli;

import io.netwarden.client.CategorizedException;
import io.netwarden.client.ConnectorClient;
import io.netwarden.client.DaemonClient;
import io.netwarden.client.RemoteCommandSession;
import io.netwarden.config.DaemonSettings;
import io.netwarden.config.NetWardenConfig;
import io.netwarden.connector.ConnectorRunner;
import io.netwarden.daemon.DaemonExitedException;
import io.netwarden.daemon.DaemonRunner;
import io.netwarden.daemon.DaemonStartupException;
import io.netwarden.model.Empty;
import io.netwarden.model.LogMessage;
import io.netwarden.model.NetWardenVersion;
import io.netwarden.model.PauseError;
import io.netwarden.model.PauseResponse;
import io.netwarden.model.ResumeError;
import io.netwarden.model.ResumeResponse;
import io.netwarden.model.VersionResponse;
import io.netwarden.rpc.ClientStreamingCall;
import io.netwarden.signal.ProcessSignalHub;
import io.netwarden.util.Jsons;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "netwarden",
        mixinStandardHelpOptions = true,
        description = "netwarden network daemon and control CLI",
        subcommands = {
                NetWardenCommand.DaemonCommand.class,
                NetWardenCommand.ConnectorCommand.class,
                NetWardenCommand.VersionCommand.class,
                NetWardenCommand.StatusCommand.class,
                NetWardenCommand.PauseCommand.class,
                NetWardenCommand.ResumeCommand.class,
                NetWardenCommand.QuitCommand.class,
                NetWardenCommand.LogCommand.class,
                NetWardenCommand.RunCommand.class
        }
)
public final class NetWardenCommand implements Runnable {
    static final String LOG_DIR_PROPERTY = "netwarden.log.dir";

    @Option(names = {"--run-dir"}, description = "Directory holding sockets, settings and logs",
            defaultValue = NetWardenConfig.DEFAULT_RUN_DIR)
    String runDir;

    public static CommandLine commandLine() {
        CommandLine commandLine = new CommandLine(new NetWardenCommand());
        CommandLine run = commandLine.getSubcommands().get("run");
        run.setStopAtPositional(true);
        run.setUnmatchedOptionsArePositionalParams(true);
        return commandLine;
    }

    @Override
    public void run() {
        System.out.println("Use subcommands: daemon | connector | version | status | pause | resume | quit | log | run");
    }

    NetWardenConfig config() {
        return NetWardenConfig.fromRunDir(runDir);
    }

    DaemonSettings settings() throws IOException {
        return DaemonSettings.load(config().settingsFile());
    }

    DaemonClient daemon() {
        return DaemonClient.forSocket(config().daemonSocket());
    }

    // Must run before the first logger is created, which is when logback reads its configuration.
    void directLogsToRunDir() {
        System.setProperty(LOG_DIR_PROPERTY, config().logDir().toString());
    }

    static int error(String message) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("error", message);
        System.out.println(Jsons.toJson(out));
        return 1;
    }

    @Command(name = "daemon", description = "Run the privileged root daemon")
    static final class DaemonCommand implements Callable<Integer> {
        @ParentCommand
        NetWardenCommand parent;

        @Option(names = {"--dns"}, description = "DNS server handed to the network override commands")
        String dns;

        @Option(names = {"--fallback"}, description = "Fallback DNS server handed to the network override commands")
        String fallback;

        @Option(names = {"--no-override"}, defaultValue = "false",
                description = "Start paused without installing the network override")
        boolean noOverride;

        @Override
        public Integer call() throws Exception {
            parent.directLogsToRunDir();
            DaemonRunner runner = DaemonRunner.create(parent.config(), parent.settings(), dns, fallback, noOverride);
            try {
                runner.run();
            } catch (DaemonStartupException | DaemonExitedException e) {
                System.err.println(e.getMessage());
            }
            return 1;
        }
    }

    @Command(name = "connector", description = "Run the downstream connector daemon")
    static final class ConnectorCommand implements Callable<Integer> {
        @ParentCommand
        NetWardenCommand parent;

        @Override
        public Integer call() throws Exception {
            parent.directLogsToRunDir();
            try {
                ConnectorRunner.create(parent.config(), parent.settings()).run();
            } catch (DaemonExitedException e) {
                System.err.println(e.getMessage());
            }
            return 1;
        }
    }

    @Command(name = "version", description = "Show client and daemon versions")
    static final class VersionCommand implements Callable<Integer> {
        @ParentCommand
        NetWardenCommand parent;

        @Override
        public Integer call() {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("client", new VersionResponse(NetWardenVersion.API_VERSION, NetWardenVersion.version()));
            try {
                out.put("daemon", parent.daemon().version());
            } catch (IOException e) {
                out.put("daemon", null);
                out.put("daemonError", e.getMessage());
            }
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "status", description = "Show the daemon status")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        NetWardenCommand parent;

        @Override
        public Integer call() {
            try {
                System.out.println(Jsons.toJson(parent.daemon().status()));
                return 0;
            } catch (IOException e) {
                return error(e.getMessage());
            }
        }
    }

    @Command(name = "pause", description = "Release the network override")
    static final class PauseCommand implements Callable<Integer> {
        @ParentCommand
        NetWardenCommand parent;

        @Override
        public Integer call() {
            PauseResponse response;
            try {
                response = parent.daemon().pause();
            } catch (IOException e) {
                return error(e.getMessage());
            }
            System.out.println(Jsons.toJson(response));
            return response.error() == PauseError.NONE ? 0 : 1;
        }
    }

    @Command(name = "resume", description = "Re-install the network override")
    static final class ResumeCommand implements Callable<Integer> {
        @ParentCommand
        NetWardenCommand parent;

        @Override
        public Integer call() {
            ResumeResponse response;
            try {
                response = parent.daemon().resume();
            } catch (IOException e) {
                return error(e.getMessage());
            }
            System.out.println(Jsons.toJson(response));
            return response.error() == ResumeError.NONE ? 0 : 1;
        }
    }

    @Command(name = "quit", description = "Stop the daemon and, through it, the connector")
    static final class QuitCommand implements Callable<Integer> {
        @ParentCommand
        NetWardenCommand parent;

        @Option(names = {"--connector"}, defaultValue = "false", description = "Stop only the connector daemon")
        boolean connector;

        @Override
        public Integer call() {
            try {
                if (connector) {
                    NetWardenConfig config = parent.config();
                    ConnectorClient.forSocket(config.connectorSocket())
                            .quit(parent.settings().cascadeQuitTimeout());
                } else {
                    parent.daemon().quit();
                }
            } catch (IOException e) {
                return error(e.getMessage());
            }
            System.out.println(Jsons.toJson(Empty.INSTANCE));
            return 0;
        }
    }

    @Command(name = "log", description = "Append lines read from stdin to the daemon log")
    static final class LogCommand implements Callable<Integer> {
        @ParentCommand
        NetWardenCommand parent;

        @Override
        public Integer call() {
            try {
                ClientStreamingCall<LogMessage, Empty> call = parent.daemon().logger();
                try (BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
                    String line;
                    while ((line = reader.readLine()) != null) {
                        call.send(new LogMessage(line));
                    }
                } catch (IOException e) {
                    call.cancel();
                    throw e;
                }
                call.closeAndReceive();
                return 0;
            } catch (IOException e) {
                return error(e.getMessage());
            }
        }
    }

    @Command(name = "run", description = "Run a command inside the connector daemon")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        NetWardenCommand parent;

        @Parameters(arity = "1..*", paramLabel = "COMMAND", description = "Command and its arguments")
        List<String> osArgs;

        @Override
        public Integer call() {
            NetWardenConfig config = parent.config();
            DaemonSettings settings;
            try {
                settings = parent.settings();
            } catch (IOException e) {
                System.err.println(e.getMessage());
                return 1;
            }
            ConnectorClient connector = ConnectorClient.forSocket(config.connectorSocket());
            RemoteCommandSession session = new RemoteCommandSession(
                    connector::runCommand,
                    System.in,
                    System.out,
                    System.err,
                    ProcessSignalHub.instance(),
                    settings.forwardSignals(),
                    settings.softCancelGrace()
            );
            try {
                session.run(osArgs, Paths.get("").toAbsolutePath().toString());
                return 0;
            } catch (CategorizedException e) {
                System.err.println(e.getMessage());
                return Math.max(1, e.category().code());
            } catch (IOException e) {
                System.err.println(e.getMessage());
                return 1;
            }
        }
    }
}
