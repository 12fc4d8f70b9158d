package io.netwarden.cli;

import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NetWardenCommandTest {
    @Test
    void runPassesEveryTokenAfterTheCommandThrough() {
        CommandLine.ParseResult parsed = NetWardenCommand.commandLine()
                .parseArgs("--run-dir", "/tmp/nw", "run", "ls", "-la", "--color=never", "/etc");

        CommandLine.ParseResult run = parsed.subcommand();
        NetWardenCommand.RunCommand command = (NetWardenCommand.RunCommand) run.commandSpec().userObject();
        assertEquals(List.of("ls", "-la", "--color=never", "/etc"), command.osArgs);
        assertEquals("/tmp/nw", ((NetWardenCommand) parsed.commandSpec().userObject()).runDir);
    }

    @Test
    void daemonOptionsAreParsed() {
        CommandLine.ParseResult parsed = NetWardenCommand.commandLine()
                .parseArgs("daemon", "--dns", "10.0.0.53", "--fallback", "1.1.1.1", "--no-override");

        NetWardenCommand.DaemonCommand command = (NetWardenCommand.DaemonCommand) parsed.subcommand().commandSpec().userObject();
        assertEquals("10.0.0.53", command.dns);
        assertEquals("1.1.1.1", command.fallback);
        assertTrue(command.noOverride);
        assertEquals("/var/run/netwarden", ((NetWardenCommand) parsed.commandSpec().userObject()).runDir);
    }

    @Test
    void unreachableDaemonIsReportedAsError() {
        int code = NetWardenCommand.commandLine().execute("--run-dir", "/nonexistent/netwarden", "status");
        assertEquals(1, code);
    }
}
