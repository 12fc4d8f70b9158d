package io.netwarden;

import io.netwarden.cli.NetWardenCommand;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = NetWardenCommand.commandLine().execute(args);
        System.exit(code);
    }
}
