package io.netwarden.connector;

import io.netwarden.model.CommandResult;
import io.netwarden.model.ErrorCategory;
import io.netwarden.model.RunCommandRequest;
import io.netwarden.model.RunCommandResponse;
import io.netwarden.rpc.MessageReader;
import io.netwarden.rpc.MessageWriter;
import io.netwarden.rpc.RpcException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.function.Function;

final class CommandExecution {
    private static final Logger log = LoggerFactory.getLogger(CommandExecution.class);
    private static final int CHUNK_BYTES = 4096;

    private final MessageReader<RunCommandRequest> requests;
    private final MessageWriter<RunCommandResponse> responses;
    private final Object sendLock = new Object();

    CommandExecution(MessageReader<RunCommandRequest> requests, MessageWriter<RunCommandResponse> responses) {
        this.requests = requests;
        this.responses = responses;
    }

    void execute() throws IOException {
        RunCommandRequest first = requests.receive();
        if (first == null || first.command() == null || first.command().osArgs().isEmpty()) {
            throw new RpcException(RpcException.Code.INVALID_ARGUMENT, "first RunCommand frame must carry the command");
        }
        RunCommandRequest.Command command = first.command();
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command.osArgs()));
        if (command.cwd() != null && !command.cwd().isBlank()) {
            pb.directory(new File(command.cwd()));
        }
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            send(RunCommandResponse.finished(CommandResult.error(ErrorCategory.UNKNOWN,
                    "failed to start " + command.osArgs().get(0) + ": " + e.getMessage())));
            return;
        }
        log.info("running {} in {} (pid {})", command.osArgs(), pb.directory(), process.pid());

        Thread out = copyOutput(process.getInputStream(), CommandResult::stdout, "netwarden-cmd-stdout");
        Thread err = copyOutput(process.getErrorStream(), CommandResult::stderr, "netwarden-cmd-stderr");
        Thread in = new Thread(() -> forwardInput(process), "netwarden-cmd-stdin");
        in.setDaemon(true);
        in.start();

        int exit;
        try {
            exit = process.waitFor();
            out.join();
            err.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new RpcException(RpcException.Code.CANCELLED, "interrupted while running " + command.osArgs().get(0));
        }
        log.info("{} exited with status {}", command.osArgs().get(0), exit);
        CommandResult result = exit == 0
                ? null
                : CommandResult.error(ErrorCategory.USER, command.osArgs().get(0) + ": exit status " + exit);
        send(RunCommandResponse.finished(result));
    }

    private void forwardInput(Process process) {
        OutputStream stdin = process.getOutputStream();
        boolean stdinOpen = true;
        try {
            RunCommandRequest request;
            while ((request = requests.receive()) != null) {
                if (request.wantsSoftCancel()) {
                    log.info("soft cancel received, terminating pid {}", process.pid());
                    process.destroy();
                } else if (request.data() != null && stdinOpen) {
                    try {
                        stdin.write(request.data());
                        stdin.flush();
                    } catch (IOException e) {
                        // The process stopped reading; later input is dropped.
                        log.debug("stdin of pid {} closed: {}", process.pid(), e.getMessage());
                        stdinOpen = false;
                    }
                }
            }
        } catch (IOException e) {
            // Client went away without half-closing; nobody is left to read the output.
            if (process.isAlive()) {
                log.info("client stream lost ({}), killing pid {}", e.getMessage(), process.pid());
                process.destroyForcibly();
            }
        } finally {
            try {
                stdin.close();
            } catch (IOException e) {
                log.debug("closing stdin of pid {}: {}", process.pid(), e.getMessage());
            }
        }
    }

    private Thread copyOutput(InputStream source, Function<byte[], CommandResult> wrap, String name) {
        Thread thread = new Thread(() -> {
            byte[] buffer = new byte[CHUNK_BYTES];
            try {
                int n;
                while ((n = source.read(buffer)) >= 0) {
                    if (n > 0) {
                        send(RunCommandResponse.output(wrap.apply(Arrays.copyOf(buffer, n))));
                    }
                }
            } catch (IOException e) {
                log.debug("{} stopped: {}", name, e.getMessage());
            }
        }, name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    private void send(RunCommandResponse response) throws IOException {
        synchronized (sendLock) {
            responses.send(response);
        }
    }
}
