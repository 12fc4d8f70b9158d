package io.netwarden.client;

import io.netwarden.model.CommandResult;
import io.netwarden.model.RunCommandRequest;
import io.netwarden.model.RunCommandResponse;
import io.netwarden.rpc.ClientStream;
import io.netwarden.signal.SignalHub;
import io.netwarden.util.Cancellation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

public final class RemoteCommandSession {
    public static final Duration DEFAULT_SOFT_CANCEL_GRACE = Duration.ofSeconds(5);

    private static final Logger log = LoggerFactory.getLogger(RemoteCommandSession.class);
    private static final int STDIN_CHUNK_BYTES = 1024;

    private final StreamOpener opener;
    private final InputStream stdin;
    private final OutputStream stdout;
    private final OutputStream stderr;
    private final SignalHub signals;
    private final List<String> forwardSignals;
    private final Duration softCancelGrace;
    private final AtomicReference<SessionState> state;
    private final AtomicBoolean outputDone;

    public RemoteCommandSession(
            StreamOpener opener,
            InputStream stdin,
            OutputStream stdout,
            OutputStream stderr,
            SignalHub signals,
            List<String> forwardSignals,
            Duration softCancelGrace
    ) {
        this.opener = Objects.requireNonNull(opener, "opener");
        this.stdin = Objects.requireNonNull(stdin, "stdin");
        this.stdout = Objects.requireNonNull(stdout, "stdout");
        this.stderr = Objects.requireNonNull(stderr, "stderr");
        this.signals = Objects.requireNonNull(signals, "signals");
        this.forwardSignals = List.copyOf(forwardSignals);
        this.softCancelGrace = softCancelGrace == null ? DEFAULT_SOFT_CANCEL_GRACE : softCancelGrace;
        this.state = new AtomicReference<>(SessionState.RUNNING);
        this.outputDone = new AtomicBoolean(false);
    }

    public SessionState state() {
        return state.get();
    }

    public void run(List<String> osArgs, String cwd) throws IOException, CategorizedException {
        if (state.get() != SessionState.RUNNING || outputDone.get()) {
            throw new IllegalStateException("a session runs only once");
        }
        ClientStream<RunCommandRequest, RunCommandResponse> stream;
        try {
            stream = opener.open();
        } catch (IOException e) {
            state.set(SessionState.FAILED);
            printError("failed to start command: " + e.getMessage());
            throw e;
        }

        Cancellation context = new Cancellation();
        context.onCancel(stream::cancel);
        Cancellation softCancel = context.child();
        AtomicBoolean signalled = new AtomicBoolean(false);
        SignalHub.Subscription subscription = signals.subscribe(forwardSignals, signal -> {
            if (signalled.compareAndSet(false, true)) {
                softCancel.cancel("signal " + signal);
            }
        });
        try {
            try {
                stream.send(RunCommandRequest.command(osArgs, cwd));
            } catch (IOException e) {
                printError("failed to send: " + e.getMessage());
                throw e;
            }
            startPump("netwarden-stdin-pump", () -> pumpInput(context, stream));
            startPump("netwarden-cancel-pump", () -> pumpCancel(context, softCancel, signalled, stream));
            pumpOutput(context, stream);
            state.updateAndGet(current -> current == SessionState.HARD_CANCELLED ? current : SessionState.COMPLETED);
        } catch (IOException | CategorizedException | RuntimeException e) {
            state.updateAndGet(current -> current == SessionState.HARD_CANCELLED ? current : SessionState.FAILED);
            throw e;
        } finally {
            outputDone.set(true);
            subscription.close();
            try {
                stream.closeSend();
            } catch (IOException e) {
                log.debug("close send: {}", e.getMessage());
            }
            context.cancel("session finished");
        }
    }

    private void pumpOutput(Cancellation context, ClientStream<RunCommandRequest, RunCommandResponse> stream)
            throws IOException, CategorizedException {
        while (!context.isCancelled()) {
            RunCommandResponse response;
            try {
                response = stream.receive();
            } catch (IOException e) {
                if (context.isCancelled()) {
                    return;
                }
                throw new IOException("failed to read stdout/stderr stream: " + e.getMessage(), e);
            }
            if (response == null) {
                return;
            }
            if (response.finalFrame()) {
                CategorizedException failure = CategorizedException.fromResult(response.data());
                if (failure != null) {
                    throw failure;
                }
                return;
            }
            CommandResult chunk = response.data();
            if (chunk == null || chunk.data().length == 0) {
                continue;
            }
            OutputStream target = chunk.errorCategory() == 0 ? stdout : stderr;
            try {
                target.write(chunk.data());
                target.flush();
            } catch (IOException e) {
                if (context.isCancelled()) {
                    return;
                }
                throw new IOException("failed to write stdout/stderr: " + e.getMessage(), e);
            }
        }
    }

    private void pumpInput(Cancellation context, ClientStream<RunCommandRequest, RunCommandResponse> stream) {
        byte[] buffer = new byte[STDIN_CHUNK_BYTES];
        while (!context.isCancelled()) {
            int n;
            try {
                n = stdin.read(buffer);
            } catch (IOException e) {
                if (!sessionOver(context)) {
                    log.error("failed to read from stdin: {}", e.getMessage());
                }
                return;
            }
            if (n < 0) {
                return;
            }
            if (n == 0) {
                continue;
            }
            try {
                stream.send(RunCommandRequest.data(Arrays.copyOf(buffer, n)));
            } catch (IOException | IllegalStateException e) {
                if (!sessionOver(context)) {
                    log.error("failed to forward to stdin: {}", e.getMessage());
                }
                return;
            }
        }
    }

    private void pumpCancel(
            Cancellation context,
            Cancellation softCancel,
            AtomicBoolean signalled,
            ClientStream<RunCommandRequest, RunCommandResponse> stream
    ) {
        try {
            softCancel.await();
            if (!signalled.get() || sessionOver(context)) {
                return;
            }
            if (!state.compareAndSet(SessionState.RUNNING, SessionState.SOFT_CANCEL_REQUESTED)) {
                return;
            }
            try {
                stream.send(RunCommandRequest.softCancelRequest());
            } catch (IOException | IllegalStateException e) {
                if (!sessionOver(context)) {
                    log.error("failed to send soft cancel: {}", e.getMessage());
                }
                return;
            }
            if (!context.await(softCancelGrace)
                    && state.compareAndSet(SessionState.SOFT_CANCEL_REQUESTED, SessionState.HARD_CANCELLED)) {
                log.warn("remote command still running {} after soft cancel, cancelling", softCancelGrace);
                context.cancel("hard cancel");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private boolean sessionOver(Cancellation context) {
        return context.isCancelled() || outputDone.get();
    }

    private void printError(String message) {
        PrintStream printer = stderr instanceof PrintStream ps
                ? ps
                : new PrintStream(stderr, true, StandardCharsets.UTF_8);
        printer.println(message);
        printer.flush();
    }

    private static void startPump(String name, Runnable pump) {
        Thread thread = new Thread(pump, name);
        thread.setDaemon(true);
        thread.start();
    }

    @FunctionalInterface
    public interface StreamOpener {
        ClientStream<RunCommandRequest, RunCommandResponse> open() throws IOException;
    }
}
