package org.aipomoea.plugin;

import org.aipomoea.model.Command;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link ProcessInvoker} backed by {@link ProcessBuilder}. The working directory is handed to the spawned process,
 * the caller's own working directory is never changed, so concurrent invocations do not interfere.
 */
public class ExternalProcessInvoker implements ProcessInvoker {

    private static final Logger LOGGER = Logger.getLogger(ExternalProcessInvoker.class.getName());

    private static final ExecutorService STREAM_DRAINER = Executors.newCachedThreadPool(runnable -> {
        final Thread thread = new Thread(runnable, "ProcessStreamDrainer");
        thread.setDaemon(true);
        return thread;
    });

    private final Duration timeout;

    /**
     * @param timeout maximum time to wait for one invocation; {@link Duration#ZERO} waits indefinitely
     */
    public ExternalProcessInvoker(Duration timeout) {
        this.timeout = timeout == null ? Duration.ZERO : timeout;
    }

    public ExternalProcessInvoker() {
        this(Duration.ZERO);
    }

    @Override
    public InvocationResult invoke(Command command, List<Path> images) throws InterruptedException {
        final List<String> argv = new ArrayList<>();
        argv.add(command.binaryPath().toString());
        argv.addAll(command.flags());
        images.forEach(p -> argv.add(p.toString()));

        final ProcessBuilder builder = new ProcessBuilder(argv).directory(command.workingDir().toFile());
        final Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            return InvocationResult.failure(new ProcessInvocationException(
                    "Could not start " + command.binaryPath() + ": " + e.getMessage(), ProcessInvocationException.NOT_STARTED, e));
        }
        LOGGER.log(Level.FINE, "Started {0} (pid {1}) with {2} images", new Object[]{command.name(), process.pid(), images.size()});

        final CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()), STREAM_DRAINER);
        final CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()), STREAM_DRAINER);

        try {
            if (timeout.isZero()) {
                process.waitFor();
            } else if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                return InvocationResult.failure(new ProcessInvocationException(
                        command.name() + " did not finish within " + timeout.toSeconds() + "s", ProcessInvocationException.TIMED_OUT));
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        }

        final int exitCode = process.exitValue();
        try {
            if (exitCode != 0) {
                return InvocationResult.failure(new ProcessInvocationException(
                        command.name() + " exited with code " + exitCode + describeStderr(stderr.get()), exitCode));
            }
            return InvocationResult.success(splitLines(stdout.get()));
        } catch (ExecutionException e) {
            return InvocationResult.failure(new ProcessInvocationException(
                    "Could not read output of " + command.name() + ": " + e.getCause().getMessage(), exitCode, e.getCause()));
        }
    }

    static List<String> splitLines(String output) {
        final String trimmed = output.strip();
        if (trimmed.isEmpty())
            return List.of();
        return Arrays.asList(trimmed.split("\\R"));
    }

    private static String describeStderr(String stderr) {
        final String text = stderr.strip();
        return text.isEmpty() ? "" : ": " + text;
    }

    private static String drain(InputStream stream) {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
