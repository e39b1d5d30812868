package org.aipomoea.processing;

import org.aipomoea.metrics.CommandInfo;
import org.aipomoea.metrics.ExecutionInfo;
import org.aipomoea.metrics.StatusHelper;
import org.aipomoea.model.Command;
import org.aipomoea.model.CommandResolver;
import org.aipomoea.model.ImageSet;
import org.aipomoea.util.ConcurrencyUtils;

import java.nio.file.NoSuchFileException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs every enabled command of a recipe over the image set. Commands are independent: one that cannot be resolved
 * or fails outright is recorded and the others keep going.
 */
public class CommandDispatcher {

    private static final Logger LOGGER = Logger.getLogger(CommandDispatcher.class.getName());

    public static final String COMMAND_ERROR = "FBIN1";
    public static final String BINARY_NOT_FOUND = "FBIN3";

    private final CommandResolver resolver;
    private final BatchScheduler scheduler;
    private final List<String> flags;
    private final int parallelism;

    public CommandDispatcher(CommandResolver resolver, BatchScheduler scheduler, List<String> flags, int parallelism) {
        this.resolver = resolver;
        this.scheduler = scheduler;
        this.flags = List.copyOf(flags);
        this.parallelism = Math.max(1, parallelism);
    }

    /**
     * Runs the commands concurrently, one task per command on a pool bounded by the available processors.
     */
    public ExecutionInfo dispatch(List<String> commandNames, ImageSet images) {
        final Instant start = Instant.now();
        if (commandNames.isEmpty()) {
            System.out.println("No commands enabled, nothing to dispatch.");
            return new ExecutionInfo(Duration.ZERO, List.of());
        }

        final int poolSize = Math.min(parallelism, commandNames.size());
        System.out.printf("Dispatching %d commands over %d images using %d threads.%n", commandNames.size(),
                images.size(), poolSize);
        final ExecutorService commandExecutor = Executors.newFixedThreadPool(poolSize,
                ConcurrencyUtils.createPlatformThreadFactory("CommandExec-"));

        final List<CommandInfo> results;
        try {
            final List<CompletableFuture<CommandInfo>> futures = new ArrayList<>();
            for (String name : commandNames)
                futures.add(CompletableFuture.supplyAsync(() -> runCommand(name, images), commandExecutor));
            results = ConcurrencyUtils.waitForCompletableFuturesAndCollect("Command", futures, "dispatch");
        } finally {
            ConcurrencyUtils.shutdownExecutorService(commandExecutor, "CommandExecutor");
        }

        if (results.size() < commandNames.size()) {
            // a command task that escaped runCommand left no result: account for it as failed
            final List<CommandInfo> complete = new ArrayList<>(results);
            for (String name : commandNames) {
                if (results.stream().noneMatch(r -> r.commandName().equals(name)))
                    complete.add(StatusHelper.createFailedCommandInfo(name, COMMAND_ERROR,
                            new IllegalStateException("Command task produced no result")));
            }
            return new ExecutionInfo(Duration.between(start, Instant.now()), List.copyOf(complete));
        }
        return new ExecutionInfo(Duration.between(start, Instant.now()), List.copyOf(results));
    }

    /**
     * Runs the commands one after another on the calling thread.
     */
    public ExecutionInfo dispatchSequential(List<String> commandNames, ImageSet images) {
        final Instant start = Instant.now();
        System.out.printf("Dispatching %d commands sequentially over %d images.%n", commandNames.size(), images.size());
        final List<CommandInfo> results = new ArrayList<>();
        for (String name : commandNames)
            results.add(runCommand(name, images));
        return new ExecutionInfo(Duration.between(start, Instant.now()), List.copyOf(results));
    }

    CommandInfo runCommand(String name, ImageSet images) {
        try {
            final Command command = resolver.resolve(name, flags).orElse(null);
            if (command == null) {
                LOGGER.log(Level.SEVERE, "{0} - Binary for command {1} not found in {2}",
                        new Object[]{BINARY_NOT_FOUND, name, resolver.modelsDir()});
                return StatusHelper.createFailedCommandInfo(name, BINARY_NOT_FOUND,
                        new NoSuchFileException(resolver.modelsDir().resolve(name).toString()));
            }
            return scheduler.schedule(command, images);
        } catch (final RuntimeException e) {
            LOGGER.log(Level.SEVERE, COMMAND_ERROR + " - Command " + name + " failed", e);
            return StatusHelper.createFailedCommandInfo(name, COMMAND_ERROR, e);
        }
    }
}
