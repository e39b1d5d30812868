package org.aipomoea.util;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Utility methods for handling concurrency, executors, and futures.
 */
public final class ConcurrencyUtils {

    private static final Duration SHUTDOWN_WAIT_TIMEOUT = Duration.ofSeconds(60);

    private ConcurrencyUtils() {
    } // Prevent instantiation

    /**
     * Creates a ThreadFactory for creating named platform threads.
     */
    public static ThreadFactory createPlatformThreadFactory(final String prefix) {
        final AtomicInteger counter = new AtomicInteger(1);
        return runnable -> {
            final Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
            thread.setDaemon(false);
            return thread;
        };
    }

    /**
     * Gracefully shuts down an ExecutorService.
     */
    public static void shutdownExecutorService(final ExecutorService executor, final String name) {
        if (executor == null) return;

        executor.shutdown(); // Disable new tasks
        try {
            if (!executor.awaitTermination(SHUTDOWN_WAIT_TIMEOUT.toSeconds(), TimeUnit.SECONDS)) {
                System.err.printf("      Executor %s did not terminate in %ds, attempting forceful shutdown...%n", name, SHUTDOWN_WAIT_TIMEOUT.toSeconds());
                final List<Runnable> droppedTasks = executor.shutdownNow(); // Cancel executing tasks
                System.err.printf("      Executor %s forcing shutdown. Dropped %d waiting tasks.%n", name, droppedTasks.size());

                if (!executor.awaitTermination(SHUTDOWN_WAIT_TIMEOUT.toSeconds(), TimeUnit.SECONDS))
                    System.err.printf("      Executor %s did not terminate even after forcing.%n", name);
            }
        } catch (final InterruptedException ie) {
            System.err.printf("      Shutdown wait for executor %s interrupted. Forcing shutdown now.%n", name);
            executor.shutdownNow(); // Re-cancel if interrupted
            Thread.currentThread().interrupt(); // Preserve interrupt status
        }
    }

    /**
     * Waits for a list of CompletableFutures to complete, collects their results, and logs errors.
     * Handles exceptions during future completion and result retrieval.
     */
    public static <T> List<T> waitForCompletableFuturesAndCollect(
            final String levelName,
            final List<CompletableFuture<T>> futures,
            final Object identifier) {

        final String idStr = identifier != null ? identifier.toString() : "N/A";
        if (futures.isEmpty()) {
            System.out.printf("      No %s job to wait for (ID: %s).%n", levelName, idStr);
            return Collections.emptyList();
        }

        final List<T> results = new ArrayList<>();
        System.out.printf("      Waiting for %d %s job(s) (ID: %s)...%n", futures.size(), levelName, idStr);

        final CompletableFuture<Void> allOf = CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));

        try {
            allOf.join();
        } catch (final CancellationException e) {
            System.err.printf("!!! %s waiting (allOf) was cancelled (ID: %s).%n", levelName, idStr);
        } catch (final CompletionException e) {
            System.err.printf("!!! Unexpected error during CompletableFuture.allOf completion for %s (ID: %s): %s%n", levelName, idStr, e.getMessage());
        }

        for (final CompletableFuture<T> future : futures) {
            try {
                results.add(future.join());
            } catch (final CompletionException e) {
                System.err.printf("!!! %s job (ID: %s) completed exceptionally: %s%n", levelName, idStr, e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            } catch (final CancellationException e) {
                System.err.printf("!!! %s job (ID: %s) was cancelled.%n", levelName, idStr);
            }
        }

        System.out.printf("      Finished waiting for %s (ID: %s). Collected %d results (out of %d submitted).%n",
                levelName, idStr, results.size(), futures.size());
        return results; // Return potentially partial results
    }

    /**
     * Submits every task to {@code executor} and collects the results in completion order.
     * A task that throws is logged and contributes no result.
     */
    public static <T> List<T> collectAsCompleted(
            final String levelName,
            final ExecutorService executor,
            final List<Callable<T>> tasks,
            final Object identifier) throws InterruptedException {

        final String idStr = identifier != null ? identifier.toString() : "N/A";
        final CompletionService<T> completionService = new ExecutorCompletionService<>(executor);
        for (Callable<T> task : tasks)
            completionService.submit(task);

        final List<T> results = new ArrayList<>(tasks.size());
        for (int i = 0; i < tasks.size(); i++) {
            final Future<T> done = completionService.take();
            try {
                results.add(done.get());
            } catch (final ExecutionException e) {
                System.err.printf("!!! %s job (ID: %s) completed exceptionally: %s%n", levelName, idStr,
                        e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            } catch (final CancellationException e) {
                System.err.printf("!!! %s job (ID: %s) was cancelled.%n", levelName, idStr);
            }
        }
        return results;
    }
}
