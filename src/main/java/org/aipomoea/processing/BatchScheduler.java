package org.aipomoea.processing;

import org.aipomoea.config.AppConfig;
import org.aipomoea.metrics.BatchInfo;
import org.aipomoea.metrics.CommandInfo;
import org.aipomoea.metrics.Status;
import org.aipomoea.metrics.StatusHelper;
import org.aipomoea.model.Batch;
import org.aipomoea.model.Command;
import org.aipomoea.model.ExecutionRecord;
import org.aipomoea.model.ImageSet;
import org.aipomoea.plugin.InvocationResult;
import org.aipomoea.plugin.ProcessInvoker;
import org.aipomoea.util.ConcurrencyUtils;
import org.aipomoea.util.FileUtils;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs one command over the whole image set, one process invocation per batch.
 * <p>
 * A failed batch is not retried as is: its images are split into sub-batches of half its own size and each
 * sub-batch is invoked once. A failing sub-batch is recorded as an error for the command and the remaining batches
 * carry on. A failed single-image batch has nothing left to halve, so the failure is final for that image.
 * <p>
 * Batches run one after another, or all at once on a bounded pool when max performance is forced. Each batch task
 * only builds its own result list; the scheduler merges them as the tasks complete.
 */
public class BatchScheduler {

    private static final Logger LOGGER = Logger.getLogger(BatchScheduler.class.getName());

    public static final String INVOCATION_ERROR = "FBIN2";

    private final ProcessInvoker invoker;
    private final int batchSize;
    private final boolean maxPerformance;
    private final int parallelism;

    public BatchScheduler(ProcessInvoker invoker, AppConfig config) {
        this(invoker, config.effectiveBatchSize(), config.isMaxPerformance(), Runtime.getRuntime().availableProcessors());
    }

    public BatchScheduler(ProcessInvoker invoker, int batchSize, boolean maxPerformance, int parallelism) {
        if (batchSize < 1)
            throw new IllegalArgumentException("Batch size must be at least 1, got " + batchSize);
        this.invoker = invoker;
        this.batchSize = batchSize;
        this.maxPerformance = maxPerformance;
        this.parallelism = Math.max(1, parallelism);
    }

    /**
     * Contiguous batches of at most {@code batchSize} images in image-set order, numbered from 1.
     */
    public List<Batch> partition(List<Path> images) {
        final List<Batch> batches = new ArrayList<>();
        int offset = 0;
        for (List<Path> slice : FileUtils.splitIntoBuckets(images, batchSize)) {
            batches.add(new Batch(String.valueOf(batches.size() + 1), offset, slice));
            offset += slice.size();
        }
        return batches;
    }

    public CommandInfo schedule(Command command, ImageSet images) {
        final Instant commandStart = Instant.now();
        final String threadName = Thread.currentThread().getName();
        final List<Batch> batches = partition(images.paths());
        System.out.printf("%n  Command %s: %d images in %d batches (batchSize=%d, mode=%s) on T %s%n", command.name(),
                images.size(), batches.size(), batchSize, maxPerformance ? "concurrent" : "sequential", threadName);

        final List<BatchInfo> batchResults;
        try {
            batchResults = maxPerformance ? runConcurrently(command, batches) : runSequentially(command, batches);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.log(Level.SEVERE, "Command {0} interrupted while running its batches.", command.name());
            return StatusHelper.createFailedCommandInfo(command.name(), INVOCATION_ERROR, e);
        }

        final Status status = StatusHelper.determineOverallStatus(batchResults, batchResults.size(), "Command", command.name());
        System.out.printf("  Finished Command %s%n", command.name());
        return new CommandInfo(command.name(), status, Duration.between(commandStart, Instant.now()), threadName,
                List.copyOf(batchResults));
    }

    private List<BatchInfo> runSequentially(Command command, List<Batch> batches) throws InterruptedException {
        final List<BatchInfo> results = new ArrayList<>();
        for (Batch batch : batches)
            results.addAll(runBatch(command, batch));
        return results;
    }

    private List<BatchInfo> runConcurrently(Command command, List<Batch> batches) throws InterruptedException {
        final int concurrency = Math.min(parallelism, Math.max(1, batches.size()));
        final ExecutorService batchExecutor = Executors.newFixedThreadPool(concurrency,
                ConcurrencyUtils.createPlatformThreadFactory(command.name() + "-Batch-"));
        try {
            final List<Callable<List<BatchInfo>>> tasks = new ArrayList<>();
            for (Batch batch : batches)
                tasks.add(() -> runBatch(command, batch));

            final List<BatchInfo> results = new ArrayList<>();
            for (List<BatchInfo> completed : ConcurrencyUtils.collectAsCompleted("Batch", batchExecutor, tasks, command.name()))
                results.addAll(completed);
            return results;
        } finally {
            ConcurrencyUtils.shutdownExecutorService(batchExecutor, command.name() + "-BatchExecutor");
        }
    }

    /**
     * Invokes one batch and, if it fails, its half-size sub-batches.
     *
     * @return the passing batch, or the outcome of every sub-batch of a failed one
     */
    List<BatchInfo> runBatch(Command command, Batch batch) throws InterruptedException {
        final BatchInfo first = invokeBatch(command, batch);
        if (first.status() == Status.PASS)
            return List.of(first);

        final int half = batch.size() / 2;
        if (half < 1) {
            LOGGER.log(Level.SEVERE, "{0} - {1} failed at the minimum batch size, giving up on {2}: {3}",
                    new Object[]{INVOCATION_ERROR, first.batchName(), batch.images(), messageOf(first)});
            return List.of(first);
        }

        System.err.printf("      %s: failed (%s), retrying with batches of %d%n", first.batchName(), messageOf(first), half);
        final List<BatchInfo> retries = new ArrayList<>();
        int offset = batch.offset();
        for (List<Path> slice : FileUtils.splitIntoBuckets(batch.images(), half)) {
            final Batch subBatch = new Batch(batch.batchId() + "." + (retries.size() + 1), offset, slice);
            offset += slice.size();
            final BatchInfo retry = invokeBatch(command, subBatch);
            if (retry.status() == Status.FAIL) {
                LOGGER.log(Level.SEVERE, "{0} - Error while retrying smaller batch {1}: {2}",
                        new Object[]{INVOCATION_ERROR, retry.batchName(), messageOf(retry)});
            }
            retries.add(retry);
        }
        return retries;
    }

    private BatchInfo invokeBatch(Command command, Batch batch) throws InterruptedException {
        final Instant batchStart = Instant.now();
        final String threadName = Thread.currentThread().getName();
        final String batchName = batch.displayName();
        System.out.printf("      %s: invoking %s with %d images on T %s%n", batchName, command.name(), batch.size(), threadName);

        try {
            final InvocationResult result = invoker.invoke(command, batch.images());
            if (!result.isSuccess()) {
                return StatusHelper.createFailedBatchInfo(batch, batchName, Duration.between(batchStart, Instant.now()),
                        INVOCATION_ERROR, result.failure());
            }
            final List<ExecutionRecord> records = OutputParser.parse(result.lines(), command.name());
            if (records.size() != batch.size()) {
                LOGGER.log(Level.WARNING, "{0}: {1} result lines for {2} images.",
                        new Object[]{batchName, records.size(), batch.size()});
            }
            return new BatchInfo(batch.batchId(), batchName, Status.PASS, Duration.between(batchStart, Instant.now()),
                    threadName, batch.images(), records, null, null);
        } catch (final RuntimeException e) {
            LOGGER.log(Level.SEVERE, batchName + " failed unexpectedly", e);
            return StatusHelper.createFailedBatchInfo(batch, batchName, Duration.between(batchStart, Instant.now()),
                    INVOCATION_ERROR, e);
        }
    }

    private static String messageOf(BatchInfo info) {
        return info.failureCause() != null ? info.failureCause().getMessage() : "unknown cause";
    }

    public int batchSize() {
        return batchSize;
    }

    public boolean isMaxPerformance() {
        return maxPerformance;
    }
}
