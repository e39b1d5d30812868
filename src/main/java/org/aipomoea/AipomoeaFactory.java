package org.aipomoea;

import org.aipomoea.aggregation.GroupKeyResolver;
import org.aipomoea.aggregation.ResultAggregator;
import org.aipomoea.aggregation.ResultTable;
import org.aipomoea.config.AppConfig;
import org.aipomoea.config.ConfigManager;
import org.aipomoea.config.ConfigurationException;
import org.aipomoea.config.PreloadingConfig;
import org.aipomoea.config.Recipe;
import org.aipomoea.config.RecipeLoader;
import org.aipomoea.export.CsvResultExporter;
import org.aipomoea.export.DatabaseResultExporter;
import org.aipomoea.export.ExportCoordinator;
import org.aipomoea.export.ExportFormat;
import org.aipomoea.export.JsonResultExporter;
import org.aipomoea.export.ResultExporter;
import org.aipomoea.metrics.BatchInfo;
import org.aipomoea.metrics.CommandInfo;
import org.aipomoea.metrics.ExecutionInfo;
import org.aipomoea.metrics.Status;
import org.aipomoea.model.CommandResolver;
import org.aipomoea.model.ImageSet;
import org.aipomoea.model.ModelRegistry;
import org.aipomoea.plugin.ExternalProcessInvoker;
import org.aipomoea.plugin.ProcessInvoker;
import org.aipomoea.processing.BatchScheduler;
import org.aipomoea.processing.CommandDispatcher;
import org.aipomoea.processing.UploadBarrier;
import org.aipomoea.util.FileUtils;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a recipe: every enabled command over the uploaded images, then the requested exports.
 * <p>
 * Inputs are found below a base directory (see {@link ConfigManager#locate}). Everything that can make the run
 * pointless (missing inputs, an unknown separation factor, a missing database table) is checked before the first
 * binary is started. After that, failures are contained per batch, per command and per export format, and whatever
 * was gathered is exported.
 */
public class AipomoeaFactory {

    private static final Logger LOGGER = Logger.getLogger(AipomoeaFactory.class.getName());

    static final String LOCK_FILE = ".factory.lock";
    static final String DEFAULT_OUTPUT_DIR = "output";

    private final Path baseDir;
    private final ProcessInvoker invoker;

    /**
     * Outcome of one run.
     */
    public record RunResult(ExecutionInfo execution, ResultTable table, Map<String, ResultTable> groups,
                            Map<ExportFormat, Status> exports) {
    }

    /**
     * @param invoker the process seam, or {@code null} to spawn the real binaries
     */
    public AipomoeaFactory(final Path baseDir, final ProcessInvoker invoker) {
        this.baseDir = Objects.requireNonNull(baseDir, "Base directory cannot be null").toAbsolutePath().normalize();
        this.invoker = invoker;
    }

    // --- Main Method ---
    public static void main(final String[] args) throws IOException {
        final Path baseDir = Path.of(args.length > 0 ? args[0] : ".");
        final Path lockFilePath = baseDir.resolve(LOCK_FILE);

        try (RandomAccessFile raf = new RandomAccessFile(lockFilePath.toFile(), "rw");
             FileChannel channel = raf.getChannel();
             FileLock lock = channel.tryLock()) {
            if (lock == null) {
                System.err.printf("!!!! WARN: Could not acquire lock (%s), another instance already running ??? %n", lockFilePath);
                throw new IllegalStateException("Skipped due to existing lock file: " + lockFilePath);
            }

            System.out.println("========================================================");
            System.out.println(" Starting Recipe Execution ");
            System.out.println("========================================================");

            final RunResult result = new AipomoeaFactory(baseDir, null).run();

            System.out.println("\n\n========================================================");
            System.out.println(" Execution Finished ");
            System.out.println("========================================================");
            printMetricsSummary(result.execution());
        } catch (final ConfigurationException e) {
            LOGGER.log(Level.SEVERE, e.getMessage(), e);
            System.exit(2);
        } catch (final InterruptedException e) {
            System.err.println("FPAR_MASTER - Execution interrupted.");
            Thread.currentThread().interrupt();
        }
    }

    // --- Metrics Printing ---
    static void printMetricsSummary(final ExecutionInfo metrics) {
        System.out.println("Total Execution Time: " + metrics.totalDuration().toMillis() + " ms");
        System.out.println("---------------------- METRICS SUMMARY ----------------------");
        for (final CommandInfo cInfo : metrics.commandInfo()) {
            final String cFailInfo = cInfo.failureCause() != null
                    ? "[" + cInfo.errorLabel() + ": " + cInfo.failureCause().getMessage() + "]" : "";
            System.out.printf("Command: %-20s | Status: %-7s | Duration: %6dms | Thread: %-16s | Batches: %d | Records: %d %s%n",
                    cInfo.commandName(), cInfo.status(), cInfo.duration().toMillis(), cInfo.threadName(),
                    cInfo.batchInfo().size(), cInfo.records().size(), cFailInfo);
            for (final BatchInfo bInfo : cInfo.batchInfo()) {
                final String retry = bInfo.isRetry() ? "[RETRY]" : "";
                final String bFail = bInfo.failureCause() != null ? "[" + bInfo.errorLabel() + "]" : "";
                System.out.printf("  Batch: %-40s | Status: %-7s | Duration: %6dms | Thread: %-24s | Images: %d %s %s%n",
                        bInfo.batchName(), bInfo.status(), bInfo.duration().toMillis(), bInfo.threadName(),
                        bInfo.images().size(), retry, bFail);
            }
        }
        System.out.println("----------------------------------------------------------");
    }

    // --- Entry Point ---

    /**
     * @throws ConfigurationException when a run-fatal input problem is found; no binary has been started
     */
    public RunResult run() throws ConfigurationException, IOException, InterruptedException {
        // --- inputs ---
        final AppConfig config = ConfigManager.loadConfig(
                ConfigManager.locate(baseDir, ConfigManager.CONFIG_FILE, "FINIT3", "Config file"));
        final Path uploadDir = ConfigManager.locate(baseDir, config.uploadDir(), ConfigManager.UPLOAD_DIR, "FINIT1", "Images folder");
        final Recipe recipe = RecipeLoader.load(
                ConfigManager.locate(baseDir, ConfigManager.RECIPE_FILE, "FINIT2", "Recipe"));
        final Path modelsDir = ConfigManager.locate(baseDir, config.modelsDir(), ConfigManager.MODELS_DIR, "FMOD2", "Models folder");

        final ImageSet uploaded = FileUtils.loadImageSet(uploadDir);
        ImageSet images = uploaded;
        if (config.isGenotypeFilterEnabled()) {
            final PreloadingConfig preloading = ConfigManager.loadPreloading(
                    ConfigManager.locate(baseDir, ConfigManager.PRELOADING_FILE, "FINIT4", "Custom preloading file"));
            images = FileUtils.applyPreloading(uploaded, preloading);
        }
        if (images.isEmpty())
            throw new ConfigurationException("FINIT1", "No images to process in " + uploadDir);

        final OptionalInt groupPosition = config.isNamingSeparationEnabled()
                ? GroupKeyResolver.resolvePosition(config.effectiveNamingConvention(), recipe.commandsSpec().exportSeparation())
                : OptionalInt.empty();

        final ModelRegistry registry = ModelRegistry.load(modelsDir);
        final CommandResolver resolver = new CommandResolver(modelsDir, config.effectiveBinaryExtension(), registry);

        if (recipe.exportationFormat().isPdfRequested())
            LOGGER.log(Level.WARNING, "PDF export is not supported, skipping it.");

        final List<ResultExporter> exporters = new ArrayList<>();
        final Path outputDir = baseDir.resolve(config.outputDir() != null ? config.outputDir() : DEFAULT_OUTPUT_DIR);
        DatabaseResultExporter database = null;
        try {
            for (ExportFormat format : recipe.exportFormats()) {
                switch (format) {
                    case CSV -> exporters.add(new CsvResultExporter(outputDir));
                    case JSON -> exporters.add(new JsonResultExporter(outputDir));
                    case CONNECTED_DATABASE -> {
                        if (!config.isDbEnabled()) {
                            LOGGER.log(Level.WARNING, "connected_database requested but ENABLE_DB is off, skipping it.");
                            continue;
                        }
                        if (config.dbPath() == null || config.dbPath().isBlank())
                            throw new ConfigurationException("FDB3", "ENABLE_DB is on but DB_PATH is not set.");
                        database = DatabaseResultExporter.open(baseDir.resolve(config.dbPath()), config.dbName());
                        database.verifyTable();
                        exporters.add(database);
                    }
                }
            }

            // --- dispatch ---
            final List<String> flags = recipe.commandsSpec().isWhiteBackground()
                    ? List.of(config.effectiveWhiteBackgroundFlag()) : List.of();
            final ProcessInvoker processInvoker = invoker != null ? invoker : new ExternalProcessInvoker(config.processTimeout());
            final int parallelism = Runtime.getRuntime().availableProcessors();
            final CommandDispatcher dispatcher = new CommandDispatcher(resolver,
                    new BatchScheduler(processInvoker, config), flags, parallelism);
            final UploadBarrier barrier = UploadBarrier.forImages(images, config.uploadWaitLimit());

            final List<String> commands = recipe.enabledCommands();
            System.out.printf("Running %d commands over %d images (batch size %d).%n", commands.size(), images.size(),
                    config.effectiveBatchSize());
            final Instant dispatchStart = Instant.now();
            final ExecutionInfo execution = execute(dispatcher, barrier, commands, images, images.size());
            if (config.isBenchmark())
                LOGGER.log(Level.INFO, "Executing commands took {0} ms",
                        Duration.between(dispatchStart, Instant.now()).toMillis());
            for (CommandInfo failed : execution.failedCommands())
                LOGGER.log(Level.SEVERE, "FPAR1 - Error while executing command {0}: {1}",
                        new Object[]{failed.commandName(), failed.failureCause() != null ? failed.failureCause().getMessage() : failed.errorLabel()});

            // --- aggregate and export ---
            final ResultAggregator aggregator = new ResultAggregator();
            final ResultTable table = aggregator.aggregate(execution.records(), images);
            final Map<String, ResultTable> groups = aggregator.group(table, groupPosition);
            final Map<ExportFormat, Status> exports = new ExportCoordinator(exporters).exportAll(table, groups);
            System.out.println("done.");
            return new RunResult(execution, table, groups, exports);
        } finally {
            if (database != null)
                database.close();
        }
    }

    /**
     * Waits for the uploads and dispatches the commands concurrently. If that fails as a whole, the commands are run
     * again one after another without waiting.
     */
    ExecutionInfo execute(CommandDispatcher dispatcher, UploadBarrier barrier, List<String> commands,
                          ImageSet images, int expectedUploads) throws InterruptedException {
        try {
            try {
                barrier.await(expectedUploads);
            } catch (final IOException | TimeoutException e) {
                throw new IllegalStateException("FPAR2 - Error while waiting for images to be copied: " + e.getMessage(), e);
            }
            return dispatcher.dispatch(commands, images);
        } catch (final RuntimeException e) {
            LOGGER.log(Level.SEVERE, "FPAR_MASTER - Error while executing recipe in parallel, trying sequential: {0}",
                    e.getMessage());
            return dispatcher.dispatchSequential(commands, images);
        }
    }
}
