package org.aipomoea.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Loads configuration files and locates the inputs of a run.
 * Inputs are probed in the build layout first ({@code <base>/<name>}) and in the packaged layout second
 * ({@code <base>/resources/app/<name>}).
 */
public final class ConfigManager {
    private static final Logger APP_LOGGER = Logger.getLogger(ConfigManager.class.getName());

    public static final String CONFIG_FILE = "config.json";
    public static final String RECIPE_FILE = "recipe.json";
    public static final String PRELOADING_FILE = "custom_preloading.json";
    public static final String UPLOAD_DIR = "uploads";
    public static final String MODELS_DIR = "models";
    static final Path DIST_LAYOUT = Path.of("resources", "app");

    static {
        System.setProperty("java.util.logging.SimpleFormatter.format", "[%1$tF %1$tT] [%4$-7s] %3$s - %5$s %6$s%n");
        ConsoleHandler handler = new ConsoleHandler();
        handler.setFormatter(new SimpleFormatter());
        handler.setLevel(Level.ALL);
        Logger rootLogger = Logger.getLogger("");
        for (var existing : rootLogger.getHandlers())
            rootLogger.removeHandler(existing);
        rootLogger.addHandler(handler);
        rootLogger.setLevel(Level.INFO);
    }

    private ConfigManager() {
    }

    public static ObjectMapper mapperFor(Path file) {
        final String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        final ObjectMapper mapper = (name.endsWith(".yaml") || name.endsWith(".yml"))
                ? new ObjectMapper(new YAMLFactory())
                : new ObjectMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    public static <T> T read(Path file, Class<T> type) throws IOException {
        return mapperFor(file).readValue(file.toFile(), type);
    }

    public static AppConfig loadConfig(Path configPath) throws ConfigurationException {
        try {
            AppConfig config = read(configPath, AppConfig.class);
            APP_LOGGER.log(Level.INFO, "Loaded configuration from {0}", configPath);
            if (config.isDebug())
                Logger.getLogger("org.aipomoea").setLevel(Level.FINE);
            if (config.effectiveBatchSize() < 1)
                throw new ConfigurationException("FLCO2", "BATCH_SIZE must be at least 1, got " + config.effectiveBatchSize());
            return config;
        } catch (IOException e) {
            throw new ConfigurationException("FLCO1", "Error while loading config " + configPath + ": " + e.getMessage(), e);
        }
    }

    public static PreloadingConfig loadPreloading(Path preloadingPath) throws ConfigurationException {
        try {
            return read(preloadingPath, PreloadingConfig.class);
        } catch (IOException e) {
            throw new ConfigurationException("LCP1", "Error while loading custom preloading " + preloadingPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Finds {@code name} under the base directory or the packaged layout below it.
     *
     * @throws ConfigurationException with {@code code} when neither location exists
     */
    public static Path locate(Path baseDir, String name, String code, String description) throws ConfigurationException {
        final Path build = baseDir.resolve(name);
        if (Files.exists(build))
            return build.toAbsolutePath().normalize();
        final Path dist = baseDir.resolve(DIST_LAYOUT).resolve(name);
        if (Files.exists(dist))
            return dist.toAbsolutePath().normalize();
        throw new ConfigurationException(code, description + " not found.");
    }

    /**
     * Like {@link #locate} but an explicitly configured path takes precedence and must exist.
     */
    public static Path locate(Path baseDir, String override, String name, String code, String description) throws ConfigurationException {
        if (override == null || override.isBlank())
            return locate(baseDir, name, code, description);
        final Path configured = baseDir.resolve(override).toAbsolutePath().normalize();
        if (!Files.exists(configured))
            throw new ConfigurationException(code, description + " not found at " + configured + ".");
        return configured;
    }
}
