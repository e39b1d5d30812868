package org.aipomoea.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * Application settings read from {@code config.json} (or a YAML equivalent). Keys follow the file written by the UI.
 * Optional settings are boxed so that an absent key falls back to its default.
 */
public record AppConfig(@JsonProperty("OUTPUT_DIR") String outputDir,
                        @JsonProperty("ENABLE_DB") Boolean enableDb,
                        @JsonProperty("DB_PATH") String dbPath,
                        @JsonProperty("DB_NAME") String dbName,
                        @JsonProperty("FORCE_MAXPERFORMANCE") Boolean forceMaxPerformance,
                        @JsonProperty("NAMING_CONVENTION") String namingConvention,
                        @JsonProperty("ENABLE_NAMING_SEPARATION") Boolean enableNamingSeparation,
                        @JsonProperty("ENABLE_GENOTYPE") Boolean enableGenotype,
                        @JsonProperty("BATCH_SIZE") Integer batchSize,
                        @JsonProperty("UPLOAD_DIR") String uploadDir,
                        @JsonProperty("MODELS_DIR") String modelsDir,
                        @JsonProperty("BINARY_EXTENSION") String binaryExtension,
                        @JsonProperty("WHITE_BACKGROUND_FLAG") String whiteBackgroundFlag,
                        @JsonProperty("UPLOAD_WAIT_MAX_SECONDS") Long uploadWaitMaxSeconds,
                        @JsonProperty("PROCESS_TIMEOUT_SECONDS") Long processTimeoutSeconds,
                        @JsonProperty("DEBUG") Boolean debug,
                        @JsonProperty("PERFORM_BENCHMARK") Boolean performBenchmark) {

    public static final int DEFAULT_BATCH_SIZE = 50;
    public static final String DEFAULT_NAMING_CONVENTION = "Matrix-Gen-Rep";
    public static final String DEFAULT_BINARY_EXTENSION = ".exe";
    public static final String DEFAULT_WHITE_BACKGROUND_FLAG = "--white-background";
    public static final long DEFAULT_UPLOAD_WAIT_MAX_SECONDS = 300L;

    public int effectiveBatchSize() {
        return batchSize != null ? batchSize : DEFAULT_BATCH_SIZE;
    }

    public boolean isDbEnabled() {
        return Boolean.TRUE.equals(enableDb);
    }

    public boolean isMaxPerformance() {
        return Boolean.TRUE.equals(forceMaxPerformance);
    }

    public boolean isNamingSeparationEnabled() {
        return enableNamingSeparation == null || enableNamingSeparation;
    }

    public boolean isGenotypeFilterEnabled() {
        return Boolean.TRUE.equals(enableGenotype);
    }

    public boolean isDebug() {
        return Boolean.TRUE.equals(debug);
    }

    public boolean isBenchmark() {
        return Boolean.TRUE.equals(performBenchmark);
    }

    public String effectiveNamingConvention() {
        return namingConvention != null && !namingConvention.isBlank() ? namingConvention : DEFAULT_NAMING_CONVENTION;
    }

    public String effectiveBinaryExtension() {
        return binaryExtension != null ? binaryExtension : DEFAULT_BINARY_EXTENSION;
    }

    public String effectiveWhiteBackgroundFlag() {
        return whiteBackgroundFlag != null && !whiteBackgroundFlag.isBlank() ? whiteBackgroundFlag : DEFAULT_WHITE_BACKGROUND_FLAG;
    }

    public Duration uploadWaitLimit() {
        return Duration.ofSeconds(uploadWaitMaxSeconds != null ? uploadWaitMaxSeconds : DEFAULT_UPLOAD_WAIT_MAX_SECONDS);
    }

    /**
     * @return the per-invocation timeout, or {@link Duration#ZERO} to wait for the binary indefinitely
     */
    public Duration processTimeout() {
        return processTimeoutSeconds != null && processTimeoutSeconds > 0 ? Duration.ofSeconds(processTimeoutSeconds) : Duration.ZERO;
    }
}
