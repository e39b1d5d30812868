package org.aipomoea.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfigManagerTest {

    @TempDir
    Path baseDir;

    @Test
    void testLoadConfig_jsonWithDefaults() throws Exception {
        Path file = Files.writeString(baseDir.resolve("config.json"), """
                {"OUTPUT_DIR": "out", "ENABLE_DB": false, "DB_PATH": "db.sqlite", "DB_NAME": "aipomoea",
                 "FORCE_MAXPERFORMANCE": true, "SOMETHING_ELSE": 1}
                """);

        AppConfig config = ConfigManager.loadConfig(file);

        assertEquals("out", config.outputDir());
        assertTrue(config.isMaxPerformance());
        assertFalse(config.isDbEnabled());
        assertEquals(AppConfig.DEFAULT_BATCH_SIZE, config.effectiveBatchSize());
        assertEquals("Matrix-Gen-Rep", config.effectiveNamingConvention());
        assertTrue(config.isNamingSeparationEnabled());
        assertEquals(".exe", config.effectiveBinaryExtension());
        assertEquals(Duration.ofSeconds(300), config.uploadWaitLimit());
        assertEquals(Duration.ZERO, config.processTimeout());
    }

    @Test
    void testLoadConfig_yaml() throws Exception {
        Path file = Files.writeString(baseDir.resolve("config.yaml"), """
                OUTPUT_DIR: results
                BATCH_SIZE: 8
                NAMING_CONVENTION: species_genotype_rep
                PROCESS_TIMEOUT_SECONDS: 30
                BINARY_EXTENSION: ""
                """);

        AppConfig config = ConfigManager.loadConfig(file);

        assertEquals(8, config.effectiveBatchSize());
        assertEquals("species_genotype_rep", config.effectiveNamingConvention());
        assertEquals(Duration.ofSeconds(30), config.processTimeout());
        assertEquals("", config.effectiveBinaryExtension());
    }

    @Test
    void testLoadConfig_invalidBatchSize() throws Exception {
        Path file = Files.writeString(baseDir.resolve("config.json"), "{\"BATCH_SIZE\": 0}");

        ConfigurationException e = assertThrows(ConfigurationException.class, () -> ConfigManager.loadConfig(file));
        assertEquals("FLCO2", e.getCode());
    }

    @Test
    void testLoadConfig_malformed() throws Exception {
        Path file = Files.writeString(baseDir.resolve("config.json"), "{not json");

        ConfigurationException e = assertThrows(ConfigurationException.class, () -> ConfigManager.loadConfig(file));
        assertEquals("FLCO1", e.getCode());
    }

    @Test
    void testLocate_buildLayoutBeforeDistLayout() throws Exception {
        Files.createDirectories(baseDir.resolve("resources/app/uploads"));
        assertEquals(baseDir.resolve("resources/app/uploads").toAbsolutePath().normalize(),
                ConfigManager.locate(baseDir, "uploads", "FINIT1", "Images folder"));

        Files.createDirectories(baseDir.resolve("uploads"));
        assertEquals(baseDir.resolve("uploads").toAbsolutePath().normalize(),
                ConfigManager.locate(baseDir, "uploads", "FINIT1", "Images folder"));
    }

    @Test
    void testLocate_missingCarriesCode() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> ConfigManager.locate(baseDir, "recipe.json", "FINIT2", "Recipe"));
        assertEquals("FINIT2", e.getCode());
        assertTrue(e.getMessage().startsWith("FINIT2 - "));
    }

    @Test
    void testLocate_overrideMustExist() throws Exception {
        Files.createDirectories(baseDir.resolve("uploads"));
        Files.createDirectories(baseDir.resolve("elsewhere"));

        assertEquals(baseDir.resolve("elsewhere").toAbsolutePath().normalize(),
                ConfigManager.locate(baseDir, "elsewhere", "uploads", "FINIT1", "Images folder"));
        assertThrows(ConfigurationException.class,
                () -> ConfigManager.locate(baseDir, "nowhere", "uploads", "FINIT1", "Images folder"));
    }

    @Test
    void testLoadPreloading() throws Exception {
        Path file = Files.writeString(baseDir.resolve("custom_preloading.json"),
                "{\"customEntry\": \"A_G7, B ,,\", \"selectedOption\": \"selectOnly\"}");

        PreloadingConfig preloading = ConfigManager.loadPreloading(file);

        assertEquals(List.of("A_G7", "B"), preloading.prefixes());
        assertEquals(PreloadingConfig.SELECT_ONLY, preloading.selectedOption());
    }
}
