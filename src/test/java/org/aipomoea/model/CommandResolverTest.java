package org.aipomoea.model;

import org.aipomoea.config.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CommandResolverTest {

    @TempDir
    Path modelsDir;

    @Test
    void testResolve_byConvention() throws Exception {
        Path binary = Files.createFile(modelsDir.resolve("leaf_area.exe"));
        CommandResolver resolver = new CommandResolver(modelsDir, ".exe", ModelRegistry.empty());

        Command command = resolver.resolve("leaf_area", List.of("--white-background")).orElseThrow();

        assertEquals(binary.toAbsolutePath().normalize(), command.binaryPath());
        assertEquals(binary.toAbsolutePath().normalize().getParent(), command.workingDir());
        assertEquals(List.of("--white-background"), command.flags());
    }

    @Test
    void testResolve_registryPathWins() throws Exception {
        Files.createDirectories(modelsDir.resolve("disease"));
        Path registered = Files.createFile(modelsDir.resolve("disease/run_disease"));
        Files.createFile(modelsDir.resolve("disease.exe"));
        CommandResolver resolver = new CommandResolver(modelsDir, ".exe",
                new ModelRegistry(Map.of("disease", "disease/run_disease")));

        Command command = resolver.resolve("disease", List.of()).orElseThrow();

        assertEquals(registered.toAbsolutePath().normalize(), command.binaryPath());
        assertEquals(modelsDir.resolve("disease").toAbsolutePath().normalize(), command.workingDir());
    }

    @Test
    void testResolve_missingOrInvalid() {
        CommandResolver resolver = new CommandResolver(modelsDir, ".exe", ModelRegistry.empty());

        assertEquals(Optional.empty(), resolver.resolve("absent", List.of()));
        assertEquals(Optional.empty(), resolver.resolve("../escape", List.of()));
        assertEquals(Optional.empty(), resolver.resolve("1abc", List.of()));
    }

    @Test
    void testRegistryLoad() throws Exception {
        assertEquals(0, ModelRegistry.load(modelsDir).size(), "no models.json is an empty registry");

        Files.writeString(modelsDir.resolve(ModelRegistry.MODELS_FILE),
                "{\"models\": [{\"name\": \"leaf_area\", \"path\": \"bin/leaf.exe\"}]}");
        ModelRegistry registry = ModelRegistry.load(modelsDir);
        assertEquals(Optional.of("bin/leaf.exe"), registry.lookup("leaf_area"));
    }

    @Test
    void testRegistryLoad_invalidName() throws Exception {
        Files.writeString(modelsDir.resolve(ModelRegistry.MODELS_FILE),
                "{\"models\": [{\"name\": \"leaf-area\", \"path\": \"leaf.exe\"}]}");

        ConfigurationException e = assertThrows(ConfigurationException.class, () -> ModelRegistry.load(modelsDir));
        assertEquals("FMOD1", e.getCode());
    }

    @Test
    void testBatch_rejectsEmptyAndNamesRange() {
        assertThrows(IllegalArgumentException.class, () -> new Batch("1", 0, List.of()));
        Batch batch = new Batch("2.1", 4, List.of(Path.of("/u/a.jpg"), Path.of("/u/b.jpg")));
        assertEquals("Batch-2.1_a.jpg..b.jpg", batch.displayName());
    }
}
