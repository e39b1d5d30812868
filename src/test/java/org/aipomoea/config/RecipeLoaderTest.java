package org.aipomoea.config;

import org.aipomoea.export.ExportFormat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RecipeLoaderTest {

    @TempDir
    Path dir;

    @Test
    void testLoad_structuredRecipe() throws Exception {
        Path file = Files.writeString(dir.resolve("recipe.json"), """
                {
                  "commands": {"leaf_area": true, "disease": false, "color_index": true},
                  "commands_spec": {"white_background": true, "export_separation": "Gen"},
                  "exportation_format": {"csv": true, "json": false, "pdf": true, "connected_database": true}
                }
                """);

        Recipe recipe = RecipeLoader.load(file);

        assertEquals(List.of("leaf_area", "color_index"), recipe.enabledCommands());
        assertTrue(recipe.commandsSpec().isWhiteBackground());
        assertEquals("Gen", recipe.commandsSpec().exportSeparation());
        assertEquals(EnumSet.of(ExportFormat.CSV, ExportFormat.CONNECTED_DATABASE), recipe.exportFormats());
        assertTrue(recipe.exportationFormat().isPdfRequested());
    }

    @Test
    void testLoad_checkboxStatesAreDecomposed() throws Exception {
        Path file = Files.writeString(dir.resolve("recipe.json"), """
                {"typemode": "advanced",
                 "checkboxStates": {"leaf-area": true, "disease": false, "csv": true, "json": true,
                                    "cli-visible": true, "white-background": false, "export-separation": true}}
                """);

        Recipe recipe = RecipeLoader.load(file);

        assertEquals(List.of("leaf_area"), recipe.enabledCommands());
        assertEquals(Set.of(ExportFormat.CSV, ExportFormat.JSON), recipe.exportFormats());
        assertFalse(recipe.commandsSpec().isWhiteBackground());
        assertEquals("1", recipe.commandsSpec().exportSeparation());
    }

    @Test
    void testLoad_checkboxSeparationByName() throws Exception {
        Path file = Files.writeString(dir.resolve("recipe.json"),
                "{\"checkboxStates\": {\"m1\": true, \"export_separation\": \"Rep\"}}");

        assertEquals("Rep", RecipeLoader.load(file).commandsSpec().exportSeparation());
    }

    @Test
    void testLoad_missingSectionsDefault() throws Exception {
        Path file = Files.writeString(dir.resolve("recipe.json"), "{\"commands\": {\"m1\": true}}");

        Recipe recipe = RecipeLoader.load(file);

        assertEquals(CommandSpec.NO_SEPARATION, recipe.commandsSpec().exportSeparation());
        assertTrue(recipe.exportFormats().isEmpty());
    }

    @Test
    void testLoad_invalidRecipe() throws Exception {
        Path array = Files.writeString(dir.resolve("recipe.json"), "[1, 2]");
        assertEquals("FLRE1", assertThrows(ConfigurationException.class, () -> RecipeLoader.load(array)).getCode());

        Path missing = dir.resolve("nope.json");
        assertEquals("FLRE1", assertThrows(ConfigurationException.class, () -> RecipeLoader.load(missing)).getCode());
    }
}
