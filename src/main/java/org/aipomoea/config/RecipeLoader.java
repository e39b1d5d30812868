package org.aipomoea.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads a recipe. Two shapes are accepted: the structured one
 * ({@code commands}, {@code commands_spec}, {@code exportation_format}) and the flat checkbox map the UI writes
 * ({@code {"typemode": .., "checkboxStates": {"leaf-area": true, "csv": true, ...}}}).
 */
public final class RecipeLoader {

    private static final Logger LOGGER = Logger.getLogger(RecipeLoader.class.getName());

    static final String CHECKBOX_STATES = "checkboxStates";
    static final Set<String> SPECIAL_COMMANDS = Set.of(
            "csv", "pdf", "json", "connected_database", "cli_visible", "export_separation", "white_background");

    private RecipeLoader() {
    }

    public static Recipe load(Path recipePath) throws ConfigurationException {
        try {
            final ObjectMapper mapper = ConfigManager.mapperFor(recipePath);
            final JsonNode root = mapper.readTree(recipePath.toFile());
            if (root == null || !root.isObject())
                throw new ConfigurationException("FLRE1", "Recipe " + recipePath + " is not an object.");
            final Recipe recipe = root.has(CHECKBOX_STATES)
                    ? fromCheckboxStates(root.get(CHECKBOX_STATES))
                    : mapper.treeToValue(root, Recipe.class);
            LOGGER.log(Level.INFO, "Recipe loaded: commands={0}, formats={1}, separation={2}",
                    new Object[]{recipe.enabledCommands(), recipe.exportFormats(), recipe.commandsSpec().exportSeparation()});
            return recipe;
        } catch (IOException e) {
            throw new ConfigurationException("FLRE1", "Error while loading recipe " + recipePath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Splits the checkbox map into commands and special entries. Ids are normalized from {@code leaf-area} to
     * {@code leaf_area}; unchecked entries are dropped.
     */
    static Recipe fromCheckboxStates(JsonNode states) {
        final Map<String, Boolean> commands = new LinkedHashMap<>();
        final Map<String, JsonNode> special = new LinkedHashMap<>();

        final Iterator<Map.Entry<String, JsonNode>> fields = states.fields();
        while (fields.hasNext()) {
            final Map.Entry<String, JsonNode> field = fields.next();
            final String id = field.getKey().replace("-", "_");
            if (SPECIAL_COMMANDS.contains(id))
                special.put(id, field.getValue());
            else if (isChecked(field.getValue()))
                commands.put(id, true);
        }

        final CommandSpec commandsSpec = new CommandSpec(isChecked(special.get("white_background")),
                separationOf(special.get("export_separation")));
        final ExportationFormat formats = new ExportationFormat(isChecked(special.get("csv")), isChecked(special.get("json")),
                isChecked(special.get("pdf")), isChecked(special.get("connected_database")));
        return new Recipe(commands, commandsSpec, formats);
    }

    private static boolean isChecked(JsonNode value) {
        if (value == null || value.isNull())
            return false;
        if (value.isBoolean())
            return value.booleanValue();
        return value.isTextual() && !value.textValue().isBlank() && !"false".equalsIgnoreCase(value.textValue());
    }

    // A checked boolean groups by the first token of the filename, as the UI did before tokens were selectable.
    private static String separationOf(JsonNode value) {
        if (value == null || value.isNull())
            return CommandSpec.NO_SEPARATION;
        if (value.isBoolean())
            return value.booleanValue() ? "1" : CommandSpec.NO_SEPARATION;
        return value.asText();
    }
}
