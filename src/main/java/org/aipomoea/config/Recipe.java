package org.aipomoea.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.aipomoea.export.ExportFormat;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The user's selection: which commands run and which exports are produced.
 */
public record Recipe(@JsonProperty("commands") Map<String, Boolean> commands,
                     @JsonProperty("commands_spec") CommandSpec commandsSpec,
                     @JsonProperty("exportation_format") ExportationFormat exportationFormat) {

    public Recipe {
        commands = commands == null ? Map.of() : new LinkedHashMap<>(commands);
        commandsSpec = commandsSpec == null ? CommandSpec.none() : commandsSpec;
        exportationFormat = exportationFormat == null ? new ExportationFormat(false, false, false, false) : exportationFormat;
    }

    /**
     * Names of the enabled commands in recipe order.
     */
    public List<String> enabledCommands() {
        final List<String> enabled = new ArrayList<>();
        commands.forEach((name, on) -> {
            if (Boolean.TRUE.equals(on))
                enabled.add(name);
        });
        return enabled;
    }

    public Set<ExportFormat> exportFormats() {
        return exportationFormat.enabledFormats();
    }
}
