package org.aipomoea.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.aipomoea.config.ConfigurationException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Model definitions declared in {@code models.json}: {@code {"models":[{"name":"leaf_area","path":"leaf_area.exe"}]}}.
 */
public final class ModelRegistry {

    public static final String MODELS_FILE = "models.json";

    private static final Logger LOGGER = Logger.getLogger(ModelRegistry.class.getName());

    public record ModelDefinition(@JsonProperty("name") String name, @JsonProperty("path") String path) {
    }

    public record ModelsFile(@JsonProperty("models") List<ModelDefinition> models) {
    }

    private final Map<String, String> definitions;

    public ModelRegistry(Map<String, String> definitions) {
        this.definitions = Collections.unmodifiableMap(new LinkedHashMap<>(definitions));
    }

    public static ModelRegistry empty() {
        return new ModelRegistry(Map.of());
    }

    /**
     * Loads the registry from the models directory. A directory without {@code models.json} yields an empty registry.
     *
     * @throws ConfigurationException if a model name is not a valid identifier
     */
    public static ModelRegistry load(Path modelsDir) throws IOException, ConfigurationException {
        final Path file = modelsDir.resolve(MODELS_FILE);
        if (!Files.isRegularFile(file)) {
            LOGGER.log(Level.INFO, "No {0} in {1}, resolving binaries by command name only.", new Object[]{MODELS_FILE, modelsDir});
            return empty();
        }
        final ObjectMapper mapper = new ObjectMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        final ModelsFile content = mapper.readValue(file.toFile(), ModelsFile.class);

        final Map<String, String> definitions = new LinkedHashMap<>();
        if (content.models() != null) {
            for (ModelDefinition model : content.models()) {
                if (!Command.isValidName(model.name()))
                    throw new ConfigurationException("FMOD1", "invalid model name: " + model.name());
                definitions.put(model.name(), model.path());
            }
        }
        LOGGER.log(Level.INFO, "Loaded {0} model definitions from {1}", new Object[]{definitions.size(), file});
        return new ModelRegistry(definitions);
    }

    public Optional<String> lookup(String name) {
        return Optional.ofNullable(definitions.get(name));
    }

    public int size() {
        return definitions.size();
    }
}
