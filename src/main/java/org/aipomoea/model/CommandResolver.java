package org.aipomoea.model;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Locates the executable for a command inside the models directory.
 */
public class CommandResolver {

    private static final Logger LOGGER = Logger.getLogger(CommandResolver.class.getName());

    private final Path modelsDir;
    private final String binaryExtension;
    private final ModelRegistry registry;

    public CommandResolver(Path modelsDir, String binaryExtension, ModelRegistry registry) {
        this.modelsDir = modelsDir.toAbsolutePath().normalize();
        this.binaryExtension = binaryExtension == null ? "" : binaryExtension;
        this.registry = registry;
    }

    /**
     * Resolves the binary of {@code name}. A path registered in {@code models.json} wins over the
     * {@code <modelsDir>/<name><extension>} convention.
     *
     * @return the command, or empty when no executable file exists for it
     */
    public Optional<Command> resolve(String name, List<String> flags) {
        if (!Command.isValidName(name)) {
            LOGGER.log(Level.WARNING, "Rejecting invalid command name: {0}", name);
            return Optional.empty();
        }
        final Path binary = registry.lookup(name)
                .map(p -> modelsDir.resolve(p).normalize())
                .orElseGet(() -> modelsDir.resolve(name + binaryExtension));

        if (!Files.isRegularFile(binary)) {
            LOGGER.log(Level.WARNING, "Binary for command {0} not found at {1}", new Object[]{name, binary});
            return Optional.empty();
        }
        return Optional.of(new Command(name, binary, binary.getParent(), flags));
    }

    public Path modelsDir() {
        return modelsDir;
    }
}
