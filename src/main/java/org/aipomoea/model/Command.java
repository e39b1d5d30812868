package org.aipomoea.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A named external binary ready to be invoked.
 *
 * @param name       identifier, also used as result column name
 * @param binaryPath absolute path of the executable
 * @param workingDir install directory of the binary, used as the process working directory
 * @param flags      modifiers passed between the binary path and the image paths
 */
public record Command(String name, Path binaryPath, Path workingDir, List<String> flags) {

    public static final Pattern NAME_PATTERN = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

    public Command {
        Objects.requireNonNull(name, "Command name cannot be null");
        if (!isValidName(name))
            throw new IllegalArgumentException("invalid command name: " + name);
        Objects.requireNonNull(binaryPath, "Binary path cannot be null");
        Objects.requireNonNull(workingDir, "Working directory cannot be null");
        flags = flags == null ? List.of() : List.copyOf(flags);
    }

    public static boolean isValidName(String name) {
        return name != null && NAME_PATTERN.matcher(name).matches();
    }
}
