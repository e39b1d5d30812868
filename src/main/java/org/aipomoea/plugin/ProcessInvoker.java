package org.aipomoea.plugin;

import org.aipomoea.model.Command;

import java.nio.file.Path;
import java.util.List;

/**
 * Runs one command's binary against one batch of images.
 */
public interface ProcessInvoker {

    /**
     * Spawns {@code [binary, flags..., images...]} in the command's working directory and waits for it to exit.
     * Expected failures (spawn error, non-zero exit, timeout) are returned, not thrown.
     *
     * @return the UTF-8 decoded standard output split into lines, or the failure
     * @throws InterruptedException if the caller is interrupted while waiting; the process is destroyed
     */
    InvocationResult invoke(Command command, List<Path> images) throws InterruptedException;
}
