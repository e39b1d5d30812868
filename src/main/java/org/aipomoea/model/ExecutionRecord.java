package org.aipomoea.model;

/**
 * One parsed result line: the image (filename stem), the command that produced it and the raw result text.
 * The value is not interpreted at this stage.
 */
public record ExecutionRecord(String imageName, String commandName, String resultValue) {
}
