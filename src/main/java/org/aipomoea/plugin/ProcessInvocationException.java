package org.aipomoea.plugin;

/**
 * Describes why a binary invocation failed: it could not be started, exited with a non-zero code or timed out.
 */
public class ProcessInvocationException extends Exception {

    public static final int NOT_STARTED = -1;
    public static final int TIMED_OUT = -2;

    private final int exitCode;

    public ProcessInvocationException(String message, int exitCode) {
        super(message);
        this.exitCode = exitCode;
    }

    public ProcessInvocationException(String message, int exitCode, Throwable cause) {
        super(message, cause);
        this.exitCode = exitCode;
    }

    public int getExitCode() {
        return exitCode;
    }
}
