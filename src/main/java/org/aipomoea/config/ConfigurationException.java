package org.aipomoea.config;

/**
 * A run-fatal configuration problem, raised before any command is dispatched.
 * The code identifies the failing step in logs ({@code FINIT2}, {@code FDB2}, ...).
 */
public class ConfigurationException extends Exception {

    private final String code;

    public ConfigurationException(String code, String message) {
        super(code + " - " + message);
        this.code = code;
    }

    public ConfigurationException(String code, String message, Throwable cause) {
        super(code + " - " + message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
