package org.aipomoea.export;

/**
 * Failure of one export format for one table. Other formats are unaffected.
 */
public class ExportException extends Exception {

    public ExportException(String message) {
        super(message);
    }

    public ExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
