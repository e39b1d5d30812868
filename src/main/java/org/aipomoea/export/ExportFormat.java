package org.aipomoea.export;

import java.util.Locale;
import java.util.Optional;

public enum ExportFormat {
    CSV("csv"),
    JSON("json"),
    CONNECTED_DATABASE("connected_database");

    private final String key;

    ExportFormat(String key) {
        this.key = key;
    }

    /**
     * Recipe key of the format.
     */
    public String key() {
        return key;
    }

    public static Optional<ExportFormat> fromKey(String key) {
        if (key == null)
            return Optional.empty();
        final String normalized = key.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (ExportFormat format : values()) {
            if (format.key.equals(normalized))
                return Optional.of(format);
        }
        return Optional.empty();
    }
}
