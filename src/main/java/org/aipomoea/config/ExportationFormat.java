package org.aipomoea.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.aipomoea.export.ExportFormat;

import java.util.EnumSet;
import java.util.Set;

public record ExportationFormat(@JsonProperty("csv") Boolean csv,
                                @JsonProperty("json") Boolean json,
                                @JsonProperty("pdf") Boolean pdf,
                                @JsonProperty("connected_database") Boolean connectedDatabase) {

    public Set<ExportFormat> enabledFormats() {
        final Set<ExportFormat> formats = EnumSet.noneOf(ExportFormat.class);
        if (Boolean.TRUE.equals(csv)) formats.add(ExportFormat.CSV);
        if (Boolean.TRUE.equals(json)) formats.add(ExportFormat.JSON);
        if (Boolean.TRUE.equals(connectedDatabase)) formats.add(ExportFormat.CONNECTED_DATABASE);
        return formats;
    }

    public boolean isPdfRequested() {
        return Boolean.TRUE.equals(pdf);
    }
}
