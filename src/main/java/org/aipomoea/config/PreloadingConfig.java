package org.aipomoea.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.List;

/**
 * Content of {@code custom_preloading.json}: comma separated filename prefixes and what to do with them.
 */
public record PreloadingConfig(@JsonProperty("customEntry") String customEntry,
                               @JsonProperty("selectedOption") String selectedOption) {

    public static final String SELECT_ONLY = "selectOnly";
    public static final String EXCLUDE_ONLY = "excludeOnly";

    public List<String> prefixes() {
        if (customEntry == null || customEntry.isBlank())
            return List.of();
        return Arrays.stream(customEntry.split(","))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
