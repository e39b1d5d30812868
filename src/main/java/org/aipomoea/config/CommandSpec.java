package org.aipomoea.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Modifiers that apply to every command of a recipe.
 *
 * @param exportSeparation naming-convention token used to split the exports, or {@code "Nenhum"} for none
 */
public record CommandSpec(@JsonProperty("white_background") Boolean whiteBackground,
                          @JsonProperty("export_separation") String exportSeparation) {

    public static final String NO_SEPARATION = "Nenhum";

    public static CommandSpec none() {
        return new CommandSpec(false, NO_SEPARATION);
    }

    public boolean isWhiteBackground() {
        return Boolean.TRUE.equals(whiteBackground);
    }
}
