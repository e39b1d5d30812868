package org.aipomoea.aggregation;

import org.aipomoea.config.CommandSpec;
import org.aipomoea.config.ConfigurationException;
import org.aipomoea.util.Utils;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Maps the export separation factor onto a token position of the naming convention.
 * <p>
 * Convention {@code species_genotype_rep} with factor {@code genotype} resolves to position 1, so
 * image {@code A_G7_1} lands in group {@code G7}.
 */
public final class GroupKeyResolver {

    public static final String UNKNOWN_TOKEN = "FSEP1";

    private GroupKeyResolver() {
    }

    /**
     * Resolves the zero-based token position for {@code factor}.
     * The factor is a token name (case-insensitive), a 1-based position, or {@code Nenhum}/{@code none}/blank for
     * no grouping.
     *
     * @throws ConfigurationException if the factor names no token of the convention
     */
    public static OptionalInt resolvePosition(String namingConvention, String factor) throws ConfigurationException {
        if (isNoSeparation(factor))
            return OptionalInt.empty();

        final String wanted = factor.trim();
        final List<String> tokens = Utils.tokenize(namingConvention);
        if (wanted.chars().allMatch(Character::isDigit)) {
            final int position = wanted.length() > 9 ? Integer.MAX_VALUE : Integer.parseInt(wanted);
            if (position < 1 || position > tokens.size())
                throw new ConfigurationException(UNKNOWN_TOKEN, "Separation position " + position
                        + " is outside naming convention " + namingConvention);
            return OptionalInt.of(position - 1);
        }
        for (int i = 0; i < tokens.size(); i++) {
            if (tokens.get(i).equalsIgnoreCase(wanted))
                return OptionalInt.of(i);
        }
        throw new ConfigurationException(UNKNOWN_TOKEN, "Separation factor '" + factor
                + "' is not part of naming convention " + namingConvention);
    }

    static boolean isNoSeparation(String factor) {
        if (factor == null || factor.isBlank())
            return true;
        final String f = factor.trim().toLowerCase(Locale.ROOT);
        return f.equals(CommandSpec.NO_SEPARATION.toLowerCase(Locale.ROOT)) || f.equals("none");
    }

    /**
     * Token of the image stem at {@code position}, or empty when the stem is too short. The stem already has its
     * extension removed, so dots are part of the tokens.
     */
    public static Optional<String> groupKey(String imageStem, int position) {
        final List<String> tokens = Utils.tokenize(imageStem);
        if (position < 0 || position >= tokens.size() || tokens.get(position).isEmpty())
            return Optional.empty();
        return Optional.of(tokens.get(position));
    }
}
