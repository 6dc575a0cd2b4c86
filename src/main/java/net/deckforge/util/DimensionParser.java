package net.deckforge.util;

import jakarta.annotation.Nullable;
import net.deckforge.model.image.ImageSize;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for image dimension values found in presentation schemas.
 * <p>
 * Handles both forms used by {@code asset_config.dimensions}: the
 * {@code WIDTHxHEIGHT} generation size string and the {@code [width, height]}
 * final size pair.
 */
public final class DimensionParser {

    // Matches: positive integer, literal x, positive integer; no whitespace, no signs
    private static final Pattern SIZE_PATTERN = Pattern.compile("^(\\d+)x(\\d+)$");

    private DimensionParser() {
        // Utility class - prevent instantiation
    }

    /**
     * Parses a {@code WIDTHxHEIGHT} string.
     *
     * @param value string like "1792x1024"
     * @return parsed size, or empty if the string is malformed or either side is not positive
     *
     * <pre>
     * parseSize("1792x1024") → 1792x1024
     * parseSize("0x1024")    → empty
     * parseSize("1792 x 1024") → empty
     * </pre>
     */
    public static Optional<ImageSize> parseSize(@Nullable String value) {
        if (value == null) {
            return Optional.empty();
        }
        Matcher matcher = SIZE_PATTERN.matcher(value);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        Integer width = parsePositive(matcher.group(1));
        Integer height = parsePositive(matcher.group(2));
        if (width == null || height == null) {
            return Optional.empty();
        }
        return Optional.of(new ImageSize(width, height));
    }

    /**
     * Converts a {@code [width, height]} pair into a size.
     *
     * @param pair list holding exactly two positive integers
     * @return parsed size, or empty if the list has the wrong length or a non-positive entry
     */
    public static Optional<ImageSize> fromPair(@Nullable List<Integer> pair) {
        if (pair == null || pair.size() != 2) {
            return Optional.empty();
        }
        Integer width = pair.get(0);
        Integer height = pair.get(1);
        if (width == null || height == null || width <= 0 || height <= 0) {
            return Optional.empty();
        }
        return Optional.of(new ImageSize(width, height));
    }

    @Nullable
    private static Integer parsePositive(String digits) {
        try {
            int parsed = Integer.parseInt(digits);
            return parsed > 0 ? parsed : null;
        } catch (NumberFormatException overflow) {
            return null;
        }
    }
}
