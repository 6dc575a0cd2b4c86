package net.deckforge.application.validation;

import jakarta.annotation.Nullable;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import net.deckforge.util.DimensionParser;

/**
 * Pure predicates for individual schema fields.
 *
 * <p>Every method accepts {@code null} and returns {@code false} for it.</p>
 */
public final class FieldValidators {

    private static final Pattern HEX_COLOR = Pattern.compile("^#[0-9A-Fa-f]{6}$");
    private static final Pattern RGBA_COLOR =
        Pattern.compile("^rgba?\\(\\s*\\d+\\s*,\\s*\\d+\\s*,\\s*\\d+\\s*(,\\s*[\\d.]+)?\\s*\\)$");
    private static final Pattern SEMANTIC_VERSION = Pattern.compile("^\\d+\\.\\d+\\.\\d+$");
    private static final Pattern ISO_DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern SHORT_NAME = Pattern.compile("^[a-z0-9-]+$");
    private static final Pattern SLIDE_ID = Pattern.compile("^\\d{2}$");
    private static final Pattern BACKGROUND_FILENAME = Pattern.compile("^SLIDE-\\d{2}-[A-Za-z]+\\.png$");
    private static final Pattern ICON_FILENAME = Pattern.compile("^IC-[A-Za-z]+\\.png$");
    private static final Pattern CSS_SIZE = Pattern.compile("^\\d+(\\.\\d+)?(px|em|rem|vw|vh|%)?$");

    /** Layouts every schema must define, in report order. */
    public static final List<String> MANDATORY_LAYOUTS = List.of("title-slide", "lf", "rf", "tb");
    /** Layouts a schema may define. */
    public static final List<String> OPTIONAL_LAYOUTS = List.of("tl", "tr", "bl", "br");
    public static final List<String> ALL_LAYOUTS =
        List.of("title-slide", "lf", "rf", "tb", "tl", "tr", "bl", "br");
    public static final List<String> TRANSITIONS = List.of("none", "fade", "slide", "convex", "concave", "zoom");
    public static final List<String> TRANSITION_SPEEDS = List.of("default", "fast", "slow");
    public static final List<String> GENERATOR_MODELS = List.of("dall-e-3", "dall-e-2");

    private static final Set<String> LAYOUT_SET = Set.copyOf(ALL_LAYOUTS);

    private FieldValidators() {
    }

    /** Hex {@code #RRGGBB} or {@code rgb(r, g, b)} / {@code rgba(r, g, b, a)}. */
    public static boolean isColor(@Nullable String value) {
        return value != null && (HEX_COLOR.matcher(value).matches() || RGBA_COLOR.matcher(value).matches());
    }

    public static boolean isSemanticVersion(@Nullable String value) {
        return value != null && SEMANTIC_VERSION.matcher(value).matches();
    }

    /**
     * {@code YYYY-MM-DD} naming a real calendar day.
     */
    public static boolean isIsoDate(@Nullable String value) {
        if (value == null || !ISO_DATE.matcher(value).matches()) {
            return false;
        }
        try {
            LocalDate.parse(value);
            return true;
        } catch (DateTimeParseException notACalendarDay) {
            return false;
        }
    }

    public static boolean isShortName(@Nullable String value) {
        return value != null && SHORT_NAME.matcher(value).matches();
    }

    /** {@code WIDTHxHEIGHT} with both sides positive integers. */
    public static boolean isDimension(@Nullable String value) {
        return DimensionParser.parseSize(value).isPresent();
    }

    public static boolean isSlideId(@Nullable String value) {
        return value != null && SLIDE_ID.matcher(value).matches();
    }

    public static boolean isBackgroundFilename(@Nullable String value) {
        return value != null && BACKGROUND_FILENAME.matcher(value).matches();
    }

    public static boolean isIconFilename(@Nullable String value) {
        return value != null && ICON_FILENAME.matcher(value).matches();
    }

    /** Number with an optional {@code px/em/rem/vw/vh/%} unit. Mismatches are reported as warnings. */
    public static boolean isCssSize(@Nullable String value) {
        return value != null && CSS_SIZE.matcher(value).matches();
    }

    public static boolean isLayout(@Nullable String value) {
        return value != null && LAYOUT_SET.contains(value);
    }

    public static boolean isTransition(@Nullable String value) {
        return value != null && TRANSITIONS.contains(value);
    }

    public static boolean isTransitionSpeed(@Nullable String value) {
        return value != null && TRANSITION_SPEEDS.contains(value);
    }

    public static boolean isGeneratorModel(@Nullable String value) {
        return value != null && GENERATOR_MODELS.contains(value);
    }

    public static boolean isPixelBreakpoint(@Nullable String value) {
        return value != null && value.endsWith("px");
    }
}
