package net.deckforge.application.validation;

import jakarta.annotation.Nullable;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import org.springframework.stereotype.Component;
import tools.jackson.databind.JsonNode;

/**
 * Structural validator for presentation schema documents.
 *
 * <p>Stateless: each call accumulates into its own {@link Findings} and returns an
 * immutable report, so one instance can validate documents concurrently. Sections
 * are checked top-down and every fault is collected; an invalid section never
 * prevents its siblings from being checked.</p>
 *
 * <p>Messages carry the JSON path, the offending value where there is one, and
 * the rule that was broken.</p>
 */
@Component
public class SchemaValidator {

    private static final List<String> REQUIRED_SECTIONS =
        List.of("meta", "visual_identity", "layout_system", "asset_config", "slides", "runtime_config");
    private static final Set<String> KNOWN_SECTIONS = Set.of(
        "meta", "visual_identity", "layout_system", "asset_config", "slides", "icons", "runtime_config");

    private static final List<String> META_FIELDS = List.of("title", "short_name", "version", "created", "theme");
    private static final List<String> VISUAL_IDENTITY_FIELDS = List.of("colors", "typography", "style_prompt", "atmosphere");
    private static final List<String> COLOR_FIELDS =
        List.of("primary", "secondary", "accent", "text_primary", "text_secondary", "overlay_bg", "border");
    private static final List<String> TYPOGRAPHY_SIZE_FIELDS = List.of("title_size", "subtitle_size", "body_size", "small_size");
    private static final List<String> LAYOUT_FIELDS = List.of("description", "text_position", "text_zone", "max_width");
    private static final List<String> ASSET_CONFIG_FIELDS = List.of("dimensions", "naming_convention", "dalle_model");
    private static final List<String> DIMENSION_CLASSES = List.of("background", "icons");
    private static final List<String> SLIDE_FIELDS = List.of("id", "layout", "content", "background");
    private static final List<String> BACKGROUND_FIELDS = List.of("filename", "concept", "prompt", "text_zones");
    private static final List<String> ICON_FIELDS = List.of("filename", "prompt", "transparent");
    private static final List<String> RUNTIME_FIELDS = List.of("reveal_js", "responsive_breakpoints", "content_sizing");
    private static final List<String> REVEAL_FIELDS = List.of(
        "transition", "transition_speed", "background_transition", "controls", "progress", "keyboard", "touch", "hash");
    private static final List<String> BREAKPOINT_FIELDS = List.of("tablet", "mobile");

    /**
     * Validates a parsed schema document.
     *
     * @param document parsed JSON tree; {@code null} is reported as an error
     * @return every error and warning found, in document order
     */
    public ValidationReport validate(@Nullable JsonNode document) {
        Findings findings = new Findings();
        if (document == null || document.isMissingNode() || document.isNull()) {
            findings.error("document is empty");
            return findings.toReport();
        }
        if (!document.isObject()) {
            findings.error("document root must be a JSON object, got: " + describeType(document));
            return findings.toReport();
        }

        for (String section : REQUIRED_SECTIONS) {
            if (!document.has(section)) {
                findings.error("required section '%s' is missing".formatted(section));
            }
        }
        for (Map.Entry<String, JsonNode> entry : document.properties()) {
            if (!KNOWN_SECTIONS.contains(entry.getKey())) {
                findings.warning("unknown top-level section '%s' is ignored".formatted(entry.getKey()));
            }
        }

        validateMeta(document.get("meta"), findings);
        validateVisualIdentity(document.get("visual_identity"), findings);
        validateLayoutSystem(document.get("layout_system"), findings);
        validateAssetConfig(document.get("asset_config"), findings);
        validateSlides(document.get("slides"), findings);
        validateIcons(document.get("icons"), findings);
        validateRuntimeConfig(document.get("runtime_config"), findings);
        return findings.toReport();
    }

    private void validateMeta(@Nullable JsonNode meta, Findings findings) {
        if (!isObjectSection(meta, "meta", findings)) {
            return;
        }
        requireFields(meta, "meta", META_FIELDS, findings);
        checkStrings(meta, "meta", List.of("title", "theme"), findings);
        checkText(meta, "meta", "short_name", FieldValidators::isShortName,
            "must be lowercase alphanumeric with hyphens only", findings);
        checkText(meta, "meta", "version", FieldValidators::isSemanticVersion,
            "must be a semantic version (x.y.z)", findings);
        checkText(meta, "meta", "created", FieldValidators::isIsoDate,
            "must be a YYYY-MM-DD calendar date", findings);
    }

    private void validateVisualIdentity(@Nullable JsonNode visualIdentity, Findings findings) {
        if (!isObjectSection(visualIdentity, "visual_identity", findings)) {
            return;
        }
        requireFields(visualIdentity, "visual_identity", VISUAL_IDENTITY_FIELDS, findings);
        checkStrings(visualIdentity, "visual_identity", List.of("style_prompt", "atmosphere"), findings);

        JsonNode colors = visualIdentity.get("colors");
        if (isObjectSection(colors, "visual_identity.colors", findings)) {
            requireFields(colors, "visual_identity.colors", COLOR_FIELDS, findings);
            for (Map.Entry<String, JsonNode> color : colors.properties()) {
                String path = "visual_identity.colors." + color.getKey();
                JsonNode value = color.getValue();
                if (!value.isString()) {
                    findings.error("%s must be a color string, got: %s".formatted(path, describeType(value)));
                } else if (!FieldValidators.isColor(value.asString())) {
                    findings.error("%s must be valid hex (#RRGGBB) or rgba() format, got: %s".formatted(path, value));
                }
            }
        }

        JsonNode typography = visualIdentity.get("typography");
        if (isObjectSection(typography, "visual_identity.typography", findings)) {
            requireFields(typography, "visual_identity.typography", List.of("font_family"), findings);
            requireFields(typography, "visual_identity.typography", TYPOGRAPHY_SIZE_FIELDS, findings);
            for (String sizeField : TYPOGRAPHY_SIZE_FIELDS) {
                warnOnCssToken(typography.get(sizeField), "visual_identity.typography." + sizeField, findings);
            }
        }
    }

    private void validateLayoutSystem(@Nullable JsonNode layoutSystem, Findings findings) {
        if (!isObjectSection(layoutSystem, "layout_system", findings)) {
            return;
        }
        JsonNode layouts = layoutSystem.get("layouts");
        if (layouts == null) {
            findings.error("layout_system.layouts is required");
            return;
        }
        if (!isObjectSection(layouts, "layout_system.layouts", findings)) {
            return;
        }
        for (String name : FieldValidators.MANDATORY_LAYOUTS) {
            if (!layouts.has(name)) {
                findings.error("layout_system.layouts.%s is required".formatted(name));
            } else {
                validateLayout(layouts.get(name), name, findings);
            }
        }
        for (String name : FieldValidators.OPTIONAL_LAYOUTS) {
            if (layouts.has(name)) {
                validateLayout(layouts.get(name), name, findings);
            }
        }
        for (Map.Entry<String, JsonNode> entry : layouts.properties()) {
            if (!FieldValidators.isLayout(entry.getKey())) {
                findings.warning("layout_system.layouts.%s is not a recognized layout and cannot be used by slides"
                    .formatted(entry.getKey()));
            }
        }
    }

    private void validateLayout(JsonNode layout, String name, Findings findings) {
        String path = "layout_system.layouts." + name;
        if (!isObjectSection(layout, path, findings)) {
            return;
        }
        requireFields(layout, path, LAYOUT_FIELDS, findings);
        warnOnCssToken(layout.get("max_width"), path + ".max_width", findings);
    }

    private void validateAssetConfig(@Nullable JsonNode assetConfig, Findings findings) {
        if (!isObjectSection(assetConfig, "asset_config", findings)) {
            return;
        }
        requireFields(assetConfig, "asset_config", ASSET_CONFIG_FIELDS, findings);
        checkStrings(assetConfig, "asset_config", List.of("naming_convention"), findings);

        JsonNode dimensions = assetConfig.get("dimensions");
        if (isObjectSection(dimensions, "asset_config.dimensions", findings)) {
            for (String assetClass : DIMENSION_CLASSES) {
                String path = "asset_config.dimensions." + assetClass;
                JsonNode dimension = dimensions.get(assetClass);
                if (dimension == null) {
                    findings.error(path + " is required");
                    continue;
                }
                if (!isObjectSection(dimension, path, findings)) {
                    continue;
                }
                requireFields(dimension, path, List.of("generation_size", "final_size"), findings);
                checkText(dimension, path, "generation_size", FieldValidators::isDimension,
                    "must be WIDTHxHEIGHT with positive integers", findings);
                JsonNode finalSize = dimension.get("final_size");
                if (finalSize != null && !isPositiveIntPair(finalSize)) {
                    findings.error("%s.final_size must be a [width, height] array of two positive integers, got: %s"
                        .formatted(path, finalSize));
                }
            }
        }

        checkText(assetConfig, "asset_config", "dalle_model", FieldValidators::isGeneratorModel,
            "must be one of " + FieldValidators.GENERATOR_MODELS, findings);
    }

    private void validateSlides(@Nullable JsonNode slides, Findings findings) {
        if (slides == null) {
            return;
        }
        if (!slides.isArray()) {
            findings.error("slides must be an array, got: " + describeType(slides));
            return;
        }
        if (slides.isEmpty()) {
            findings.error("slides array cannot be empty");
            return;
        }
        Set<String> seenIds = new HashSet<>();
        Map<String, Integer> backgroundOwners = new HashMap<>();
        for (int i = 0; i < slides.size(); i++) {
            String path = "slides[%d]".formatted(i);
            JsonNode slide = slides.get(i);
            if (!isObjectSection(slide, path, findings)) {
                continue;
            }
            requireFields(slide, path, SLIDE_FIELDS, findings);

            String slideId = null;
            JsonNode id = slide.get("id");
            if (id != null) {
                if (!id.isString()) {
                    findings.error("%s.id must be a two-digit string (e.g. \"01\"), got: %s".formatted(path, id));
                } else {
                    slideId = id.asString();
                    if (!FieldValidators.isSlideId(slideId)) {
                        findings.error("%s.id must be two-digit zero-padded (e.g. \"01\"), got: %s".formatted(path, id));
                    }
                    if (!seenIds.add(slideId)) {
                        findings.error("%s.id duplicates slide id %s".formatted(path, id));
                    }
                }
            }

            checkText(slide, path, "layout", FieldValidators::isLayout,
                "must be one of " + FieldValidators.ALL_LAYOUTS, findings);

            JsonNode background = slide.get("background");
            if (background != null) {
                validateBackground(background, path + ".background", slideId, i, backgroundOwners, findings);
            }
        }
    }

    private void validateBackground(JsonNode background, String path, @Nullable String slideId, int slideIndex,
                                    Map<String, Integer> backgroundOwners, Findings findings) {
        if (!isObjectSection(background, path, findings)) {
            return;
        }
        requireFields(background, path, BACKGROUND_FIELDS, findings);
        checkStrings(background, path, List.of("concept", "prompt"), findings);
        boolean validName = checkText(background, path, "filename", FieldValidators::isBackgroundFilename,
            "must match 'SLIDE-XX-Concept.png'", findings);
        if (validName) {
            String filename = background.get("filename").asString();
            if (slideId != null && FieldValidators.isSlideId(slideId) && !filename.startsWith("SLIDE-" + slideId + "-")) {
                findings.warning("%s.filename %s does not carry slide id %s".formatted(path, filename, slideId));
            }
            Integer owner = backgroundOwners.putIfAbsent(filename, slideIndex);
            if (owner != null) {
                findings.warning("%s.filename %s is shared with slides[%d]; the image is generated once"
                    .formatted(path, filename, owner));
            }
        }

        JsonNode textZones = background.get("text_zones");
        if (textZones != null && isObjectSection(textZones, path + ".text_zones", findings)
            && !textZones.has("primary")) {
            findings.error(path + ".text_zones.primary is required");
        }
    }

    private void validateIcons(@Nullable JsonNode icons, Findings findings) {
        if (icons == null || icons.isNull()) {
            return;
        }
        if (!icons.isArray()) {
            findings.error("icons must be an array, got: " + describeType(icons));
            return;
        }
        Set<String> seenFilenames = new HashSet<>();
        for (int i = 0; i < icons.size(); i++) {
            String path = "icons[%d]".formatted(i);
            JsonNode icon = icons.get(i);
            if (!isObjectSection(icon, path, findings)) {
                continue;
            }
            requireFields(icon, path, ICON_FIELDS, findings);
        checkStrings(icon, path, List.of("prompt"), findings);
            checkText(icon, path, "filename", FieldValidators::isIconFilename,
                "must match 'IC-Name.png'", findings);
            JsonNode filename = icon.get("filename");
            if (filename != null && filename.isString() && !seenFilenames.add(filename.asString())) {
                findings.error("%s.filename duplicates icon filename %s".formatted(path, filename));
            }
            JsonNode transparent = icon.get("transparent");
            if (transparent != null && !transparent.isBoolean()) {
                findings.error("%s.transparent must be boolean, got: %s".formatted(path, transparent));
            }
        }
    }

    private void validateRuntimeConfig(@Nullable JsonNode runtimeConfig, Findings findings) {
        if (!isObjectSection(runtimeConfig, "runtime_config", findings)) {
            return;
        }
        requireFields(runtimeConfig, "runtime_config", RUNTIME_FIELDS, findings);

        JsonNode reveal = runtimeConfig.get("reveal_js");
        if (isObjectSection(reveal, "runtime_config.reveal_js", findings)) {
            requireFields(reveal, "runtime_config.reveal_js", REVEAL_FIELDS, findings);
            checkText(reveal, "runtime_config.reveal_js", "transition", FieldValidators::isTransition,
                "must be one of " + FieldValidators.TRANSITIONS, findings);
            checkText(reveal, "runtime_config.reveal_js", "transition_speed", FieldValidators::isTransitionSpeed,
                "must be one of " + FieldValidators.TRANSITION_SPEEDS, findings);
        }

        JsonNode breakpoints = runtimeConfig.get("responsive_breakpoints");
        if (isObjectSection(breakpoints, "runtime_config.responsive_breakpoints", findings)) {
            requireFields(breakpoints, "runtime_config.responsive_breakpoints", BREAKPOINT_FIELDS, findings);
            for (String field : BREAKPOINT_FIELDS) {
                checkText(breakpoints, "runtime_config.responsive_breakpoints", field,
                    FieldValidators::isPixelBreakpoint, "must end with 'px'", findings);
            }
        }
    }

    /**
     * Reports a non-object section. A {@code null} node means the section is absent,
     * which the caller has already reported as missing.
     */
    private static boolean isObjectSection(@Nullable JsonNode node, String path, Findings findings) {
        if (node == null) {
            return false;
        }
        if (!node.isObject()) {
            findings.error("%s must be an object, got: %s".formatted(path, describeType(node)));
            return false;
        }
        return true;
    }

    private static void requireFields(JsonNode parent, String path, List<String> fields, Findings findings) {
        for (String field : fields) {
            if (!parent.has(field)) {
                findings.error("%s.%s is required".formatted(path, field));
            }
        }
    }

    /**
     * Type-checks free-text leaves that are read as plain strings when the schema is bound.
     */
    private static void checkStrings(JsonNode parent, String path, List<String> fields, Findings findings) {
        for (String field : fields) {
            checkText(parent, path, field, text -> true, "", findings);
        }
    }

    /**
     * Checks an optional-at-this-point text leaf. Absence is ignored here because
     * {@link #requireFields} reports it.
     *
     * @return {@code true} when the field is a string satisfying the rule
     */
    private static boolean checkText(JsonNode parent, String path, String field,
                                     Predicate<String> rule, String ruleDescription, Findings findings) {
        JsonNode value = parent.get(field);
        if (value == null) {
            return false;
        }
        if (!value.isString()) {
            findings.error("%s.%s must be a string, got: %s".formatted(path, field, describeType(value)));
            return false;
        }
        if (!rule.test(value.asString())) {
            findings.error("%s.%s %s, got: %s".formatted(path, field, ruleDescription, value));
            return false;
        }
        return true;
    }

    private static void warnOnCssToken(@Nullable JsonNode value, String path, Findings findings) {
        if (value == null) {
            return;
        }
        String token = value.isString() || value.isNumber() ? value.asString() : null;
        if (!FieldValidators.isCssSize(token)) {
            findings.warning("%s should use a CSS size (number with px, em, rem, vw, vh or %%), got: %s"
                .formatted(path, value));
        }
    }

    private static boolean isPositiveIntPair(JsonNode node) {
        if (!node.isArray() || node.size() != 2) {
            return false;
        }
        for (int i = 0; i < 2; i++) {
            JsonNode side = node.get(i);
            if (!side.isIntegralNumber() || !side.canConvertToInt() || side.intValue() <= 0) {
                return false;
            }
        }
        return true;
    }

    static String describeType(JsonNode node) {
        if (node.isObject()) {
            return "object";
        }
        if (node.isArray()) {
            return "array";
        }
        if (node.isString()) {
            return "string " + node;
        }
        if (node.isNumber()) {
            return "number " + node;
        }
        if (node.isBoolean()) {
            return "boolean " + node;
        }
        if (node.isNull()) {
            return "null";
        }
        return node.toString();
    }
}
