package net.deckforge.application.validation;

import static org.assertj.core.api.Assertions.assertThat;

import net.deckforge.testutil.SchemaFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.ObjectNode;

class SchemaValidatorTest {

    private SchemaValidator validator;
    private ObjectNode schema;

    @BeforeEach
    void setUp() {
        validator = new SchemaValidator();
        schema = SchemaFixtures.validSchema();
    }

    @Test
    void should_PassWithoutWarnings_When_SchemaIsComplete() {
        ValidationReport report = validator.validate(schema);

        assertThat(report.errors()).isEmpty();
        assertThat(report.warnings()).isEmpty();
        assertThat(report.isValid()).isTrue();
    }

    @Test
    void should_ReportMissingSection_When_SlidesAbsent() {
        schema.remove("slides");

        ValidationReport report = validator.validate(schema);

        assertThat(report.errors()).containsExactly("required section 'slides' is missing");
    }

    @Test
    void should_ReportEveryFault_When_SeveralSectionsAreInvalid() {
        meta().put("version", "1.0");
        meta().put("short_name", "Deep Sea");
        colors().put("accent", "orange");
        obj(runtime(), "reveal_js").put("transition", "spin");

        ValidationReport report = validator.validate(schema);

        assertThat(report.errors()).hasSize(4);
        assertThat(report.errors()).anySatisfy(e -> assertThat(e).startsWith("meta.short_name").contains("\"Deep Sea\""));
        assertThat(report.errors()).anySatisfy(e -> assertThat(e).startsWith("meta.version").contains("x.y.z"));
        assertThat(report.errors()).anySatisfy(e -> assertThat(e).startsWith("visual_identity.colors.accent"));
        assertThat(report.errors()).anySatisfy(e -> assertThat(e).startsWith("runtime_config.reveal_js.transition"));
    }

    @Test
    void should_ReportMissingLeaf_When_ColorAbsent() {
        colors().remove("border");

        assertThat(validator.validate(schema).errors()).containsExactly("visual_identity.colors.border is required");
    }

    @Test
    void should_ValidateEveryColorValue_When_ExtraKeysPresent() {
        colors().put("highlight", "not-a-color");
        colors().put("shadow", 12);

        ValidationReport report = validator.validate(schema);

        assertThat(report.errors()).hasSize(2);
        assertThat(report.errors().get(0)).startsWith("visual_identity.colors.highlight");
        assertThat(report.errors().get(1)).startsWith("visual_identity.colors.shadow must be a color string");
    }

    @Test
    void should_OnlyWarn_When_CssSizeTokenIsUnusual() {
        obj(schema, "visual_identity", "typography").put("title_size", "huge");
        obj(layouts(), "lf").put("max_width", "half");

        ValidationReport report = validator.validate(schema);

        assertThat(report.isValid()).isTrue();
        assertThat(report.warnings()).hasSize(2);
        assertThat(report.warnings().get(0)).startsWith("visual_identity.typography.title_size");
        assertThat(report.warnings().get(1)).startsWith("layout_system.layouts.lf.max_width");
    }

    @Test
    void should_ReportMissingMandatoryLayout_And_ValidateOptionalLayoutsTheSameWay() {
        layouts().remove("rf");
        layouts().putObject("tl").put("description", "Top left");

        ValidationReport report = validator.validate(schema);

        assertThat(report.errors()).containsExactly(
            "layout_system.layouts.rf is required",
            "layout_system.layouts.tl.text_position is required",
            "layout_system.layouts.tl.text_zone is required",
            "layout_system.layouts.tl.max_width is required");
    }

    @Test
    void should_WarnAboutUnknownLayoutAndSection() {
        layouts().putObject("diagonal")
            .put("description", "d").put("text_position", "p").put("text_zone", "z").put("max_width", "10px");
        schema.putObject("extras");

        ValidationReport report = validator.validate(schema);

        assertThat(report.isValid()).isTrue();
        assertThat(report.warnings()).containsExactlyInAnyOrder(
            "unknown top-level section 'extras' is ignored",
            "layout_system.layouts.diagonal is not a recognized layout and cannot be used by slides");
    }

    @Test
    void should_RejectDuplicateSlideIds_And_BadFilename() {
        ObjectNode second = (ObjectNode) slides().get(1);
        second.put("id", "01");
        obj(second, "background").put("filename", "slide-01-pressure.png");

        ValidationReport report = validator.validate(schema);

        assertThat(report.errors()).containsExactly(
            "slides[1].id duplicates slide id \"01\"",
            "slides[1].background.filename must match 'SLIDE-XX-Concept.png', got: \"slide-01-pressure.png\"");
    }

    @Test
    void should_RequirePrimaryTextZone() {
        obj(slides().get(0), "background", "text_zones").remove("primary");

        assertThat(validator.validate(schema).errors())
            .containsExactly("slides[0].background.text_zones.primary is required");
    }

    @Test
    void should_RejectEmptySlides() {
        schema.putArray("slides");

        assertThat(validator.validate(schema).errors()).containsExactly("slides array cannot be empty");
    }

    @Test
    void should_RejectUnknownSlideLayout_And_NumericId() {
        ObjectNode first = (ObjectNode) slides().get(0);
        first.put("layout", "center");
        first.put("id", 1);

        ValidationReport report = validator.validate(schema);

        assertThat(report.errors()).hasSize(2);
        assertThat(report.errors().get(0)).startsWith("slides[0].id must be a two-digit string");
        assertThat(report.errors().get(1)).startsWith("slides[0].layout must be one of");
    }

    @Test
    void should_WarnWhenBackgroundFilenameIsSharedOrMismatchesId() {
        obj(slides().get(2), "background").put("filename", "SLIDE-01-Abyss.png");

        ValidationReport report = validator.validate(schema);

        assertThat(report.isValid()).isTrue();
        assertThat(report.warnings()).containsExactly(
            "slides[2].background.filename SLIDE-01-Abyss.png does not carry slide id 03",
            "slides[2].background.filename SLIDE-01-Abyss.png is shared with slides[0]; the image is generated once");
    }

    @Test
    void should_RejectNonBooleanTransparency_And_DuplicateIcons() {
        ArrayNode icons = (ArrayNode) schema.get("icons");
        ((ObjectNode) icons.get(0)).put("transparent", "yes");
        icons.addObject().put("filename", "IC-Rover.png").put("prompt", "again").put("transparent", false);

        ValidationReport report = validator.validate(schema);

        assertThat(report.errors()).containsExactly(
            "icons[0].transparent must be boolean, got: \"yes\"",
            "icons[1].filename duplicates icon filename \"IC-Rover.png\"");
    }

    @Test
    void should_AcceptSchemaWithoutIcons() {
        schema.remove("icons");

        assertThat(validator.validate(schema).isValid()).isTrue();
    }

    @Test
    void should_RejectBadFinalSize_And_GenerationSize() {
        ObjectNode background = obj(schema, "asset_config", "dimensions", "background");
        background.put("generation_size", "1792*1024");
        background.putArray("final_size").add(1920).add(-1);

        ValidationReport report = validator.validate(schema);

        assertThat(report.errors()).hasSize(2);
        assertThat(report.errors().get(0)).startsWith("asset_config.dimensions.background.generation_size");
        assertThat(report.errors().get(1)).startsWith("asset_config.dimensions.background.final_size");
    }

    @Test
    void should_RejectUnsupportedGeneratorModel() {
        obj(schema, "asset_config").put("dalle_model", "midjourney");

        assertThat(validator.validate(schema).errors())
            .singleElement()
            .satisfies(e -> assertThat(e).startsWith("asset_config.dalle_model must be one of"));
    }

    @Test
    void should_RequirePixelBreakpoints() {
        obj(runtime(), "responsive_breakpoints").put("mobile", "40em");

        assertThat(validator.validate(schema).errors())
            .containsExactly("runtime_config.responsive_breakpoints.mobile must end with 'px', got: \"40em\"");
    }

    @Test
    void should_ReportTypeError_When_SectionIsNotAnObject() {
        schema.put("meta", "deep-sea");
        schema.putArray("runtime_config");

        ValidationReport report = validator.validate(schema);

        assertThat(report.errors()).containsExactly(
            "meta must be an object, got: string \"deep-sea\"",
            "runtime_config must be an object, got: array");
    }

    @Test
    void should_RejectNonStringFreeTextFields_InOnePass() {
        obj(schema, "asset_config").putObject("naming_convention").put("backgrounds", "SLIDE-XX-Concept.png");
        obj(slides().get(0), "background").putNull("prompt");
        obj(schema, "visual_identity").putArray("style_prompt").add("cinematic");
        meta().put("version", "1.0");

        ValidationReport report = validator.validate(schema);

        assertThat(report.errors()).hasSize(4);
        assertThat(report.errors()).contains(
            "asset_config.naming_convention must be a string, got: object",
            "slides[0].background.prompt must be a string, got: null",
            "visual_identity.style_prompt must be a string, got: array");
        assertThat(report.errors()).anySatisfy(e -> assertThat(e).startsWith("meta.version"));
    }

    @Test
    void should_RejectNumericIconPrompt_And_MetaTitle() {
        ((ObjectNode) schema.get("icons").get(0)).put("prompt", 42);
        meta().put("title", true);

        assertThat(validator.validate(schema).errors()).containsExactlyInAnyOrder(
            "meta.title must be a string, got: boolean true",
            "icons[0].prompt must be a string, got: number 42");
    }

    @Test
    void should_RejectNonObjectRoot() {
        ValidationReport report = validator.validate(SchemaFixtures.MAPPER.createArrayNode());

        assertThat(report.errors()).containsExactly("document root must be a JSON object, got: array");
    }

    private static ObjectNode obj(JsonNode root, String... names) {
        JsonNode node = root;
        for (String name : names) {
            node = node.get(name);
        }
        return (ObjectNode) node;
    }

    private ObjectNode meta() {
        return obj(schema, "meta");
    }

    private ObjectNode colors() {
        return obj(schema, "visual_identity", "colors");
    }

    private ObjectNode layouts() {
        return obj(schema, "layout_system", "layouts");
    }

    private ObjectNode runtime() {
        return obj(schema, "runtime_config");
    }

    private ArrayNode slides() {
        return (ArrayNode) schema.get("slides");
    }
}
