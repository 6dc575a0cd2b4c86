package net.deckforge.application.build;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.deckforge.domain.schema.PresentationSchema;
import net.deckforge.testutil.SchemaFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.ObjectNode;

class RuntimeSlideListWriterTest {

    private final RuntimeSlideListWriter writer = new RuntimeSlideListWriter(SchemaFixtures.MAPPER);

    @Test
    void should_FlattenObjectContent_AfterLayoutAndBackground() {
        ArrayNode slides = writer.toRuntimeSlides(schema(SchemaFixtures.validSchema()));

        assertThat(slides).hasSize(3);
        JsonNode first = slides.get(0);
        List<String> names = new ArrayList<>();
        for (Map.Entry<String, JsonNode> property : first.properties()) {
            names.add(property.getKey());
        }
        assertThat(names).containsExactly("layout", "bg", "title", "subtitle");
        assertThat(first.get("layout").asString()).isEqualTo("title-slide");
        assertThat(first.get("bg").asString()).isEqualTo("SLIDE-01-Abyss.png");
        assertThat(slides.get(1).get("bullets").size()).isEqualTo(3);
    }

    @Test
    void should_KeepScalarContent_UnderContentField() {
        JsonNode third = writer.toRuntimeSlides(schema(SchemaFixtures.validSchema())).get(2);

        assertThat(third.get("content").asString()).isEqualTo("Questions?");
    }

    @Test
    void should_LetContentFieldsOverrideDerivedOnes() {
        ObjectNode schema = SchemaFixtures.validSchema();
        ObjectNode content = (ObjectNode) schema.get("slides").get(0).get("content");
        content.put("bg", "custom.png");

        JsonNode first = writer.toRuntimeSlides(schema(schema)).get(0);

        assertThat(first.get("bg").asString()).isEqualTo("custom.png");
    }

    @Test
    void should_WriteFileIntoBuildDirectory(@TempDir Path buildDir) throws Exception {
        Path written = writer.write(schema(SchemaFixtures.validSchema()), buildDir);

        assertThat(written).isEqualTo(buildDir.resolve(RuntimeSlideListWriter.FILE_NAME));
        JsonNode parsed = SchemaFixtures.MAPPER.readTree(Files.readString(written));
        assertThat(parsed.isArray()).isTrue();
        assertThat(parsed.get(1).get("layout").asString()).isEqualTo("lf");
    }

    private static PresentationSchema schema(ObjectNode node) {
        return SchemaFixtures.MAPPER.treeToValue(node, PresentationSchema.class);
    }
}
