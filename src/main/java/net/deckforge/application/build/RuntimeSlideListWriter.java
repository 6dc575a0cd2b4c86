package net.deckforge.application.build;

import java.io.IOException;
import java.nio.file.Path;
import net.deckforge.domain.schema.PresentationSchema;
import net.deckforge.domain.schema.SlideDefinition;
import net.deckforge.exception.BuildStructureException;
import net.deckforge.support.fs.AtomicFileWriter;
import org.springframework.stereotype.Component;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.ObjectNode;

/**
 * Writes {@code slides_runtime.json}, the slide list consumed by the viewer.
 *
 * <p>Each entry starts with {@code layout} and {@code bg} (the background
 * filename). Object content is flattened into the entry, so a content field
 * named {@code layout} or {@code bg} wins; any other content is stored under
 * {@code content}.</p>
 */
@Component
public class RuntimeSlideListWriter {

    public static final String FILE_NAME = "slides_runtime.json";

    private final ObjectMapper objectMapper;

    public RuntimeSlideListWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ArrayNode toRuntimeSlides(PresentationSchema schema) {
        ArrayNode slides = objectMapper.createArrayNode();
        for (SlideDefinition slide : schema.slides()) {
            ObjectNode entry = slides.addObject();
            entry.put("layout", slide.layout());
            entry.put("bg", slide.background().filename());
            JsonNode content = slide.content();
            if (content != null && content.isObject()) {
                entry.setAll((ObjectNode) content.deepCopy());
            } else if (content != null && !content.isMissingNode()) {
                entry.set("content", content.deepCopy());
            }
        }
        return slides;
    }

    /**
     * @return the written file
     * @throws BuildStructureException if the file cannot be written
     */
    public Path write(PresentationSchema schema, Path buildDir) {
        Path target = buildDir.resolve(FILE_NAME);
        String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(toRuntimeSlides(schema));
        try {
            AtomicFileWriter.writeString(target, json);
        } catch (IOException e) {
            throw new BuildStructureException("Cannot write runtime slide list", target, e);
        }
        return target;
    }
}
