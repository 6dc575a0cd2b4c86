package net.deckforge.domain.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import tools.jackson.databind.JsonNode;

/**
 * One slide; {@code content} is free-form and passed through to the runtime slide list.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SlideDefinition(
    String id,
    String layout,
    JsonNode content,
    SlideBackground background
) {
}
