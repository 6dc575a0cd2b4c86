package net.deckforge.domain.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import tools.jackson.databind.JsonNode;

@JsonIgnoreProperties(ignoreUnknown = true)
public record VisualIdentity(
    JsonNode colors,
    JsonNode typography,
    @JsonProperty("style_prompt") String stylePrompt,
    String atmosphere
) {
}
