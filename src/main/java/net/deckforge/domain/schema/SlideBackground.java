package net.deckforge.domain.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import tools.jackson.databind.JsonNode;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SlideBackground(
    String filename,
    String concept,
    String prompt,
    @JsonProperty("text_zones") JsonNode textZones
) {
}
