package net.deckforge.domain.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Requested generator size ({@code WIDTHxHEIGHT}) and the exact size the stored asset is resized to.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AssetDimension(
    @JsonProperty("generation_size") String generationSize,
    @JsonProperty("final_size") List<Integer> finalSize
) {
}
