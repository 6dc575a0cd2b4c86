package net.deckforge.domain.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Generation settings shared by every asset of the presentation.
 *
 * @param generatorModel image model identifier, serialized as {@code dalle_model}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AssetConfig(
    AssetDimensions dimensions,
    @JsonProperty("naming_convention") String namingConvention,
    @JsonProperty("dalle_model") String generatorModel
) {
}
