package net.deckforge.domain.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AssetDimensions(AssetDimension background, AssetDimension icons) {
}
