package net.deckforge.domain.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import tools.jackson.databind.JsonNode;

/**
 * Typed view of a validated presentation schema document.
 * <p>
 * Only bound after the document passed validation, so every required section is present.
 * Sections the build does not interpret ({@code layout_system}, {@code runtime_config})
 * stay as JSON trees.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PresentationSchema(
    SchemaMeta meta,
    @JsonProperty("visual_identity") VisualIdentity visualIdentity,
    @JsonProperty("layout_system") JsonNode layoutSystem,
    @JsonProperty("asset_config") AssetConfig assetConfig,
    List<SlideDefinition> slides,
    List<IconDefinition> icons,
    @JsonProperty("runtime_config") JsonNode runtimeConfig
) {
    public PresentationSchema {
        slides = slides == null ? List.of() : List.copyOf(slides);
        icons = icons == null ? List.of() : List.copyOf(icons);
    }
}
