package net.deckforge.domain.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Presentation identity; {@code shortName} names the project build directory.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SchemaMeta(
    String title,
    @JsonProperty("short_name") String shortName,
    String version,
    String created,
    String theme
) {
}
