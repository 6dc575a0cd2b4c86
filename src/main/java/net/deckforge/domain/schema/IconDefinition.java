package net.deckforge.domain.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record IconDefinition(String filename, String prompt, boolean transparent) {
}
