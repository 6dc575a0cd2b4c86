package net.deckforge.application.validation;

import jakarta.annotation.Nullable;
import java.nio.file.Path;
import java.util.Optional;
import net.deckforge.domain.schema.PresentationSchema;
import tools.jackson.databind.JsonNode;

/**
 * Outcome of validating a schema file.
 *
 * @param source the validated file
 * @param report every error and warning found
 * @param document parsed tree, present only when the report is valid
 * @param schema typed view of the document, present only when the report is valid
 */
public record SchemaValidationResult(
    Path source,
    ValidationReport report,
    @Nullable JsonNode document,
    @Nullable PresentationSchema schema
) {

    static SchemaValidationResult rejected(Path source, ValidationReport report) {
        return new SchemaValidationResult(source, report, null, null);
    }

    public boolean isValid() {
        return report.isValid() && schema != null;
    }

    public Optional<PresentationSchema> schemaIfValid() {
        return isValid() ? Optional.of(schema) : Optional.empty();
    }
}
