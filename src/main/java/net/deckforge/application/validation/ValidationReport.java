package net.deckforge.application.validation;

import java.util.List;

/**
 * Ordered errors and warnings for one schema document.
 * A report with no errors is valid; warnings never block a build.
 */
public record ValidationReport(List<String> errors, List<String> warnings) {

    public ValidationReport {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static ValidationReport ofError(String error) {
        return new ValidationReport(List.of(error), List.of());
    }

    public boolean isValid() {
        return errors.isEmpty();
    }
}
