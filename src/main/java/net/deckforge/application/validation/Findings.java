package net.deckforge.application.validation;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-call accumulator; never shared between validations.
 */
final class Findings {

    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    void error(String message) {
        errors.add(message);
    }

    void warning(String message) {
        warnings.add(message);
    }

    void addAll(ValidationReport report) {
        errors.addAll(report.errors());
        warnings.addAll(report.warnings());
    }

    boolean hasErrors() {
        return !errors.isEmpty();
    }

    ValidationReport toReport() {
        return new ValidationReport(errors, warnings);
    }
}
