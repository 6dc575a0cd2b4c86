package net.deckforge.application.validation;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders a {@link ValidationReport} as the human-readable block printed by the CLI.
 */
public final class ValidationReportFormatter {

    private static final Logger log = LoggerFactory.getLogger(ValidationReportFormatter.class);
    private static final String RULE = "=".repeat(50);

    private ValidationReportFormatter() {
    }

    public static List<String> format(String sourceLabel, ValidationReport report) {
        List<String> lines = new ArrayList<>();
        lines.add("Validating: " + sourceLabel);
        lines.add(RULE);
        if (!report.errors().isEmpty()) {
            lines.add("%d ERROR(S) FOUND:".formatted(report.errors().size()));
            appendNumbered(lines, report.errors());
        }
        if (!report.warnings().isEmpty()) {
            lines.add("%d WARNING(S):".formatted(report.warnings().size()));
            appendNumbered(lines, report.warnings());
        }
        lines.add(verdict(report));
        return lines;
    }

    public static String verdict(ValidationReport report) {
        if (!report.isValid()) {
            return "VALIDATION FAILED - %d errors must be fixed".formatted(report.errors().size());
        }
        if (report.warnings().isEmpty()) {
            return "VALIDATION PASSED";
        }
        return "VALIDATION PASSED with %d warnings".formatted(report.warnings().size());
    }

    /**
     * Logs the formatted report; errors at ERROR level, otherwise INFO.
     */
    public static void log(String sourceLabel, ValidationReport report) {
        for (String line : format(sourceLabel, report)) {
            if (report.isValid()) {
                log.info(line);
            } else {
                log.error(line);
            }
        }
    }

    private static void appendNumbered(List<String> lines, List<String> messages) {
        for (int i = 0; i < messages.size(); i++) {
            lines.add("  %d. %s".formatted(i + 1, messages.get(i)));
        }
    }
}
