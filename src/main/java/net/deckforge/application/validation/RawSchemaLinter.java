package net.deckforge.application.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Checks raw schema text for hand-editing mistakes before it is parsed, so the
 * author gets line-level hints instead of a bare parser error.
 *
 * <p>Comments stop processing (the parser error they cause is not useful).
 * Trailing commas do not: the parse still runs and its error is reported too.</p>
 */
final class RawSchemaLinter {

    private static final int EXCERPT_LENGTH = 60;

    /**
     * @param errors messages in report order
     * @param blocking {@code true} when parsing must not be attempted
     */
    record LintResult(List<String> errors, boolean blocking) {
        LintResult {
            errors = List.copyOf(errors);
        }
    }

    private RawSchemaLinter() {
    }

    static LintResult lint(String content) {
        String[] lines = content.split("\r?\n", -1);
        List<String> errors = new ArrayList<>();

        if (content.contains("/*") || content.contains("*/")) {
            errors.add("JSON files cannot contain block comments (/* */). Remove all comments from the file.");
            for (int i = 0; i < lines.length; i++) {
                if (lines[i].contains("/*") || lines[i].contains("*/")) {
                    errors.add("  → Comment found on line %d: %s".formatted(i + 1, excerpt(lines[i])));
                }
            }
            return new LintResult(errors, true);
        }

        List<Integer> lineComments = new ArrayList<>();
        for (int i = 0; i < lines.length; i++) {
            String trimmed = lines[i].strip();
            // URLs pasted on their own line look like comments
            if (trimmed.startsWith("//") && !trimmed.contains("http")) {
                lineComments.add(i);
            }
        }
        if (!lineComments.isEmpty()) {
            errors.add("JSON files cannot contain line comments (//).");
            for (int index : lineComments) {
                errors.add("  → Comment found on line %d: %s".formatted(index + 1, excerpt(lines[index])));
            }
            return new LintResult(errors, true);
        }

        SortedSet<Integer> trailingCommaLines = findTrailingCommaLines(content);
        if (!trailingCommaLines.isEmpty()) {
            errors.add("JSON has trailing commas before closing brackets. Remove commas before } or ]");
            for (int lineNumber : trailingCommaLines) {
                errors.add("  → Trailing comma on line %d: %s".formatted(lineNumber, lines[lineNumber - 1].strip()));
            }
        }
        return new LintResult(errors, false);
    }

    /**
     * Finds commas outside string literals whose next non-whitespace character
     * closes an object or array. Returns 1-based line numbers of the commas.
     */
    static SortedSet<Integer> findTrailingCommaLines(String content) {
        SortedSet<Integer> result = new TreeSet<>();
        boolean inString = false;
        boolean escaped = false;
        int line = 1;
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (c == '\n') {
                line++;
            }
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == ',' && closesAfterWhitespace(content, i + 1)) {
                result.add(line);
            }
        }
        return result;
    }

    private static boolean closesAfterWhitespace(String content, int from) {
        for (int j = from; j < content.length(); j++) {
            char next = content.charAt(j);
            if (!Character.isWhitespace(next)) {
                return next == '}' || next == ']';
            }
        }
        return false;
    }

    private static String excerpt(String line) {
        String trimmed = line.strip();
        return trimmed.length() > EXCERPT_LENGTH ? trimmed.substring(0, EXCERPT_LENGTH) + "..." : trimmed;
    }
}
