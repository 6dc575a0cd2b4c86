package net.deckforge.application.validation;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.MalformedInputException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import net.deckforge.domain.schema.PresentationSchema;
import org.springframework.stereotype.Service;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

/**
 * File-level schema validation: read, lint raw text, parse, validate structure, bind.
 *
 * <p>Never throws for a bad input file. A missing or unreadable file, a comment,
 * a parse failure and structural faults all come back as report errors.</p>
 */
@Slf4j
@Service
public class SchemaValidationService {

    private final ObjectMapper objectMapper;
    private final SchemaValidator schemaValidator;

    public SchemaValidationService(ObjectMapper objectMapper, SchemaValidator schemaValidator) {
        this.objectMapper = objectMapper;
        this.schemaValidator = schemaValidator;
    }

    public SchemaValidationResult validateFile(Path schemaFile) {
        String content;
        try {
            content = Files.readString(schemaFile, StandardCharsets.UTF_8);
        } catch (NoSuchFileException missing) {
            return SchemaValidationResult.rejected(schemaFile, ValidationReport.ofError("file not found: " + schemaFile));
        } catch (MalformedInputException badEncoding) {
            return SchemaValidationResult.rejected(schemaFile,
                ValidationReport.ofError("file is not valid UTF-8 text: " + schemaFile));
        } catch (IOException ioException) {
            log.warn("Unable to read schema file {}", schemaFile, ioException);
            return SchemaValidationResult.rejected(schemaFile,
                ValidationReport.ofError("cannot read file %s: %s".formatted(schemaFile, ioException.getMessage())));
        }
        return validateContent(schemaFile, content);
    }

    /**
     * Validates schema text already in memory.
     *
     * @param source path used in log messages and carried on the result
     */
    public SchemaValidationResult validateContent(Path source, String content) {
        Findings findings = new Findings();
        RawSchemaLinter.LintResult lint = RawSchemaLinter.lint(content);
        lint.errors().forEach(findings::error);
        if (lint.blocking()) {
            return SchemaValidationResult.rejected(source, findings.toReport());
        }

        JsonNode document;
        try {
            document = objectMapper.readTree(content);
        } catch (JacksonException parseError) {
            reportParseError(parseError, content, findings);
            return SchemaValidationResult.rejected(source, findings.toReport());
        }

        findings.addAll(schemaValidator.validate(document));
        if (findings.hasErrors()) {
            return SchemaValidationResult.rejected(source, findings.toReport());
        }

        PresentationSchema schema;
        try {
            schema = objectMapper.treeToValue(document, PresentationSchema.class);
        } catch (JacksonException bindError) {
            // Validation accepted a shape the typed model cannot hold
            log.error("Validated schema {} could not be bound", source, bindError);
            findings.error("schema could not be read after validation: " + bindError.getOriginalMessage());
            return SchemaValidationResult.rejected(source, findings.toReport());
        }
        return new SchemaValidationResult(source, findings.toReport(), document, schema);
    }

    private static void reportParseError(JacksonException parseError, String content, Findings findings) {
        var location = parseError.getLocation();
        int lineNumber = location == null ? -1 : location.getLineNr();
        int column = location == null ? -1 : location.getColumnNr();
        if (lineNumber > 0) {
            findings.error("JSON parsing error at line %d, column %d".formatted(lineNumber, column));
        } else {
            findings.error("JSON parsing error");
        }
        findings.error("  → Details: " + parseError.getOriginalMessage());

        String[] lines = content.split("\r?\n", -1);
        if (lineNumber > 0 && lineNumber <= lines.length) {
            String problemLine = lines[lineNumber - 1];
            findings.error("  → Line %d: %s".formatted(lineNumber, problemLine));
            if (column > 0) {
                String prefix = "  → Line %d: ".formatted(lineNumber);
                findings.error(" ".repeat(prefix.length() + column - 1) + "^");
            }
        }
    }
}
