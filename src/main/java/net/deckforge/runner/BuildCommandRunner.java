package net.deckforge.runner;

import jakarta.annotation.PreDestroy;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import net.deckforge.application.asset.AssetOutcome;
import net.deckforge.application.build.BuildOrchestrator;
import net.deckforge.application.build.BuildReport;
import net.deckforge.application.build.BuildRequest;
import net.deckforge.application.validation.SchemaValidationResult;
import net.deckforge.application.validation.SchemaValidationService;
import net.deckforge.application.validation.ValidationReportFormatter;
import net.deckforge.support.concurrent.BuildCancellation;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Command-line entry point.
 *
 * <pre>
 * deckforge --schema=presentation.json [--output=DIR] [--no-version] [--validate-only]
 * deckforge presentation.json
 * </pre>
 *
 * Exit codes: 0 success, 1 rejected schema or failed build, 2 usage error.
 * Assets that failed to generate are listed but do not change the exit code.
 */
@Slf4j
@Component
public class BuildCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private static final String OPT_SCHEMA = "schema";
    private static final String OPT_OUTPUT = "output";
    private static final String OPT_NO_VERSION = "no-version";
    private static final String OPT_VALIDATE_ONLY = "validate-only";
    private static final Set<String> KNOWN_OPTIONS = Set.of(OPT_SCHEMA, OPT_OUTPUT, OPT_NO_VERSION, OPT_VALIDATE_ONLY);
    private static final String USAGE =
        "Usage: deckforge --schema=<presentation.json> [--output=<dir>] [--no-version] [--validate-only]";

    private final BuildOrchestrator buildOrchestrator;
    private final SchemaValidationService validationService;
    private final AtomicReference<BuildCancellation> activeBuild = new AtomicReference<>();
    private volatile int exitCode = EXIT_OK;

    public BuildCommandRunner(BuildOrchestrator buildOrchestrator, SchemaValidationService validationService) {
        this.buildOrchestrator = buildOrchestrator;
        this.validationService = validationService;
    }

    @Override
    public void run(ApplicationArguments arguments) {
        Path schemaFile;
        Path output;
        try {
            schemaFile = resolveSchemaFile(arguments);
            output = singleValue(arguments, OPT_OUTPUT);
            rejectUnknownOptions(arguments);
        } catch (IllegalArgumentException usageError) {
            log.error("{}", usageError.getMessage());
            log.error(USAGE);
            exitCode = EXIT_USAGE;
            return;
        }

        if (arguments.containsOption(OPT_VALIDATE_ONLY)) {
            SchemaValidationResult result = validationService.validateFile(schemaFile);
            ValidationReportFormatter.log(schemaFile.toString(), result.report());
            exitCode = result.isValid() ? EXIT_OK : EXIT_FAILED;
            return;
        }

        BuildRequest request = new BuildRequest(schemaFile, output, !arguments.containsOption(OPT_NO_VERSION));
        BuildCancellation cancellation = new BuildCancellation();
        activeBuild.set(cancellation);
        try {
            BuildReport report = buildOrchestrator.build(request, cancellation);
            logSummary(report);
            exitCode = report.isSuccess() ? EXIT_OK : EXIT_FAILED;
        } finally {
            activeBuild.set(null);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Cancels a running build when the context closes (for example on Ctrl-C),
     * so workers stop between assets instead of being cut off mid-write.
     */
    @PreDestroy
    void cancelActiveBuild() {
        BuildCancellation cancellation = activeBuild.get();
        if (cancellation != null) {
            log.warn("Shutdown requested; cancelling the running build");
            cancellation.cancel();
        }
    }

    private static Path resolveSchemaFile(ApplicationArguments arguments) {
        Path fromOption = singleValue(arguments, OPT_SCHEMA);
        List<String> positional = arguments.getNonOptionArgs();
        if (fromOption != null && !positional.isEmpty()) {
            throw new IllegalArgumentException("Give the schema either as --schema or as an argument, not both");
        }
        if (positional.size() > 1) {
            throw new IllegalArgumentException("Expected one schema file but got " + positional);
        }
        if (fromOption != null) {
            return fromOption;
        }
        if (positional.isEmpty()) {
            throw new IllegalArgumentException("Missing schema file");
        }
        return Path.of(positional.get(0));
    }

    private static Path singleValue(ApplicationArguments arguments, String option) {
        if (!arguments.containsOption(option)) {
            return null;
        }
        List<String> values = arguments.getOptionValues(option);
        if (values == null || values.size() != 1 || values.get(0).isBlank()) {
            throw new IllegalArgumentException("Option --" + option + " needs exactly one value");
        }
        return Path.of(values.get(0));
    }

    private static void rejectUnknownOptions(ApplicationArguments arguments) {
        for (String option : arguments.getOptionNames()) {
            // spring.* and deckforge.* options configure the application itself
            if (!KNOWN_OPTIONS.contains(option) && !option.startsWith("spring.") && !option.startsWith("deckforge.")
                && !option.startsWith("logging.")) {
                throw new IllegalArgumentException("Unknown option --" + option);
            }
        }
    }

    private static void logSummary(BuildReport report) {
        switch (report.state()) {
            case REJECTED -> log.error("Schema rejected; nothing was built");
            case FAILED -> log.error("Build failed: {}", report.failureMessage());
            default -> {
                log.info("Build complete: {}", report.buildDir());
                if (report.version() != null) {
                    log.info("Version: v{}{}", report.version(),
                        report.previousVersion() == null ? "" : " (previous v" + report.previousVersion() + ")");
                }
                if (report.carriedForward() > 0) {
                    log.info("Carried forward {} asset(s)", report.carriedForward());
                }
                log.info("Assets: {} generated, {} already present, {} failed",
                    report.materialization().generatedCount(),
                    report.materialization().alreadyPresentCount(),
                    report.materialization().failures().size());
            }
        }
        for (String warning : report.warnings()) {
            log.warn(warning);
        }
        List<AssetOutcome> failures = report.materialization().failures();
        if (!failures.isEmpty()) {
            log.warn("{} asset(s) must be regenerated:", failures.size());
            for (AssetOutcome failure : failures) {
                log.warn("  - {} ({}: {})", failure.filename(), failure.failureKind(), failure.detail());
            }
            log.warn("Run the same command again to retry them.");
        }
    }
}
