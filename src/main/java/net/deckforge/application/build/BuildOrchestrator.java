package net.deckforge.application.build;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import net.deckforge.application.asset.AssetMaterializer;
import net.deckforge.application.asset.AssetOutcome;
import net.deckforge.application.asset.AssetSpec;
import net.deckforge.application.asset.AssetSpecFactory;
import net.deckforge.application.asset.MaterializationReport;
import net.deckforge.application.validation.SchemaValidationResult;
import net.deckforge.application.validation.SchemaValidationService;
import net.deckforge.application.validation.ValidationReport;
import net.deckforge.application.validation.ValidationReportFormatter;
import net.deckforge.application.version.VersionDirectory;
import net.deckforge.application.version.VersionManager;
import net.deckforge.config.DeckForgeProperties;
import net.deckforge.domain.schema.PresentationSchema;
import net.deckforge.exception.BuildStructureException;
import net.deckforge.support.concurrent.BuildCancellation;
import net.deckforge.support.fs.AtomicFileWriter;
import org.springframework.stereotype.Service;

/**
 * Runs one build: validate the schema, pick or allocate the build directory,
 * carry assets forward, materialize missing assets, then write the runtime
 * artifacts and move the {@code current} pointer.
 *
 * <p>Steps run sequentially; only materialization fans out to workers. Asset
 * failures are reported, never fatal. A {@link BuildStructureException} or a
 * cancellation ends the run in {@link BuildState#FAILED} without touching
 * {@code current}.</p>
 */
@Slf4j
@Service
public class BuildOrchestrator {

    public static final String SCHEMA_COPY_NAME = "presentation_schema.json";

    private final SchemaValidationService validationService;
    private final VersionManager versionManager;
    private final AssetMaterializer assetMaterializer;
    private final RuntimeSlideListWriter runtimeSlideListWriter;
    private final ViewerTemplateCopier viewerTemplateCopier;
    private final DeckForgeProperties properties;

    public BuildOrchestrator(SchemaValidationService validationService,
                             VersionManager versionManager,
                             AssetMaterializer assetMaterializer,
                             RuntimeSlideListWriter runtimeSlideListWriter,
                             ViewerTemplateCopier viewerTemplateCopier,
                             DeckForgeProperties properties) {
        this.validationService = validationService;
        this.versionManager = versionManager;
        this.assetMaterializer = assetMaterializer;
        this.runtimeSlideListWriter = runtimeSlideListWriter;
        this.viewerTemplateCopier = viewerTemplateCopier;
        this.properties = properties;
    }

    public BuildReport build(BuildRequest request) {
        return build(request, BuildCancellation.none());
    }

    public BuildReport build(BuildRequest request, BuildCancellation cancellation) {
        BuildRun run = new BuildRun();

        run.enter(BuildState.VALIDATING);
        SchemaValidationResult validation = validationService.validateFile(request.schemaFile());
        run.validation = validation.report();
        ValidationReportFormatter.log(request.schemaFile().toString(), validation.report());
        if (!validation.isValid()) {
            run.enter(BuildState.REJECTED);
            return run.toReport();
        }
        PresentationSchema schema = validation.schema();

        try {
            run.enter(BuildState.ALLOCATING_VERSION);
            Path projectDir = Path.of(properties.getBuildRoot()).resolve(schema.meta().shortName());
            Optional<VersionDirectory> previous = Optional.empty();
            Optional<VersionDirectory> unfinished = Optional.empty();
            VersionDirectory allocated = null;
            if (request.outputOverride() != null) {
                run.buildDir = request.outputOverride();
            } else if (!request.versioned()) {
                run.buildDir = projectDir;
            } else {
                versionManager.migrateLegacy(projectDir, projectDir.resolve(VersionDirectory.directoryName(1)));
                previous = versionManager.latestCompletedVersion(projectDir);
                int completed = previous.map(VersionDirectory::version).orElse(0);
                unfinished = versionManager.latestVersion(projectDir).filter(latest -> latest.version() > completed);
                allocated = versionManager.allocateVersion(projectDir);
                run.buildDir = allocated.path();
                run.version = allocated.version();
                run.previousVersion = previous.map(VersionDirectory::version).orElse(null);
            }
            createBuildDirectory(run.buildDir);
            copySchema(request.schemaFile(), run.buildDir);
            log.info("Building '{}' into {}{}", schema.meta().title(), run.buildDir,
                run.version == null ? "" : " (v" + run.version + ")");

            run.enter(BuildState.CARRYING_FORWARD);
            // assets from an interrupted newer build are kept too, so a re-run resumes it
            if (unfinished.isPresent()) {
                run.carriedForward += versionManager.carryForward(unfinished.get().path(), run.buildDir);
            }
            if (previous.isPresent()) {
                run.carriedForward += versionManager.carryForward(previous.get().path(), run.buildDir);
            }

            run.enter(BuildState.MATERIALIZING);
            List<AssetSpec> specs = AssetSpecFactory.fromSchema(schema);
            run.materialization = assetMaterializer.materialize(specs,
                run.buildDir.resolve(properties.getAssetDirectory()),
                progressLogger(specs.size()),
                cancellation);
            if (cancellation.isCancelled()) {
                return run.fail("Build cancelled; re-run the same command to resume");
            }

            run.enter(BuildState.FINALIZING);
            runtimeSlideListWriter.write(schema, run.buildDir);
            run.warnings.addAll(viewerTemplateCopier.copyInto(run.buildDir));
            if (allocated != null) {
                versionManager.writeVersionMetadata(run.buildDir, allocated.version(), run.previousVersion);
                run.pointerUpdated = versionManager.updateCurrentPointer(projectDir, allocated.version());
                if (!run.pointerUpdated) {
                    run.warnings.add("Could not point '%s' at %s; open the version directory directly"
                        .formatted(VersionManager.CURRENT_POINTER, VersionDirectory.directoryName(allocated.version())));
                }
            }
            run.enter(BuildState.DONE);
            return run.toReport();
        } catch (BuildStructureException structural) {
            log.error("Build failed: {}", structural.getMessage(), structural);
            return run.fail(structural.getMessage());
        }
    }

    private static Consumer<AssetOutcome> progressLogger(int total) {
        AtomicInteger processed = new AtomicInteger();
        return outcome -> log.info("[{}/{}] {} {}", processed.incrementAndGet(), total, outcome.filename(),
            outcome.isSuccess() ? outcome.status() : outcome.failureKind());
    }

    private static void createBuildDirectory(Path buildDir) {
        try {
            Files.createDirectories(buildDir);
        } catch (IOException e) {
            throw new BuildStructureException("Cannot create build directory", buildDir, e);
        }
    }

    private static void copySchema(Path schemaFile, Path buildDir) {
        Path target = buildDir.resolve(SCHEMA_COPY_NAME);
        try {
            if (Files.exists(target) && Files.isSameFile(schemaFile, target)) {
                return;
            }
            AtomicFileWriter.copy(schemaFile, target);
        } catch (IOException e) {
            throw new BuildStructureException("Cannot copy schema into build directory", target, e);
        }
    }

    /**
     * Mutable state of one run; confined to the calling thread.
     */
    private static final class BuildRun {
        private final List<BuildState> visited = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();
        private BuildState state;
        private ValidationReport validation = new ValidationReport(List.of(), List.of());
        private Path buildDir;
        private Integer version;
        private Integer previousVersion;
        private int carriedForward;
        private MaterializationReport materialization = MaterializationReport.empty();
        private boolean pointerUpdated;

        void enter(BuildState next) {
            state = next;
            visited.add(next);
            log.debug("Build state -> {}", next);
        }

        BuildReport fail(String message) {
            enter(BuildState.FAILED);
            return toReport(message);
        }

        BuildReport toReport() {
            return toReport(null);
        }

        private BuildReport toReport(String failureMessage) {
            return new BuildReport(state, visited, validation, buildDir, version, previousVersion,
                carriedForward, materialization, pointerUpdated, warnings, failureMessage);
        }
    }
}
