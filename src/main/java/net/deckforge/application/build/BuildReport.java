package net.deckforge.application.build;

import jakarta.annotation.Nullable;
import java.nio.file.Path;
import java.util.List;
import net.deckforge.application.asset.MaterializationReport;
import net.deckforge.application.validation.ValidationReport;

/**
 * Everything a build run did, for the CLI summary and for callers deciding what to re-run.
 *
 * @param state terminal state
 * @param visitedStates every state entered, in order
 * @param validation schema validation result
 * @param buildDir directory written to, when one was chosen
 * @param version allocated version, for versioned builds
 * @param previousVersion version assets were carried forward from
 * @param carriedForward number of assets copied from the previous version
 * @param materialization per-asset outcomes
 * @param pointerUpdated whether {@code current} now points at this build
 * @param warnings non-fatal problems
 * @param failureMessage cause of a {@link BuildState#FAILED} run
 */
public record BuildReport(
    BuildState state,
    List<BuildState> visitedStates,
    ValidationReport validation,
    @Nullable Path buildDir,
    @Nullable Integer version,
    @Nullable Integer previousVersion,
    int carriedForward,
    MaterializationReport materialization,
    boolean pointerUpdated,
    List<String> warnings,
    @Nullable String failureMessage
) {

    public BuildReport {
        visitedStates = List.copyOf(visitedStates);
        warnings = List.copyOf(warnings);
        materialization = materialization == null ? MaterializationReport.empty() : materialization;
    }

    public boolean isSuccess() {
        return state == BuildState.DONE;
    }

    /**
     * Assets that failed and will be generated by running the same build again.
     */
    public List<String> regenerationRequired() {
        return List.copyOf(materialization.failed());
    }
}
