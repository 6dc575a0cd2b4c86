package net.deckforge.application.asset;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Per-asset outcomes of one materialization run, in asset spec order.
 */
public record MaterializationReport(List<AssetOutcome> outcomes) {

    public MaterializationReport {
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }

    public static MaterializationReport empty() {
        return new MaterializationReport(List.of());
    }

    /** Filenames present on disk after the run, whether generated now or earlier. */
    public Set<String> succeeded() {
        return outcomes.stream()
            .filter(AssetOutcome::isSuccess)
            .map(AssetOutcome::filename)
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /** Filenames that must be regenerated by re-running the build. */
    public Set<String> failed() {
        return failures().stream()
            .map(AssetOutcome::filename)
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public List<AssetOutcome> failures() {
        return outcomes.stream().filter(outcome -> !outcome.isSuccess()).toList();
    }

    public long generatedCount() {
        return count(AssetOutcome.Status.GENERATED);
    }

    public long alreadyPresentCount() {
        return count(AssetOutcome.Status.ALREADY_PRESENT);
    }

    public boolean hasFailures() {
        return outcomes.stream().anyMatch(outcome -> !outcome.isSuccess());
    }

    private long count(AssetOutcome.Status status) {
        return outcomes.stream().filter(outcome -> outcome.status() == status).count();
    }
}
