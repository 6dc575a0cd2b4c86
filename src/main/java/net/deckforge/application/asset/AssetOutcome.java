package net.deckforge.application.asset;

import jakarta.annotation.Nullable;
import java.nio.file.Path;

/**
 * Result of materializing one asset. Failures are values, never thrown.
 *
 * @param filename asset filename
 * @param status what happened
 * @param path the file on disk, set unless the asset failed
 * @param failureKind the failing step, set only for failures
 * @param detail human-readable failure detail, set only for failures
 */
public record AssetOutcome(
    String filename,
    Status status,
    @Nullable Path path,
    @Nullable FailureKind failureKind,
    @Nullable String detail
) {

    public enum Status {
        GENERATED,
        ALREADY_PRESENT,
        FAILED
    }

    public enum FailureKind {
        /** Generator rejected the request; not retried. */
        GENERATION_FAILED,
        /** Transient generator failures on every allowed attempt. */
        GENERATION_RETRIES_EXHAUSTED,
        DOWNLOAD_FAILED,
        PROCESSING_FAILED,
        WRITE_FAILED,
        CANCELLED
    }

    public static AssetOutcome generated(String filename, Path path) {
        return new AssetOutcome(filename, Status.GENERATED, path, null, null);
    }

    public static AssetOutcome alreadyPresent(String filename, Path path) {
        return new AssetOutcome(filename, Status.ALREADY_PRESENT, path, null, null);
    }

    public static AssetOutcome failure(String filename, FailureKind kind, String detail) {
        return new AssetOutcome(filename, Status.FAILED, null, kind, detail);
    }

    public boolean isSuccess() {
        return status != Status.FAILED;
    }
}
