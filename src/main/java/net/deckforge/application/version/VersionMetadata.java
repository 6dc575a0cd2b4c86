package net.deckforge.application.version;

import jakarta.annotation.Nullable;
import java.time.Instant;

/**
 * Contents of {@code version.json}.
 *
 * @param version this build's version
 * @param createdAt when the metadata was written
 * @param previousVersion the version this build carried assets forward from, if any
 */
public record VersionMetadata(int version, Instant createdAt, @Nullable Integer previousVersion) {
}
