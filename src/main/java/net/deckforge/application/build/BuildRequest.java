package net.deckforge.application.build;

import jakarta.annotation.Nullable;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Inputs of one build.
 *
 * @param schemaFile presentation schema to build
 * @param outputOverride explicit build directory; disables versioning when set
 * @param versioned whether to allocate a new {@code v<N>} directory
 */
public record BuildRequest(Path schemaFile, @Nullable Path outputOverride, boolean versioned) {

    public BuildRequest {
        Objects.requireNonNull(schemaFile, "schemaFile");
    }

    public static BuildRequest versioned(Path schemaFile) {
        return new BuildRequest(schemaFile, null, true);
    }
}
