package net.deckforge.application.version;

import java.nio.file.Path;

/**
 * A numbered build directory {@code v<version>} inside a project directory.
 */
public record VersionDirectory(int version, Path path) {

    public VersionDirectory {
        if (version < 1) {
            throw new IllegalArgumentException("Build versions start at 1 but was " + version);
        }
    }

    public static String directoryName(int version) {
        return "v" + version;
    }
}
