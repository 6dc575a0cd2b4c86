package net.deckforge.exception;

import java.nio.file.Path;

/**
 * Build directory structure could not be created, migrated or written.
 * Aborts the whole build; never retried.
 */
public class BuildStructureException extends RuntimeException {
    private final Path path;

    public BuildStructureException(String message, Path path, Throwable cause) {
        super(message + " (" + path + ")", cause);
        this.path = path;
    }

    public BuildStructureException(String message, Path path) {
        this(message, path, null);
    }

    public Path getPath() {
        return path;
    }
}
