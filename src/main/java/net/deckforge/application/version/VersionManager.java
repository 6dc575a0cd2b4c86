package net.deckforge.application.version;

import java.nio.file.Path;
import java.util.Optional;
import net.deckforge.exception.BuildStructureException;

/**
 * Discovers, allocates and links numbered build versions of a project.
 *
 * <p>A project directory holds one {@code v<N>} subdirectory per build and a
 * {@code current} link to the newest successful one. Version numbers only grow;
 * gaps left by deleted versions are never reused.</p>
 */
public interface VersionManager {

    /** File holding {@link VersionMetadata} inside a version directory. */
    String METADATA_FILE = "version.json";

    /** Name of the link to the newest successful build. */
    String CURRENT_POINTER = "current";

    /**
     * @return the highest existing version plus one, or 1 when none exists or the project directory is missing
     */
    int nextVersion(Path projectDir);

    Optional<VersionDirectory> latestVersion(Path projectDir);

    /**
     * @return the highest version whose build finished, i.e. whose directory holds {@link #METADATA_FILE}
     */
    Optional<VersionDirectory> latestCompletedVersion(Path projectDir);

    /**
     * Creates the next version directory. Creation is exclusive, so two concurrent
     * builds never receive the same version.
     *
     * @throws BuildStructureException if no directory could be created
     */
    VersionDirectory allocateVersion(Path projectDir);

    /**
     * Copies an unversioned legacy build into {@code newVersionDir} as version 1.
     * Runs only when {@code legacyDir} holds legacy entries and the project has no versions yet.
     *
     * @return {@code true} if a migration happened
     * @throws BuildStructureException if copying fails
     */
    boolean migrateLegacy(Path legacyDir, Path newVersionDir);

    /**
     * Copies generated assets missing from {@code newVersionDir} out of {@code previousVersionDir}.
     *
     * @return number of files copied
     * @throws BuildStructureException if copying fails
     */
    int carryForward(Path previousVersionDir, Path newVersionDir);

    void writeVersionMetadata(Path versionDir, int version, Integer previousVersion);

    Optional<VersionMetadata> readVersionMetadata(Path versionDir);

    /**
     * Points {@code current} at {@code v<version>}, replacing any previous link atomically.
     *
     * @return {@code false} if the link could not be created; never throws for that
     */
    boolean updateCurrentPointer(Path projectDir, int version);
}
