package net.deckforge.application.version;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import net.deckforge.config.DeckForgeProperties;
import net.deckforge.exception.BuildStructureException;
import net.deckforge.support.fs.AtomicFileWriter;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.node.ObjectNode;

/**
 * {@link VersionManager} over the local filesystem.
 *
 * <p>Versions are discovered by scanning the project directory for
 * subdirectories named {@code v<digits>}; anything else is ignored.</p>
 */
@Slf4j
@Component
public class FileSystemVersionManager implements VersionManager {

    private static final Pattern VERSION_DIRECTORY = Pattern.compile("^v(\\d+)$");
    private static final int MAX_ALLOCATION_ATTEMPTS = 5;

    private final ObjectMapper objectMapper;
    private final String assetDirectory;
    private final Clock clock;

    public FileSystemVersionManager(ObjectMapper objectMapper, DeckForgeProperties properties, Clock clock) {
        this.objectMapper = objectMapper;
        this.assetDirectory = properties.getAssetDirectory();
        this.clock = clock;
    }

    @Override
    public int nextVersion(Path projectDir) {
        return latestVersion(projectDir).map(latest -> latest.version() + 1).orElse(1);
    }

    @Override
    public Optional<VersionDirectory> latestVersion(Path projectDir) {
        VersionDirectory latest = null;
        for (VersionDirectory candidate : scanVersions(projectDir)) {
            if (latest == null || candidate.version() > latest.version()) {
                latest = candidate;
            }
        }
        return Optional.ofNullable(latest);
    }

    @Override
    public Optional<VersionDirectory> latestCompletedVersion(Path projectDir) {
        VersionDirectory latest = null;
        for (VersionDirectory candidate : scanVersions(projectDir)) {
            if ((latest == null || candidate.version() > latest.version())
                && readVersionMetadata(candidate.path()).isPresent()) {
                latest = candidate;
            }
        }
        return Optional.ofNullable(latest);
    }

    @Override
    public VersionDirectory allocateVersion(Path projectDir) {
        try {
            Files.createDirectories(projectDir);
        } catch (IOException e) {
            throw new BuildStructureException("Cannot create project directory", projectDir, e);
        }
        for (int attempt = 1; attempt <= MAX_ALLOCATION_ATTEMPTS; attempt++) {
            int version = nextVersion(projectDir);
            Path candidate = projectDir.resolve(VersionDirectory.directoryName(version));
            try {
                Files.createDirectory(candidate);
                log.info("Allocated build version v{} at {}", version, candidate);
                return new VersionDirectory(version, candidate);
            } catch (FileAlreadyExistsException lostRace) {
                log.debug("Version directory {} appeared concurrently (attempt {}/{}); rescanning",
                    candidate, attempt, MAX_ALLOCATION_ATTEMPTS);
            } catch (IOException e) {
                throw new BuildStructureException("Cannot create version directory", candidate, e);
            }
        }
        throw new BuildStructureException(
            "Could not allocate a version directory after " + MAX_ALLOCATION_ATTEMPTS + " attempts", projectDir);
    }

    @Override
    public boolean migrateLegacy(Path legacyDir, Path newVersionDir) {
        if (!Files.isDirectory(legacyDir)) {
            return false;
        }
        Path projectDir = newVersionDir.toAbsolutePath().getParent();
        if (!scanVersions(projectDir).isEmpty()) {
            return false;
        }
        List<Path> legacyEntries = listLegacyEntries(legacyDir);
        if (legacyEntries.isEmpty()) {
            return false;
        }

        log.info("Migrating unversioned build {} into {}", legacyDir, newVersionDir);
        try {
            Files.createDirectories(newVersionDir);
            for (Path entry : legacyEntries) {
                copyRecursively(entry, newVersionDir.resolve(entry.getFileName().toString()));
            }
        } catch (IOException e) {
            throw new BuildStructureException("Cannot migrate legacy build directory " + legacyDir, newVersionDir, e);
        }
        writeVersionMetadata(newVersionDir, 1, null);
        log.info("Migration complete: {} legacy entries now in {}", legacyEntries.size(), newVersionDir);
        return true;
    }

    @Override
    public int carryForward(Path previousVersionDir, Path newVersionDir) {
        Path previousAssets = previousVersionDir.resolve(assetDirectory);
        if (!Files.isDirectory(previousAssets)) {
            return 0;
        }
        Path newAssets = newVersionDir.resolve(assetDirectory);
        int copied = 0;
        try {
            Files.createDirectories(newAssets);
            try (DirectoryStream<Path> entries = Files.newDirectoryStream(previousAssets)) {
                for (Path asset : entries) {
                    String name = asset.getFileName().toString();
                    if (name.startsWith(".") || !Files.isRegularFile(asset)) {
                        continue;
                    }
                    Path destination = newAssets.resolve(name);
                    if (Files.exists(destination)) {
                        continue;
                    }
                    AtomicFileWriter.copy(asset, destination);
                    copied++;
                }
            }
        } catch (IOException e) {
            throw new BuildStructureException("Cannot carry assets forward from " + previousAssets, newAssets, e);
        }
        if (copied > 0) {
            log.info("Carried {} asset(s) forward from {}", copied, previousVersionDir.getFileName());
        }
        return copied;
    }

    @Override
    public void writeVersionMetadata(Path versionDir, int version, Integer previousVersion) {
        ObjectNode metadata = objectMapper.createObjectNode();
        metadata.put("version", version);
        metadata.put("created_at", Instant.now(clock).toString());
        if (previousVersion == null) {
            metadata.putNull("previous_version");
        } else {
            metadata.put("previous_version", previousVersion.intValue());
        }
        Path target = versionDir.resolve(METADATA_FILE);
        try {
            AtomicFileWriter.writeString(target, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(metadata));
        } catch (IOException e) {
            throw new BuildStructureException("Cannot write version metadata", target, e);
        }
    }

    @Override
    public Optional<VersionMetadata> readVersionMetadata(Path versionDir) {
        Path source = versionDir.resolve(METADATA_FILE);
        if (!Files.isRegularFile(source)) {
            return Optional.empty();
        }
        try {
            JsonNode root = objectMapper.readTree(Files.readString(source));
            JsonNode version = root.path("version");
            JsonNode createdAt = root.path("created_at");
            JsonNode previous = root.path("previous_version");
            if (!version.isIntegralNumber() || !createdAt.isString()) {
                log.warn("Ignoring malformed version metadata in {}", source);
                return Optional.empty();
            }
            Integer previousVersion = previous.isIntegralNumber() ? previous.intValue() : null;
            return Optional.of(new VersionMetadata(version.intValue(), Instant.parse(createdAt.asString()), previousVersion));
        } catch (IOException | JacksonException | DateTimeParseException e) {
            log.warn("Unable to read version metadata {}: {}", source, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public boolean updateCurrentPointer(Path projectDir, int version) {
        Path pointer = projectDir.resolve(CURRENT_POINTER);
        Path staging = projectDir.resolve("." + CURRENT_POINTER + "." + UUID.randomUUID() + ".tmp");
        Path relativeTarget = Path.of(VersionDirectory.directoryName(version));
        try {
            Files.createSymbolicLink(staging, relativeTarget);
            Files.move(staging, pointer, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            log.info("Updated {} -> {}", pointer, relativeTarget);
            return true;
        } catch (IOException | UnsupportedOperationException | SecurityException e) {
            log.warn("Could not update {} to {} (symbolic links may be unsupported here): {}",
                pointer, relativeTarget, e.getMessage());
            deleteQuietly(staging);
            return false;
        }
    }

    private List<VersionDirectory> scanVersions(Path projectDir) {
        List<VersionDirectory> versions = new ArrayList<>();
        if (projectDir == null || !Files.isDirectory(projectDir)) {
            return versions;
        }
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(projectDir)) {
            for (Path entry : entries) {
                Matcher matcher = VERSION_DIRECTORY.matcher(entry.getFileName().toString());
                if (!matcher.matches() || !Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
                    continue;
                }
                try {
                    int version = Integer.parseInt(matcher.group(1));
                    if (version >= 1) {
                        versions.add(new VersionDirectory(version, entry));
                    }
                } catch (NumberFormatException overflow) {
                    log.debug("Ignoring out-of-range version directory {}", entry);
                }
            }
        } catch (IOException e) {
            throw new BuildStructureException("Cannot scan project directory for versions", projectDir, e);
        }
        return versions;
    }

    private static List<Path> listLegacyEntries(Path legacyDir) {
        List<Path> entries = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(legacyDir)) {
            for (Path entry : stream) {
                String name = entry.getFileName().toString();
                if (name.startsWith(".") || name.equals(CURRENT_POINTER) || VERSION_DIRECTORY.matcher(name).matches()) {
                    continue;
                }
                entries.add(entry);
            }
        } catch (IOException e) {
            throw new BuildStructureException("Cannot list legacy build directory", legacyDir, e);
        }
        entries.sort(null);
        return entries;
    }

    private static void copyRecursively(Path source, Path target) throws IOException {
        if (!Files.isDirectory(source)) {
            Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
            return;
        }
        Files.walkFileTree(source, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                Files.createDirectories(target.resolve(source.relativize(dir).toString()));
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                if (AtomicFileWriter.isPartial(file)) {
                    return FileVisitResult.CONTINUE;
                }
                Files.copy(file, target.resolve(source.relativize(file).toString()),
                    StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException cleanupFailure) {
            log.debug("Could not remove staging link {}: {}", path, cleanupFailure.getMessage());
        }
    }
}
