package net.deckforge.application.version;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import net.deckforge.config.DeckForgeProperties;
import net.deckforge.exception.BuildStructureException;
import net.deckforge.testutil.SchemaFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileSystemVersionManagerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");

    @TempDir
    Path root;

    private Path projectDir;
    private FileSystemVersionManager manager;

    @BeforeEach
    void setUp() {
        projectDir = root.resolve("deep-sea");
        manager = new FileSystemVersionManager(SchemaFixtures.MAPPER, new DeckForgeProperties(),
            Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void should_StartAtOne_When_ProjectDirectoryMissing() {
        assertThat(manager.nextVersion(projectDir)).isEqualTo(1);
        assertThat(manager.latestVersion(projectDir)).isEmpty();
    }

    @Test
    void should_UseHighestVersion_AndIgnoreNonVersionEntries() throws IOException {
        Files.createDirectories(projectDir.resolve("v1"));
        Files.createDirectories(projectDir.resolve("v7"));
        Files.createDirectories(projectDir.resolve("v3"));
        Files.createDirectories(projectDir.resolve("v2-old"));
        Files.createDirectories(projectDir.resolve("version9"));
        Files.writeString(projectDir.resolve("v12"), "a file, not a version");

        assertThat(manager.latestVersion(projectDir)).get().extracting(VersionDirectory::version).isEqualTo(7);
        assertThat(manager.nextVersion(projectDir)).isEqualTo(8);
    }

    @Test
    void should_SkipUnfinishedVersions_When_LookingForLatestCompleted() throws IOException {
        Files.createDirectories(projectDir.resolve("v1"));
        manager.writeVersionMetadata(projectDir.resolve("v1"), 1, null);
        Files.createDirectories(projectDir.resolve("v2"));

        assertThat(manager.latestCompletedVersion(projectDir)).get()
            .extracting(VersionDirectory::version).isEqualTo(1);
        assertThat(manager.latestVersion(projectDir)).get()
            .extracting(VersionDirectory::version).isEqualTo(2);
        assertThat(manager.latestCompletedVersion(root.resolve("missing"))).isEmpty();
    }

    @Test
    void should_NeverReuseGaps() throws IOException {
        Files.createDirectories(projectDir.resolve("v5"));

        VersionDirectory allocated = manager.allocateVersion(projectDir);

        assertThat(allocated.version()).isEqualTo(6);
        assertThat(allocated.path()).isEqualTo(projectDir.resolve("v6")).isDirectory();
    }

    @Test
    void should_AllocateDistinctVersions_OnConsecutiveCalls() {
        VersionDirectory first = manager.allocateVersion(projectDir);
        VersionDirectory second = manager.allocateVersion(projectDir);

        assertThat(first.version()).isEqualTo(1);
        assertThat(second.version()).isEqualTo(2);
    }

    @Test
    void should_CopyLegacyBuildIntoVersionOne() throws IOException {
        Files.createDirectories(projectDir.resolve("assets_generated"));
        Files.writeString(projectDir.resolve("assets_generated/SLIDE-01-A.png"), "png");
        Files.writeString(projectDir.resolve("assets_generated/.SLIDE-02-B.png.77.partial"), "half");
        Files.writeString(projectDir.resolve("index.html"), "<html/>");
        Files.writeString(projectDir.resolve(".DS_Store"), "junk");

        boolean migrated = manager.migrateLegacy(projectDir, projectDir.resolve("v1"));

        assertThat(migrated).isTrue();
        Path v1 = projectDir.resolve("v1");
        assertThat(v1.resolve("assets_generated/SLIDE-01-A.png")).hasContent("png");
        assertThat(v1.resolve("assets_generated/.SLIDE-02-B.png.77.partial")).doesNotExist();
        assertThat(v1.resolve("index.html")).exists();
        assertThat(v1.resolve(".DS_Store")).doesNotExist();
        assertThat(projectDir.resolve("index.html")).exists();
        assertThat(manager.readVersionMetadata(v1)).get()
            .isEqualTo(new VersionMetadata(1, NOW, null));
    }

    @Test
    void should_SkipMigration_When_VersionsAlreadyExist() throws IOException {
        Files.createDirectories(projectDir.resolve("v1"));
        Files.writeString(projectDir.resolve("index.html"), "<html/>");

        assertThat(manager.migrateLegacy(projectDir, projectDir.resolve("v1"))).isFalse();
        assertThat(projectDir.resolve("v1/index.html")).doesNotExist();
    }

    @Test
    void should_SkipMigration_When_NothingToMigrate() throws IOException {
        Files.createDirectories(projectDir);

        assertThat(manager.migrateLegacy(projectDir, projectDir.resolve("v1"))).isFalse();
        assertThat(manager.migrateLegacy(root.resolve("absent"), root.resolve("absent/v1"))).isFalse();
        assertThat(projectDir.resolve("v1")).doesNotExist();
    }

    @Test
    void should_CarryForwardOnlyMissingAssets() throws IOException {
        Path previous = Files.createDirectories(projectDir.resolve("v1/assets_generated"));
        Files.writeString(previous.resolve("SLIDE-01-A.png"), "old-a");
        Files.writeString(previous.resolve("SLIDE-02-B.png"), "old-b");
        Files.writeString(previous.resolve(".SLIDE-03-C.png.1.partial"), "half");
        Path next = Files.createDirectories(projectDir.resolve("v2/assets_generated"));
        Files.writeString(next.resolve("SLIDE-02-B.png"), "new-b");

        int copied = manager.carryForward(projectDir.resolve("v1"), projectDir.resolve("v2"));

        assertThat(copied).isEqualTo(1);
        assertThat(next.resolve("SLIDE-01-A.png")).hasContent("old-a");
        assertThat(next.resolve("SLIDE-02-B.png")).hasContent("new-b");
        assertThat(next.resolve(".SLIDE-03-C.png.1.partial")).doesNotExist();
    }

    @Test
    void should_CarryNothing_When_PreviousHasNoAssets() throws IOException {
        Files.createDirectories(projectDir.resolve("v1"));

        assertThat(manager.carryForward(projectDir.resolve("v1"), projectDir.resolve("v2"))).isZero();
    }

    @Test
    void should_RoundTripMetadata_WithPreviousVersion() throws IOException {
        Path v3 = Files.createDirectories(projectDir.resolve("v3"));

        manager.writeVersionMetadata(v3, 3, 2);

        assertThat(manager.readVersionMetadata(v3)).contains(new VersionMetadata(3, NOW, 2));
        assertThat(Files.readString(v3.resolve(VersionManager.METADATA_FILE)))
            .contains("\"created_at\"").contains("\"previous_version\"");
    }

    @Test
    void should_IgnoreMalformedMetadata() throws IOException {
        Path v1 = Files.createDirectories(projectDir.resolve("v1"));
        Files.writeString(v1.resolve(VersionManager.METADATA_FILE), "{\"version\": \"one\"}");
        Path v2 = Files.createDirectories(projectDir.resolve("v2"));
        Files.writeString(v2.resolve(VersionManager.METADATA_FILE), "not json");

        assertThat(manager.readVersionMetadata(v1)).isEmpty();
        assertThat(manager.readVersionMetadata(v2)).isEmpty();
        assertThat(manager.readVersionMetadata(projectDir.resolve("v9"))).isEmpty();
    }

    @Test
    void should_PointCurrentAtNewestVersion_WithRelativeLink() throws IOException {
        Files.createDirectories(projectDir.resolve("v1"));
        Files.createDirectories(projectDir.resolve("v2"));

        assertThat(manager.updateCurrentPointer(projectDir, 1)).isTrue();
        assertThat(manager.updateCurrentPointer(projectDir, 2)).isTrue();

        Path pointer = projectDir.resolve(VersionManager.CURRENT_POINTER);
        assertThat(Files.isSymbolicLink(pointer)).isTrue();
        assertThat(Files.readSymbolicLink(pointer)).isEqualTo(Path.of("v2"));
        assertThat(pointer.toRealPath()).isEqualTo(projectDir.resolve("v2").toRealPath());
        try (var entries = Files.list(projectDir)) {
            assertThat(entries.map(p -> p.getFileName().toString())).noneMatch(name -> name.endsWith(".tmp"));
        }
    }

    @Test
    void should_ReportPointerFailure_InsteadOfThrowing() {
        assertThat(manager.updateCurrentPointer(root.resolve("missing-project"), 1)).isFalse();
    }

    @Test
    void should_FailAllocation_When_ProjectPathIsAFile() throws IOException {
        Files.writeString(root.resolve("taken"), "file");

        assertThatThrownBy(() -> manager.allocateVersion(root.resolve("taken")))
            .isInstanceOf(BuildStructureException.class);
    }
}
