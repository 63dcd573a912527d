package io.packscan.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScanLocationTest {

    @TempDir
    Path tempDir;

    @Test
    void createChild_copiesMetadataWithoutPairing() throws IOException {
        Path file = Files.writeString(tempDir.resolve("a.txt"), "a");
        ScanLocation root = ScanLocation.of(tempDir);
        root.putMetadata("origin", "test");
        root.putMetadata(ScanLocation.PAIRED_LOCATION, ScanLocation.of(file));

        ScanLocation child = root.createChild(file, false);

        assertThat(child.metadata()).containsEntry("origin", "test")
                .containsEntry(ScanLocation.MIME, ContentType.UNSUPPORTED.mimeType())
                .doesNotContainKey(ScanLocation.PAIRED_LOCATION);
        assertThat(child.parent()).containsSame(root);
        assertThat(child.depth()).isZero();
        assertThat(root.metadata()).containsEntry(ScanLocation.MIME, ContentType.DIRECTORY.mimeType());
    }

    @Test
    void createChild_ownedChildIsOneLevelDeeper() throws IOException {
        Path dir = Files.createDirectory(tempDir.resolve("extracted"));
        ScanLocation root = ScanLocation.of(tempDir);

        ScanLocation child = root.createChild(dir, true);

        assertThat(child.depth()).isEqualTo(1);
        assertThat(child.cleanup()).isTrue();
        assertThat(child.contentType()).isEqualTo(ContentType.DIRECTORY);
    }

    @Test
    void release_deletesOwnedDirectoryOnLastReference() throws IOException {
        Path dir = Files.createDirectory(tempDir.resolve("extracted"));
        Files.writeString(Files.createDirectories(dir.resolve("nested")).resolve("file.txt"), "x");
        ScanLocation root = ScanLocation.of(tempDir);
        ScanLocation owned = root.createChild(dir, true);
        ScanLocation grandchild = owned.createChild(dir.resolve("nested/file.txt"), false);

        owned.release();
        assertThat(dir).exists();
        assertThat(owned.isReleased()).isFalse();

        grandchild.release();
        assertThat(dir).doesNotExist();
        assertThat(owned.isReleased()).isTrue();
        assertThat(root.isReleased()).isFalse();

        root.release();
        assertThat(root.isReleased()).isTrue();
        assertThat(tempDir).exists();
    }

    @Test
    void release_cleansUpExactlyOnce() throws IOException {
        Path dir = Files.createDirectory(tempDir.resolve("extracted"));
        ScanLocation owned = ScanLocation.of(tempDir).createChild(dir, true);
        owned.retain();

        owned.release();
        assertThat(dir).exists();
        owned.release();
        assertThat(dir).doesNotExist();

        Files.createDirectory(dir);
        assertThatThrownBy(owned::release).isInstanceOf(IllegalStateException.class);
        assertThat(dir).exists();
    }

    @Test
    void retain_afterReleaseFails() {
        ScanLocation location = ScanLocation.of(tempDir);
        location.release();

        assertThatThrownBy(location::retain).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> location.createChild(tempDir, false)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void pairedLocation_onlyForLocationValues() {
        ScanLocation a = ScanLocation.of(tempDir);
        ScanLocation b = ScanLocation.of(tempDir);

        assertThat(a.pairedLocation()).isEmpty();
        a.putMetadata(ScanLocation.PAIRED_LOCATION, "not a location");
        assertThat(a.pairedLocation()).isEmpty();
        a.putMetadata(ScanLocation.PAIRED_LOCATION, b);
        assertThat(a.pairedLocation()).containsSame(b);
    }
}
