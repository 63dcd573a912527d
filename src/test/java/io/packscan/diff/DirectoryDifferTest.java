package io.packscan.diff;

import io.packscan.model.ScanLocation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DirectoryDifferTest {

    @TempDir
    Path tempDir;

    private final DirectoryDiffer differ = new DirectoryDiffer();

    private Path tree(String name, String... pathsAndContents) throws IOException {
        Path root = Files.createDirectory(tempDir.resolve(name));
        for (int i = 0; i < pathsAndContents.length; i += 2) {
            Path file = root.resolve(pathsAndContents[i]);
            Files.createDirectories(file.getParent());
            Files.writeString(file, pathsAndContents[i + 1]);
        }
        return root;
    }

    @Test
    void diff_reportsAddedDeletedAndModifiedInPathOrder() throws IOException {
        Path a = tree("a", "same.txt", "1", "changed.txt", "old", "lib/gone.py", "x");
        Path b = tree("b", "same.txt", "1", "changed.txt", "new", "lib/new.py", "y");

        List<DiffEntry> entries = differ.diff(ScanLocation.of(a), ScanLocation.of(b), "");

        assertThat(entries).extracting(DiffEntry::toString)
                .containsExactly("M changed.txt", "D lib/gone.py", "A lib/new.py");
        DiffEntry modified = entries.get(0);
        assertThat(modified.contentChanged()).isTrue();
        assertThat(modified.aPath()).isEqualTo(a.resolve("changed.txt"));
        assertThat(modified.bPath()).isEqualTo(b.resolve("changed.txt"));
        assertThat(entries.get(1).bPath()).isNull();
        assertThat(entries.get(2).aMd5()).isNull();
        assertThat(entries.get(2).contentChanged()).isFalse();
    }

    @Test
    void diff_identicalTreesProduceNothing() throws IOException {
        Path a = tree("a", "x/y.txt", "same");
        Path b = tree("b", "x/y.txt", "same");

        assertThat(differ.diff(ScanLocation.of(a), ScanLocation.of(b), "")).isEmpty();
    }

    @Test
    void diff_singleFilesWithDifferentNamesAreRenamed() throws IOException {
        Path a = Files.writeString(tempDir.resolve("pkg-1.0.zip"), "one");
        Path b = Files.writeString(tempDir.resolve("pkg-1.1.zip"), "two");

        List<DiffEntry> entries = differ.diff(ScanLocation.of(a), ScanLocation.of(b), "");

        assertThat(entries).singleElement().satisfies(entry -> {
            assertThat(entry.operation()).isEqualTo(DiffOperation.RENAMED);
            assertThat(entry.toString()).isEqualTo("R pkg-1.0.zip -> pkg-1.1.zip");
            assertThat(entry.contentChanged()).isTrue();
        });
    }

    @Test
    void diff_prefixIsPrependedToNames() throws IOException {
        Path a = tree("a", "f.txt", "1");
        Path b = tree("b", "f.txt", "2");

        List<DiffEntry> entries = differ.diff(ScanLocation.of(a), ScanLocation.of(b), "pkg.zip!/");

        assertThat(entries).extracting(DiffEntry::name).containsExactly("pkg.zip!/f.txt");
    }

    @Test
    void md5_isHexOfContent() throws IOException {
        Path file = Files.writeString(tempDir.resolve("abc"), "abc");

        assertThat(DiffEntry.md5(file)).isEqualTo("900150983cd24fb0d6963f7d28e17f72");
    }
}
