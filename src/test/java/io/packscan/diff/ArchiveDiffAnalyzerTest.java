package io.packscan.diff;

import io.packscan.ScanConfig;
import io.packscan.TestArchives;
import io.packscan.archive.EntryClassifier;
import io.packscan.model.Finding;
import io.packscan.model.ScanItem;
import io.packscan.model.ScanLocation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class ArchiveDiffAnalyzerTest {

    @TempDir
    Path tempDir;

    private final ArchiveDiffAnalyzer analyzer = new ArchiveDiffAnalyzer(ScanConfig.defaults());

    @Test
    void diff_unchangedArchiveIsNotUnpacked() throws IOException {
        Path a = Files.createDirectory(tempDir.resolve("a"));
        Path b = Files.createDirectory(tempDir.resolve("b"));
        TestArchives.zip(a.resolve("pkg.zip"), Map.of("../evil.txt", "x"));
        Files.copy(a.resolve("pkg.zip"), b.resolve("pkg.zip"));
        Files.writeString(a.resolve("setup.py"), "version = 1");
        Files.writeString(b.resolve("setup.py"), "version = 2");

        DiffReport report = analyzer.diff(ScanLocation.of(a), ScanLocation.of(b));

        assertThat(report.changes()).containsExactly("M setup.py");
        assertThat(report.findings()).isEmpty();
    }

    @Test
    void diff_recursesIntoModifiedArchivesAndReportsBothSides() throws IOException {
        Path a = Files.createDirectory(tempDir.resolve("a"));
        Path b = Files.createDirectory(tempDir.resolve("b"));
        TestArchives.zip(a.resolve("pkg.zip"), Map.of("module.py", "x = 1"));
        Map<String, String> newer = new LinkedHashMap<>();
        newer.put("module.py", "x = 2");
        newer.put("added.py", "y = 1");
        newer.put("../escape.txt", "z");
        TestArchives.zip(b.resolve("pkg.zip"), newer);

        DiffReport report = analyzer.diff(ScanLocation.of(a), ScanLocation.of(b));

        assertThat(report.changes()).containsExactly(
                "M pkg.zip",
                "A pkg.zip!/added.py",
                "M pkg.zip!/module.py");
        assertThat(report.findings()).singleElement().satisfies(finding -> {
            assertThat(finding.name()).isEqualTo(EntryClassifier.SUSPICIOUS_ENTRY);
            assertThat(finding.location()).isEqualTo(b.resolve("pkg.zip").toString());
        });
    }

    @Test
    void diff_renamedTopLevelArchives() throws IOException {
        Path a = TestArchives.tarGz(tempDir.resolve("pkg-1.0.tar.gz"), Map.of("pkg/version.txt", "1.0"));
        Path b = TestArchives.tarGz(tempDir.resolve("pkg-1.1.tar.gz"), Map.of("pkg/version.txt", "1.1"));

        DiffReport report = analyzer.diff(ScanLocation.of(a), ScanLocation.of(b));

        assertThat(report.changes()).containsExactly(
                "R pkg-1.0.tar.gz -> pkg-1.1.tar.gz",
                "M pkg-1.0.tar.gz -> pkg-1.1.tar.gz!/pkg/version.txt");
    }

    @Test
    void analyze_pairsUnpackedSidesAndFallsBackToRawFile() throws IOException {
        Path a = Files.writeString(tempDir.resolve("old.bin"), "not an archive");
        Path b = TestArchives.zip(tempDir.resolve("new.zip"), Map.of("x.txt", "x"));
        ScanLocation aRoot = ScanLocation.of(tempDir);
        ScanLocation bRoot = ScanLocation.of(tempDir);
        DiffEntry entry = new DiffEntry(DiffOperation.RENAMED, "old.bin -> new.zip", a, b, aRoot, bRoot,
                DiffEntry.md5(a), DiffEntry.md5(b));

        List<ScanItem> items;
        try (Stream<ScanItem> stream = analyzer.analyze(entry)) {
            items = stream.toList();
        }

        assertThat(items).singleElement().isInstanceOfSatisfying(ScanLocation.class, pairA -> {
            assertThat(pairA.path()).isEqualTo(a);
            ScanLocation pairB = pairA.pairedLocation().orElseThrow();
            assertThat(pairB.path()).isDirectory();
            assertThat(pairB.path().resolve("x.txt")).exists();
            assertThat(pairB.depth()).isEqualTo(1);

            Path extracted = pairB.path();
            ArchiveDiffAnalyzer.releasePair(pairA);
            assertThat(extracted).doesNotExist();
        });
        aRoot.release();
        bRoot.release();
        assertThat(aRoot.isReleased()).isTrue();
        assertThat(bRoot.isReleased()).isTrue();
    }

    @Test
    void analyze_skipsAddedDeletedAndUnchangedEntries() throws IOException {
        Path file = Files.writeString(tempDir.resolve("f.zip"), "x");
        ScanLocation root = ScanLocation.of(tempDir);
        String md5 = DiffEntry.md5(file);

        List<DiffEntry> entries = List.of(
                new DiffEntry(DiffOperation.ADDED, "f.zip", null, file, null, root, null, md5),
                new DiffEntry(DiffOperation.DELETED, "f.zip", file, null, root, null, md5, null),
                new DiffEntry(DiffOperation.MODIFIED, "f.zip", file, file, root, root, md5, md5));

        for (DiffEntry entry : entries) {
            try (Stream<ScanItem> stream = analyzer.analyze(entry)) {
                assertThat(stream.toList()).isEmpty();
            }
        }
        root.release();
        assertThat(root.isReleased()).isTrue();
    }

    @Test
    void diff_findingsFromBothSidesAreMerged() throws IOException {
        Path a = Files.createDirectory(tempDir.resolve("a"));
        Path b = Files.createDirectory(tempDir.resolve("b"));
        TestArchives.zip(a.resolve("pkg.zip"), Map.of("/abs.txt", "1"));
        TestArchives.zip(b.resolve("pkg.zip"), Map.of("/abs.txt", "2", "ok.txt", "fine"));

        DiffReport report = analyzer.diff(ScanLocation.of(a), ScanLocation.of(b));

        assertThat(report.findings()).extracting(Finding::location).containsExactly(
                a.resolve("pkg.zip").toString(), b.resolve("pkg.zip").toString());
    }
}
