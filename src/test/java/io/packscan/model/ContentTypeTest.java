package io.packscan.model;

import io.packscan.TestArchives;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ContentTypeTest {

    @TempDir
    Path tempDir;

    @Test
    void detect_recognizesArchivesByContent() throws IOException {
        Path zip = TestArchives.zip(tempDir.resolve("renamed.bin"), Map.of("a.txt", "a"));
        Path tgz = TestArchives.tarGz(tempDir.resolve("pkg.tar.gz"), Map.of("a.txt", "a"));
        Path tbz = TestArchives.tarBz2(tempDir.resolve("pkg"), Map.of("a.txt", "a"));

        assertThat(ContentType.detect(zip)).isEqualTo(ContentType.ZIP);
        assertThat(ContentType.detect(tgz)).isEqualTo(ContentType.GZIP_TAR);
        assertThat(ContentType.detect(tbz)).isEqualTo(ContentType.BZIP2_TAR);
    }

    @Test
    void detect_plainFilesDirectoriesAndMissingPaths() throws IOException {
        Path text = Files.writeString(tempDir.resolve("setup.py"), "print('hello')\n");
        Path empty = Files.createFile(tempDir.resolve("empty"));

        assertThat(ContentType.detect(text)).isEqualTo(ContentType.UNSUPPORTED);
        assertThat(ContentType.detect(empty)).isEqualTo(ContentType.UNSUPPORTED);
        assertThat(ContentType.detect(tempDir)).isEqualTo(ContentType.DIRECTORY);
        assertThat(ContentType.detect(tempDir.resolve("missing"))).isEqualTo(ContentType.UNSUPPORTED);
    }

    @Test
    void isArchive_onlyForUnpackableTypes() {
        assertThat(ContentType.ZIP.isArchive()).isTrue();
        assertThat(ContentType.GZIP_TAR.isArchive()).isTrue();
        assertThat(ContentType.BZIP2_TAR.isArchive()).isTrue();
        assertThat(ContentType.DIRECTORY.isArchive()).isFalse();
        assertThat(ContentType.UNSUPPORTED.isArchive()).isFalse();
        assertThat(ContentType.ZIP.mimeType()).isEqualTo("application/zip");
    }
}
